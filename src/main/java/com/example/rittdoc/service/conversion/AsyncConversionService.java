package com.example.rittdoc.service.conversion;

import com.example.rittdoc.model.ConversionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Runs conversion jobs on the conversion executor so a caller can bound them with a timeout.
 */
@Service
public class AsyncConversionService {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConversionService.class);

    @Autowired
    private ConversionOrchestrationService orchestrationService;

    @Async("conversionExecutor")
    public CompletableFuture<ConversionResult> convertAsync(Path source, Path outputDir) {
        logger.info("Async thread started for {}", source.getFileName());
        try {
            return CompletableFuture.completedFuture(orchestrationService.convert(source, outputDir));
        } catch (RuntimeException e) {
            logger.error("Error in async conversion of {} ({}): {}",
                    source.getFileName(), e.getClass().getSimpleName(), e.getMessage(), e);
            return CompletableFuture.failedFuture(e);
        }
    }
}
