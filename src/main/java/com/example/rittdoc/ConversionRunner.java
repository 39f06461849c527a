package com.example.rittdoc;

import com.example.rittdoc.config.ConversionConfig;
import com.example.rittdoc.model.ConversionResult;
import com.example.rittdoc.model.JobStatus;
import com.example.rittdoc.service.conversion.AsyncConversionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command-line entry point: {@code --input=<book.pdf|book.epub> [--output=<dir>]}.
 * Without {@code --input} the application starts and does nothing.
 */
@Component
public class ConversionRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(ConversionRunner.class);

    @Autowired
    private AsyncConversionService asyncConversionService;

    @Autowired
    private ConversionConfig conversionConfig;

    private JobStatus lastStatus;

    @Override
    public void run(ApplicationArguments args) {
        List<String> inputs = args.getOptionValues("input");
        if (inputs == null || inputs.isEmpty()) {
            logger.debug("No --input given, nothing to convert");
            return;
        }
        List<String> outputs = args.getOptionValues("output");
        Path outputDir = outputs == null || outputs.isEmpty()
                ? conversionConfig.getOutputDir() : Paths.get(outputs.get(0));

        for (String input : inputs) {
            lastStatus = runJob(Paths.get(input), outputDir);
        }
    }

    private JobStatus runJob(Path source, Path outputDir) {
        long timeout = conversionConfig.getJobTimeoutSeconds();
        CompletableFuture<ConversionResult> job = asyncConversionService.convertAsync(source, outputDir);
        try {
            ConversionResult result = job.get(timeout, TimeUnit.SECONDS);
            logger.info("{}: {} -> {}", result.getSourceName(), result.getStatus(), result.getArchivePath());
            if (result.getFailureReason() != null) {
                logger.error("{}: {}", result.getSourceName(), result.getFailureReason());
            }
            return result.getStatus();
        } catch (TimeoutException e) {
            job.cancel(true);
            logger.error("Conversion of {} exceeded {} seconds and was abandoned", source.getFileName(), timeout);
            return JobStatus.FAILED;
        } catch (ExecutionException e) {
            logger.error("Conversion of {} failed: {}", source.getFileName(), e.getCause().getMessage(), e.getCause());
            return JobStatus.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while waiting for conversion of {}", source.getFileName());
            return JobStatus.FAILED;
        }
    }

    /**
     * Status of the last job run from the command line, or {@code null} when none ran.
     */
    public JobStatus getLastStatus() {
        return lastStatus;
    }
}
