package com.example.rittdoc.service.validation;

import com.example.rittdoc.config.ConversionConfig;
import com.example.rittdoc.exception.SchemaValidationUnavailableException;
import com.example.rittdoc.xml.DocBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Provides the RittDoc DTD as a file: the configured one when set, otherwise the copy bundled on the classpath.
 * A configured DTD brings along the {@code .dtd}, {@code .mod} and {@code .ent} files next to it, which a
 * modular grammar pulls in through parameter entities.
 */
@Component
public class SchemaLocator {

    private static final Logger logger = LoggerFactory.getLogger(SchemaLocator.class);

    private static final Pattern DTD_MODULE = Pattern.compile("(?i).*\\.(dtd|mod|ent)$");

    private final ConversionConfig conversionConfig;

    @Autowired
    public SchemaLocator(ConversionConfig conversionConfig) {
        this.conversionConfig = conversionConfig;
    }

    /**
     * Makes the DTD available under {@code workDir/RITTDOCdtd/v1.1/} and returns its path.
     *
     * @throws SchemaValidationUnavailableException when neither a configured nor a bundled DTD can be found
     */
    public Path locate(Path workDir) {
        Path configured = conversionConfig.getDtdPath();
        Path target = workDir.resolve(DocBook.DTD_SYSTEM_ID);
        try {
            Files.createDirectories(target.getParent());
            if (configured != null) {
                if (!Files.isRegularFile(configured)) {
                    throw new SchemaValidationUnavailableException("Configured DTD not found: " + configured);
                }
                int modules = copyModules(configured, target.getParent());
                Files.copy(configured, target, StandardCopyOption.REPLACE_EXISTING);
                logger.debug("Using configured DTD {} with {} sibling files", configured, modules);
                return target;
            }
            ClassPathResource bundled = new ClassPathResource(DocBook.DTD_SYSTEM_ID);
            if (!bundled.exists()) {
                throw new SchemaValidationUnavailableException("No DTD configured and none bundled at " + DocBook.DTD_SYSTEM_ID);
            }
            try (InputStream in = bundled.getInputStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Using bundled DTD {}", DocBook.DTD_SYSTEM_ID);
            return target;
        } catch (IOException e) {
            throw new SchemaValidationUnavailableException("Could not provide DTD in " + workDir + ": " + e.getMessage(), e);
        }
    }

    private static int copyModules(Path configured, Path targetDir) throws IOException {
        Path sourceDir = configured.toAbsolutePath().getParent();
        List<Path> modules;
        try (Stream<Path> files = Files.list(sourceDir)) {
            modules = files.filter(Files::isRegularFile)
                    .filter(f -> DTD_MODULE.matcher(f.getFileName().toString()).matches())
                    .collect(Collectors.toList());
        }
        for (Path module : modules) {
            Files.copy(module, targetDir.resolve(module.getFileName().toString()), StandardCopyOption.REPLACE_EXISTING);
        }
        return modules.size();
    }
}
