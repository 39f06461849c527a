package com.example.rittdoc.service.validation;

import com.example.rittdoc.config.ConversionConfig;
import com.example.rittdoc.exception.SchemaValidationUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SchemaLocatorTest {

    @TempDir
    Path tempDir;

    @Test
    void fallsBackToBundledDtd() throws Exception {
        Path dtd = new SchemaLocator(new ConversionConfig()).locate(tempDir);

        assertThat(dtd).isEqualTo(tempDir.resolve("RITTDOCdtd/v1.1/RittDocBook.dtd"));
        assertThat(Files.readString(dtd)).contains("<!ELEMENT book");
    }

    @Test
    void usesConfiguredDtd() throws Exception {
        Path custom = Files.writeString(tempDir.resolve("custom.dtd"), "<!ELEMENT book (#PCDATA)>\n");
        ConversionConfig config = new ConversionConfig();
        ReflectionTestUtils.setField(config, "dtdPath", custom.toString());

        Path dtd = new SchemaLocator(config).locate(tempDir.resolve("work"));

        assertThat(Files.readString(dtd)).isEqualTo("<!ELEMENT book (#PCDATA)>\n");
    }

    /**
     * Modules a configured grammar includes through parameter entities travel with it.
     */
    @Test
    void configuredDtdBringsItsModules() throws Exception {
        Path sourceDir = Files.createDirectories(tempDir.resolve("grammar"));
        Path main = Files.writeString(sourceDir.resolve("RittDocBook.dtd"),
                "<!ENTITY % pool SYSTEM \"dbpoolx.mod\">\n%pool;\n");
        Files.writeString(sourceDir.resolve("dbpoolx.mod"), "<!ELEMENT book (#PCDATA)>\n");
        Files.writeString(sourceDir.resolve("dbcent.ent"), "<!ENTITY copy \"&#169;\">\n");
        Files.writeString(sourceDir.resolve("README.txt"), "not part of the grammar");
        ConversionConfig config = new ConversionConfig();
        ReflectionTestUtils.setField(config, "dtdPath", main.toString());

        Path dtd = new SchemaLocator(config).locate(tempDir.resolve("work"));

        try (Stream<Path> files = Files.list(dtd.getParent())) {
            assertThat(files.map(f -> f.getFileName().toString()))
                    .containsExactlyInAnyOrder("RittDocBook.dtd", "dbpoolx.mod", "dbcent.ent");
        }
        assertThat(Files.readString(dtd)).contains("%pool;");
    }

    @Test
    void missingConfiguredDtdIsReported() {
        ConversionConfig config = new ConversionConfig();
        ReflectionTestUtils.setField(config, "dtdPath", tempDir.resolve("absent.dtd").toString());

        assertThrows(SchemaValidationUnavailableException.class,
                () -> new SchemaLocator(config).locate(tempDir.resolve("work")));
    }
}
