package com.example.rittdoc;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "rittdoc.output.dir=target/test-output")
class RittDocConverterApplicationTests {

    @Autowired
    private ConversionRunner conversionRunner;

    @Test
    void contextLoads() {
        assertThat(conversionRunner).isNotNull();
    }

    @Test
    void runnerWithoutInputDoesNothing() {
        conversionRunner.run(new DefaultApplicationArguments("--output=target/test-output"));

        assertThat(conversionRunner.getLastStatus()).isNull();
    }
}
