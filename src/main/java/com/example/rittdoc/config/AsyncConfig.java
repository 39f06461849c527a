package com.example.rittdoc.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Value("${rittdoc.conversion.threads:2}")
    private int conversionThreads;

    @Value("${rittdoc.validation.threads:4}")
    private int validationThreads;

    @Bean(name = "conversionExecutor")
    public Executor conversionExecutor() {
        return executor("conversion-", conversionThreads);
    }

    /**
     * Per-chapter DTD validation pool. Chapters are independent, results are merged in chapter order.
     */
    @Bean(name = "validationExecutor")
    public Executor validationExecutor() {
        return executor("dtd-validation-", validationThreads);
    }

    private ThreadPoolTaskExecutor executor(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }
}
