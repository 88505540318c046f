package com.example.docassembly.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import jakarta.annotation.PostConstruct;

/**
 * Settings for document assembly and the worker pool pages are assembled on.
 */
@Configuration
public class AssemblyConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AssemblyConfiguration.class);

    @Value("${assembly.match-threshold:0.6}")
    private double matchThreshold;

    @Value("${assembly.parallelism:1}")
    private int parallelism;

    @Value("${assembly.detection-origin:doctr}")
    private String detectionOrigin;

    @Value("${assembly.non-text-line-policy:DROP}")
    private String nonTextLinePolicy;

    @PostConstruct
    public void initialize() {
        logger.info("Document assembly configured");
        logger.info("   - Match threshold: {}", matchThreshold);
        logger.info("   - Page parallelism: {}", parallelism);
        logger.info("   - Default detection origin: {}", detectionOrigin);
        logger.info("   - Non-text line policy: {}", nonTextLinePolicy);
    }

    @Bean(name = "pageAssemblyExecutor")
    public ThreadPoolTaskExecutor pageAssemblyExecutor() {
        int workers = Math.max(1, parallelism);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("page-assembly-");
        executor.initialize();
        return executor;
    }
}
