package com.clausescan.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool used by comparison and ranking to analyze documents in parallel.
 * Worker threads inherit the caller's MDC so log lines keep the request id.
 */
@Configuration
public class AnalysisExecutorConfig {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisExecutorConfig.class);

    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor(
            @Value("${clausescan.executor.core-pool-size:4}") int corePoolSize,
            @Value("${clausescan.executor.max-pool-size:8}") int maxPoolSize,
            @Value("${clausescan.executor.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("analysis-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        logger.info("Analysis executor configured: core={}, max={}, queue={}", corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }
}
