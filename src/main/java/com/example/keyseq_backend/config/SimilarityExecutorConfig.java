package com.example.keyseq_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Provides the thread pool used by
 * {@link com.example.keyseq_backend.service.similarity.PairwiseSimilarityMatrixProvider} to run a
 * group of single-pair lookups concurrently.
 */
@Configuration
public class SimilarityExecutorConfig {

    @Bean(name = "similarityTaskExecutor")
    public ThreadPoolTaskExecutor similarityTaskExecutor(SimilarityProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(properties.getFallbackThreads(), properties.getFallbackGroupSize());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(50, properties.getFallbackGroupSize() * 4));
        executor.setThreadNamePrefix("similarity-");
        // concurrent sessions may exceed the queue, run the overflow on the caller
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
