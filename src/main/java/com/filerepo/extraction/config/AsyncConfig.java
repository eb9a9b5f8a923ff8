package com.filerepo.extraction.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Whole-file runs and the per-page model calls they fan out use separate executors.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "indexingTaskExecutor")
    public Executor indexingTaskExecutor(@Value("${app.indexing.max-concurrent-files:4}") int concurrentFiles) {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("index-run-");
        executor.setConcurrencyLimit(concurrentFiles);
        return executor;
    }

    // unbounded queue: submitting page tasks never blocks
    @Bean(name = "pageTaskExecutor")
    public ThreadPoolTaskExecutor pageTaskExecutor(@Value("${app.indexing.max-concurrent-pages:8}") int concurrentPages) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("index-page-");
        executor.setCorePoolSize(concurrentPages);
        executor.setMaxPoolSize(concurrentPages);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
