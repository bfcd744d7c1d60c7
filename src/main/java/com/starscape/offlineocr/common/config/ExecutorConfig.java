package com.starscape.offlineocr.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools for job execution and artifact fetching.
 * 
 * Jobs run on a bounded pool: at most app.processing.max-concurrent-jobs documents are
 * recognized at once and at most app.processing.max-queued-jobs wait in the pool's queue.
 * Jobs the pool rejects stay PENDING until the admission loop hands them over again. Fetches get their own pool so a fetch shared
 * by several jobs keeps running when the job that started it is cancelled.
 */
@Configuration
public class ExecutorConfig {
    
    @Bean(name = "ocrJobExecutor")
    public ThreadPoolTaskExecutor ocrJobExecutor(ProcessingProperties processingProperties) {
        int workers = Math.max(1, processingProperties.getMaxConcurrentJobs());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Math.max(0, processingProperties.getMaxQueuedJobs()));
        executor.setThreadNamePrefix("ocr-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
    
    @Bean(name = "artifactFetchExecutor")
    public ThreadPoolTaskExecutor artifactFetchExecutor(ArtifactProperties artifactProperties) {
        int workers = Math.max(1, artifactProperties.getFetchPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("artifact-fetch-");
        executor.initialize();
        return executor;
    }
}
