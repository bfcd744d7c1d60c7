package com.starscape.offlineocr.common.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorConfigTest {
    
    private final CountDownLatch release = new CountDownLatch(1);
    private ThreadPoolTaskExecutor executor;
    
    @AfterEach
    void tearDown() {
        release.countDown();
        if (executor != null) {
            executor.shutdown();
        }
    }
    
    @Test
    void jobExecutorShouldRejectOnceWorkersAndQueueAreFull() throws Exception {
        ProcessingProperties properties = new ProcessingProperties();
        properties.setMaxConcurrentJobs(1);
        properties.setMaxQueuedJobs(1);
        executor = new ExecutorConfig().ocrJobExecutor(properties);
        
        CountDownLatch started = new CountDownLatch(1);
        executor.execute(() -> {
            started.countDown();
            awaitRelease();
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        executor.execute(this::awaitRelease);
        
        assertThrows(RejectedExecutionException.class, () -> executor.execute(this::awaitRelease));
        assertEquals(1, executor.getThreadPoolExecutor().getQueue().size());
    }
    
    private void awaitRelease() {
        try {
            release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
