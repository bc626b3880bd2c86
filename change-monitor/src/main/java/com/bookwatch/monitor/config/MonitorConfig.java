package com.bookwatch.monitor.config;

import com.bookwatch.monitor.service.ChangePolicy;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class MonitorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChangePolicy changePolicy(MonitorProperties properties) {
        return ChangePolicy.standard(properties.getDetection().getPriceChangeThreshold());
    }

    @Bean("detectionWorkerPool")
    public ThreadPoolTaskExecutor detectionWorkerPool(MonitorProperties properties) {
        int threads = Math.max(1, properties.getDetection().getConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(1, properties.getDetection().getBatchSize()) * 2);
        // A full queue runs the item on the submitting thread instead of dropping it.
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("DetectWorker-");
        executor.initialize();
        return executor;
    }

    /** Retry for fingerprint and change-log calls; tuned under resilience4j.retry.instances.monitorStore. */
    @Bean("monitorStoreRetry")
    public Retry monitorStoreRetry(RetryRegistry retryRegistry) {
        return retryRegistry.retry("monitorStore");
    }
}
