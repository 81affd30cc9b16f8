package com.venue.scout.recommender.config;

import com.venue.scout.recommender.common.constants.GeocodeProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for I/O bound provider calls.
 */
@Configuration
public class ExecutorConfig {

    /**
     * Fan-out of source adapter searches. Sized for a handful of adapters times concurrent requests.
     */
    @Bean(name = "sourceExecutor")
    public ThreadPoolTaskExecutor sourceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("SourceSearch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Geocoding runs N at a time against a rate-limited provider.
     */
    @Bean(name = "geocodeExecutor")
    public ThreadPoolTaskExecutor geocodeExecutor(GeocodeProperties props) {
        int n = Math.max(1, props.getPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(n);
        executor.setMaxPoolSize(n);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("Geocode-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
