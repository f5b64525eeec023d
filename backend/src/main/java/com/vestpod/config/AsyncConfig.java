package com.vestpod.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools: price-update-executor (users), quote-fetch-executor (asset classes of a user),
 * alert-check-executor (users). Sizes come from vestpod.price-update and vestpod.alerts.
 */
@Configuration
public class AsyncConfig {

    public static final String PRICE_UPDATE_EXECUTOR = "price-update-executor";
    public static final String QUOTE_FETCH_EXECUTOR = "quote-fetch-executor";
    public static final String ALERT_CHECK_EXECUTOR = "alert-check-executor";

    @Bean(name = PRICE_UPDATE_EXECUTOR)
    public ThreadPoolTaskExecutor priceUpdateExecutor(
            @Value("${vestpod.price-update.user-parallelism:4}") int userParallelism) {
        return pool(userParallelism, "price-update-");
    }

    /** Separate from the user pool so a user task waiting on its class fetches cannot starve them. */
    @Bean(name = QUOTE_FETCH_EXECUTOR)
    public ThreadPoolTaskExecutor quoteFetchExecutor(
            @Value("${vestpod.price-update.quote-fetch-parallelism:6}") int quoteFetchParallelism) {
        return pool(quoteFetchParallelism, "quote-fetch-");
    }

    @Bean(name = ALERT_CHECK_EXECUTOR)
    public ThreadPoolTaskExecutor alertCheckExecutor(
            @Value("${vestpod.alerts.user-parallelism:4}") int userParallelism) {
        return pool(userParallelism, "alert-check-");
    }

    private static ThreadPoolTaskExecutor pool(int size, String threadNamePrefix) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(Math.max(1, size));
        e.setMaxPoolSize(Math.max(1, size));
        e.setThreadNamePrefix(threadNamePrefix);
        e.initialize();
        return e;
    }
}
