package com.gapfill.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class BackfillExecutorConfig {

    /**
     * Fails startup unless at least one known data type is configured.
     */
    @Bean
    public Subscription subscription(FetcherProperties properties) {
        return Subscription.from(properties);
    }

    @Bean(name = "backfillTaskExecutor")
    public ThreadPoolTaskExecutor backfillTaskExecutor(FetcherProperties properties) {
        FetcherProperties.BackfillProperties backfill = properties.getBackfill();
        int ceiling = backfill.resolveConcurrencyCeiling(Runtime.getRuntime().availableProcessors());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(ceiling);
        executor.setMaxPoolSize(ceiling);
        executor.setQueueCapacity(ceiling);
        executor.setThreadNamePrefix("backfill-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(backfill.getShutdownAwaitSeconds());
        return executor;
    }
}
