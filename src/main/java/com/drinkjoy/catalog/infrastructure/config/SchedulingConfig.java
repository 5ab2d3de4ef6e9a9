package com.drinkjoy.catalog.infrastructure.config;

import com.drinkjoy.catalog.domain.model.CatalogItem;
import com.drinkjoy.catalog.infrastructure.cache.ExpiringCache;
import com.drinkjoy.catalog.infrastructure.cache.VenueMenuCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.List;

@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Single thread: syncs never run concurrently on the timer
     */
    @Bean
    public ThreadPoolTaskScheduler catalogSyncTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("catalog-sync-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public ExpiringCache<String, List<CatalogItem>> catalogCache(Clock clock, CacheProperties cacheProperties) {
        return new ExpiringCache<>(clock, cacheProperties.getDefaultTtl());
    }

    @Bean
    public VenueMenuCache venueMenuCache(Clock clock, CacheProperties cacheProperties) {
        return new VenueMenuCache(clock, cacheProperties.getMenuCapacity(), cacheProperties.getMenuTtl());
    }
}
