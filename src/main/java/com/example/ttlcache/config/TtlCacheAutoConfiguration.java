package com.example.ttlcache.config;

import com.example.ttlcache.core.LruTtlCache;
import com.example.ttlcache.core.TtlCache;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.task.TaskSchedulingAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Registers one {@link LruTtlCache} for the host application, with its
 * expiry sweep running on a dedicated single-thread scheduler. Ordered after
 * the task scheduling auto-configuration so that the reaper scheduler never
 * stands in for the application's own {@code taskScheduler}.
 */
@AutoConfiguration(after = TaskSchedulingAutoConfiguration.class)
@EnableConfigurationProperties(TtlCacheProperties.class)
@ConditionalOnProperty(prefix = "ttl-cache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TtlCacheAutoConfiguration {

    public static final String SCHEDULER_BEAN_NAME = "ttlCacheReaperScheduler";

    @Bean(name = SCHEDULER_BEAN_NAME)
    @ConditionalOnMissingBean(name = SCHEDULER_BEAN_NAME)
    public ThreadPoolTaskScheduler ttlCacheReaperScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("ttl-cache-reaper-");
        s.setDaemon(true);
        s.setRemoveOnCancelPolicy(true);
        return s;
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnMissingBean(TtlCache.class)
    public LruTtlCache<Object, Object> ttlCache(
        TtlCacheProperties properties,
        @Qualifier(SCHEDULER_BEAN_NAME) ThreadPoolTaskScheduler scheduler
    ) {
        return new LruTtlCache<>(
            properties.getCapacity(),
            Clock.systemUTC(),
            scheduler,
            properties.getSweepInterval(),
            properties.effectiveSweepBatchSize()
        );
    }
}
