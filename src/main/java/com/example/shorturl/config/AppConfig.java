package com.example.shorturl.config;

import com.example.shorturl.ratelimit.SlidingWindowRateLimiter;
import com.example.shorturl.task.BackgroundTasks;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskExecutor backgroundTaskExecutor(ShortUrlProperties properties) {
        ShortUrlProperties.Background cfg = properties.getBackground();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getCorePoolSize());
        executor.setMaxPoolSize(cfg.getMaxPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("bg-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    // Shared by @Scheduled jobs, the limiter sweeper and delayed cache evictions.
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public BackgroundTasks backgroundTasks(ThreadPoolTaskExecutor backgroundTaskExecutor,
                                           ThreadPoolTaskScheduler taskScheduler,
                                           MeterRegistry meterRegistry) {
        return new BackgroundTasks(backgroundTaskExecutor, taskScheduler, meterRegistry);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "app.rate-limit", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SlidingWindowRateLimiter rateLimiter(ShortUrlProperties properties, Clock clock,
                                                ThreadPoolTaskScheduler taskScheduler) {
        ShortUrlProperties.RateLimit cfg = properties.getRateLimit();
        return new SlidingWindowRateLimiter(cfg.getRequestsPerWindow(), cfg.getWindow(), cfg.getSweepInterval(),
                clock, taskScheduler);
    }
}
