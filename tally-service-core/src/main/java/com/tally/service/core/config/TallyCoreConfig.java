package com.tally.service.core.config;

import com.tally.service.core.calendar.TallyCalendar;
import com.tally.service.core.scheduler.LoggingCronErrorHandler;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.util.ErrorHandler;

@Configuration
public class TallyCoreConfig {

    @Bean
    public Clock systemUtcClock() {
        return Clock.systemUTC();
    }

    @Bean
    public TallyCalendar tallyCalendar(TallyProperties properties) {
        return new TallyCalendar(properties.getCalendar().getDayOffset());
    }

    /** Single thread: cron callbacks never overlap, across all registered schedules. */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler cronTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("tally-cron-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    /** Used by {@code @Scheduled} maintenance such as the counter buffer flush. */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("tally-maint-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public ErrorHandler cronErrorHandler() {
        return new LoggingCronErrorHandler();
    }
}
