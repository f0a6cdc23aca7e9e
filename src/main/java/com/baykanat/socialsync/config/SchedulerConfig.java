package com.baykanat.socialsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/** Cron işleri için task scheduler ve zaman kaynağı. */
@Slf4j
@Configuration
public class SchedulerConfig {

    /** İş başına bir thread; kapanışta çalışan işlerin bitmesi 30 sn beklenir. */
    @Bean
    public ThreadPoolTaskScheduler syncTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(5);
        scheduler.setThreadNamePrefix("sync-job-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.setErrorHandler(t -> log.error("Unhandled error in scheduled job: {}", t.getMessage(), t));
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
