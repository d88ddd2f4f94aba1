package com.chaincustody.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * monitor-scheduler drives deposit monitor poll cycles; taskScheduler runs @Scheduled jobs (BroadcastTracker).
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "taskScheduler";
    public static final String MONITOR_SCHEDULER = "monitor-scheduler";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("scheduler-");
        s.initialize();
        return s;
    }

    @Bean(name = MONITOR_SCHEDULER)
    public ThreadPoolTaskScheduler monitorScheduler(
            @Value("${chaincustody.monitor.scheduler-pool-size:8}") int poolSize) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(Math.max(1, poolSize));
        s.setThreadNamePrefix("deposit-monitor-");
        s.setRemoveOnCancelPolicy(true);
        s.initialize();
        return s;
    }
}
