package com.perpradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single-thread scheduler for the monitoring job. One thread keeps cycles strictly sequential;
 * on shutdown a running cycle is allowed to drain.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String MONITOR_SCHEDULER = "monitor-scheduler";

    @Bean(name = MONITOR_SCHEDULER)
    public ThreadPoolTaskScheduler monitorScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("monitor-");
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(300);
        s.initialize();
        return s;
    }
}
