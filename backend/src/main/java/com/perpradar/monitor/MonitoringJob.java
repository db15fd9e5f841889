package com.perpradar.monitor;

import com.perpradar.config.SchedulerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Schedules {@link MonitoringCycle} on the monitor scheduler once the application is ready.
 */
@Component
@Slf4j
public class MonitoringJob {

    private final MonitoringCycle monitoringCycle;
    private final TaskScheduler taskScheduler;
    private final JitteredDelayTrigger trigger;
    private final MonitorProperties properties;

    public MonitoringJob(MonitoringCycle monitoringCycle,
                         @Qualifier(SchedulerConfig.MONITOR_SCHEDULER) TaskScheduler taskScheduler,
                         JitteredDelayTrigger trigger,
                         MonitorProperties properties) {
        this.monitoringCycle = monitoringCycle;
        this.taskScheduler = taskScheduler;
        this.trigger = trigger;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isEnabled()) {
            log.info("Monitoring disabled");
            return;
        }
        taskScheduler.schedule(this::runCycle, trigger);
        log.info("Monitoring scheduled every {} ms (+ up to {} ms jitter)",
                properties.getPollIntervalMs(), properties.getMaxJitterMs());
    }

    void runCycle() {
        try {
            monitoringCycle.runOnce();
        } catch (Exception e) {
            log.error("Monitoring cycle failed", e);
        }
    }
}
