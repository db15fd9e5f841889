package com.perpradar.monitor;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

@Configuration
@EnableConfigurationProperties(MonitorProperties.class)
public class MonitorConfig {

    @Bean
    public JitteredDelayTrigger monitorTrigger(MonitorProperties properties, Clock clock) {
        return new JitteredDelayTrigger(
                properties.getInitialDelayMs(),
                properties.getPollIntervalMs(),
                properties.getMaxJitterMs(),
                bound -> bound <= 0 ? 0L : ThreadLocalRandom.current().nextLong(bound + 1),
                clock);
    }
}
