package com.perpradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: the Telegram long-poll loop runs on its own single thread, concurrently with
 * the monitoring scheduler.
 */
@Configuration
public class AsyncConfig {

    public static final String TELEGRAM_POLLER_EXECUTOR = "telegram-poller-executor";

    @Bean(name = TELEGRAM_POLLER_EXECUTOR)
    public Executor telegramPollerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("telegram-poller-");
        e.initialize();
        return e;
    }
}
