package com.perpradar.bot;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Bot module configuration: properties and the Caffeine cache holding per-chat session state.
 */
@Configuration
@EnableConfigurationProperties(BotProperties.class)
public class BotConfig {

    public static final String CHAT_SESSION_CACHE = "chatSessionCache";

    @Bean
    public CacheManager caffeineCacheManager(BotProperties properties) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(CHAT_SESSION_CACHE, Caffeine.newBuilder()
                .expireAfterAccess(Math.max(1, properties.getSessionTtlMinutes()), TimeUnit.MINUTES)
                .maximumSize(10_000)
                .build());
        return manager;
    }
}
