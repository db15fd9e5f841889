package com.perpradar.bot;

import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Session state per chat. Entries expire after the configured idle time, which drops the chat back to IDLE.
 */
@Component
public class ChatSessions {

    private final Cache states;

    public ChatSessions(CacheManager cacheManager) {
        this.states = Objects.requireNonNull(cacheManager.getCache(BotConfig.CHAT_SESSION_CACHE),
                "cache " + BotConfig.CHAT_SESSION_CACHE + " not configured");
    }

    public SessionState stateOf(long chatId) {
        SessionState state = states.get(chatId, SessionState.class);
        return state != null ? state : SessionState.IDLE;
    }

    public void transition(long chatId, SessionState next) {
        if (next == SessionState.IDLE) {
            states.evict(chatId);
        } else {
            states.put(chatId, next);
        }
    }
}
