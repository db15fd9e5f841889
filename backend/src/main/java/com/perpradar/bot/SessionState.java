package com.perpradar.bot;

/**
 * Per-chat conversation state. Anything but IDLE means the next plain-text message is an answer.
 */
public enum SessionState {
    IDLE,
    AWAITING_ADDRESS,
    AWAITING_REMOVAL_INDEX
}
