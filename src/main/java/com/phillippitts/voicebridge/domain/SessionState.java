package com.phillippitts.voicebridge.domain;

/**
 * Lifecycle of a streaming session. Transitions only move forward:
 * {@code ACTIVE -> DRAINING -> CLOSED}.
 */
public enum SessionState {
    ACTIVE,
    DRAINING,
    CLOSED
}
