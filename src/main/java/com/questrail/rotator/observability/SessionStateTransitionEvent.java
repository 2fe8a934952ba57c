package com.questrail.rotator.observability;

import com.questrail.rotator.session.SessionState;

import java.time.Instant;

/**
 * Record representing a lifecycle transition of one translator session.
 */
public record SessionStateTransitionEvent(
    Instant timestamp,
    String sessionId,
    SessionState oldState,
    SessionState newState
) {
    /**
     * True when the session reached {@link SessionState#CLOSED} without ever
     * becoming active (device connection failed).
     */
    public boolean isAbort() {
        return oldState == SessionState.CONNECTING && newState == SessionState.CLOSED;
    }
}
