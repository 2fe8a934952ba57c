package com.questrail.rotator.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in a translator session.
 *
 * @param fatal {@code true} if the error ends the session
 */
public record TranslatorErrorEvent(
    Instant timestamp,
    String sessionId,
    String message,
    Throwable cause,
    boolean fatal
) {
}
