package com.questrail.rotator.observability;

import com.questrail.rotator.protocol.AsciiText;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing one message crossing a session boundary, or one
 * classification decision.
 *
 * @param payload message text, unescaped; use {@link #escapedPayload()} for display
 */
public record TrafficEvent(
    Instant timestamp,
    String sessionId,
    Direction direction,
    Peer peer,
    String payload
) {
    public TrafficEvent {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(peer, "peer");
        Objects.requireNonNull(payload, "payload");
    }

    /** What happened to the message. */
    public enum Direction {
        /** Read from the client. */
        RECEIVED,
        /** Client input classified. */
        PARSED,
        /** Written to the device. */
        SENT,
        /** Read from the device. */
        RESPONSE,
        /** Written back to the client. */
        REPLIED
    }

    /** Which side of the translator the message belongs to. */
    public enum Peer {
        CLIENT,
        DEVICE,
        TRANSLATOR
    }

    public String escapedPayload() {
        return AsciiText.escape(payload);
    }
}
