package com.questrail.rotator.translation;

import java.util.Objects;
import java.util.Optional;

/**
 * TranslationResult
 * -----------------------------------------------------------------------------
 * Outcome of forwarding one command to the rotator device.
 *
 * <ul>
 *   <li>{@link Position} - a query was answered with a heading</li>
 *   <li>{@link Acknowledged} - a move or stop was written to the device; any
 *       reply it sent is advisory and kept for diagnostics only</li>
 *   <li>{@link Failed} - the device could not be reached or did not produce a
 *       usable answer</li>
 * </ul>
 */
public sealed interface TranslationResult
{
    /**
     * Query answered. {@code degrees} is the device's reading as reported; it is
     * not limited to a compass heading or to three digits.
     */
    record Position(int degrees) implements TranslationResult {
        public Position {
            if (degrees < 0) {
                throw new IllegalArgumentException("degrees must be non-negative, got " + degrees);
            }
        }
    }

    /** Move/stop written; {@code reply} holds whatever the device sent back within the ack window. */
    record Acknowledged(Optional<String> reply) implements TranslationResult {
        public Acknowledged {
            Objects.requireNonNull(reply, "reply");
        }

        public static Acknowledged silent() {
            return new Acknowledged(Optional.empty());
        }
    }

    /** Forwarding failed. {@code cause} may be {@code null} for protocol-level failures. */
    record Failed(String reason, Throwable cause) implements TranslationResult {
        public Failed {
            Objects.requireNonNull(reason, "reason");
        }

        public Failed(String reason) {
            this(reason, null);
        }
    }

    default boolean isFailure() {
        return this instanceof Failed;
    }
}
