package com.questrail.rotator.config;

import java.time.Duration;
import java.util.Objects;

/**
 * TranslatorTimingPolicy
 * -----------------------------------------------------------------------------
 * Timeouts applied to the device connection of each session.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b> - how long a session waits for the device
 *       connection before aborting.</li>
 *   <li><b>acknowledgementTimeout</b> - how long to wait for an (optional)
 *       device reply after a move or stop. Expiry is a normal outcome.</li>
 *   <li><b>queryTimeout</b> - how long to wait for a position reply.
 *       {@link Duration#ZERO} means no bound: an unresponsive device stalls the
 *       session until the socket is closed.</li>
 * </ul>
 */
public record TranslatorTimingPolicy(
        Duration connectTimeout,
        Duration acknowledgementTimeout,
        Duration queryTimeout
) {
    public TranslatorTimingPolicy {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(acknowledgementTimeout, "acknowledgementTimeout");
        Objects.requireNonNull(queryTimeout, "queryTimeout");

        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (acknowledgementTimeout.isNegative() || acknowledgementTimeout.isZero()) {
            throw new IllegalArgumentException("acknowledgementTimeout must be positive");
        }
        if (queryTimeout.isNegative()) {
            throw new IllegalArgumentException("queryTimeout must be non-negative");
        }
    }

    /**
     * Defaults matching deployed RT21 controllers:
     * <ul>
     *   <li>connectTimeout: 5s</li>
     *   <li>acknowledgementTimeout: 2s</li>
     *   <li>queryTimeout: unbounded</li>
     * </ul>
     */
    public static TranslatorTimingPolicy defaults() {
        return new TranslatorTimingPolicy(
                Duration.ofSeconds(5),
                Duration.ofSeconds(2),
                Duration.ZERO
        );
    }

    public boolean isQueryBounded() {
        return !queryTimeout.isZero();
    }

    public TranslatorTimingPolicy withQueryTimeout(Duration timeout) {
        return new TranslatorTimingPolicy(connectTimeout, acknowledgementTimeout, timeout);
    }
}
