package com.questrail.rotator.observability;

/**
 * Main interface for receiving translator observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on session threads; implementations shared between
 * sessions must be thread-safe.</p>
 */
public interface TranslatorObservabilitySink {
    /**
     * Called when a session changes lifecycle state.
     * @param event the transition event details
     */
    void onSessionStateTransition(SessionStateTransitionEvent event);

    /**
     * Called for every message read from or written to either peer, and for each
     * command classification.
     * @param event the traffic event
     */
    void onTraffic(TrafficEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(TranslatorErrorEvent event);
}
