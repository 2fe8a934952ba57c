package com.questrail.rotator.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TranslatorObservabilitySink that emits logs via SLF4J.
 *
 * <p>Traffic lines follow the layout operators know from the console tool,
 * e.g. {@code [session-1] RECEIVED CLIENT: 'M030'}, with control characters
 * shown escaped.</p>
 */
public final class Slf4jTranslatorObservabilitySink implements TranslatorObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTranslatorObservabilitySink.class);

    @Override
    public void onSessionStateTransition(SessionStateTransitionEvent event) {
        if (event.isAbort()) {
            log.warn("[{}] Session aborted: {} -> {}",
                event.sessionId(), event.oldState(), event.newState());
            return;
        }
        log.info("[{}] Session {} -> {}",
            event.sessionId(), event.oldState(), event.newState());
    }

    @Override
    public void onTraffic(TrafficEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("[{}] {} {}: '{}'",
                event.sessionId(),
                event.direction(),
                event.peer(),
                event.escapedPayload());
        }
    }

    @Override
    public void onError(TranslatorErrorEvent event) {
        if (event.fatal()) {
            log.error("[{}] {}", event.sessionId(), event.message(), event.cause());
        } else {
            log.warn("[{}] {}", event.sessionId(), event.message(), event.cause());
        }
    }
}
