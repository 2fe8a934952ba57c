package com.questrail.rotator.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.rotator.session.SessionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jTranslatorObservabilitySinkTest {

    private final Slf4jTranslatorObservabilitySink sink = new Slf4jTranslatorObservabilitySink();
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Logger logger;
    private Level originalLevel;
    private boolean originalAdditive;

    @BeforeEach
    void attach() {
        logger = (Logger) LoggerFactory.getLogger(Slf4jTranslatorObservabilitySink.class);
        originalLevel = logger.getLevel();
        originalAdditive = logger.isAdditive();
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        logger.setLevel(originalLevel);
        logger.setAdditive(originalAdditive);
        appender.stop();
    }

    @Test
    void trafficIsLoggedAtDebugWithEscapedPayload() {
        sink.onTraffic(new TrafficEvent(Instant.EPOCH, "session-7",
            TrafficEvent.Direction.SENT, TrafficEvent.Peer.DEVICE, "AP0035\r;"));

        List<ILoggingEvent> events = appender.list;
        assertEquals(1, events.size());
        assertEquals(Level.DEBUG, events.get(0).getLevel());
        assertEquals("[session-7] SENT DEVICE: 'AP0035\\r;'", events.get(0).getFormattedMessage());
    }

    @Test
    void stateTransitionsAreInfoAndAbortsAreWarn() {
        sink.onSessionStateTransition(new SessionStateTransitionEvent(Instant.EPOCH, "session-1",
            SessionState.CONNECTING, SessionState.ACTIVE));
        sink.onSessionStateTransition(new SessionStateTransitionEvent(Instant.EPOCH, "session-2",
            SessionState.CONNECTING, SessionState.CLOSED));

        List<ILoggingEvent> events = appender.list;
        assertEquals(2, events.size());
        assertEquals(Level.INFO, events.get(0).getLevel());
        assertEquals("[session-1] Session CONNECTING -> ACTIVE", events.get(0).getFormattedMessage());
        assertEquals(Level.WARN, events.get(1).getLevel());
        assertTrue(events.get(1).getFormattedMessage().contains("aborted"));
    }

    @Test
    void errorSeverityFollowsFatality() {
        IOException cause = new IOException("Broken pipe");
        sink.onError(new TranslatorErrorEvent(Instant.EPOCH, "session-3", "RT21 communication failed", cause, false));
        sink.onError(new TranslatorErrorEvent(Instant.EPOCH, "session-3", "Client handler error", null, true));

        List<ILoggingEvent> events = appender.list;
        assertEquals(Level.WARN, events.get(0).getLevel());
        assertNotNull(events.get(0).getThrowableProxy());
        assertEquals("[session-3] RT21 communication failed", events.get(0).getFormattedMessage());
        assertEquals(Level.ERROR, events.get(1).getLevel());
    }
}
