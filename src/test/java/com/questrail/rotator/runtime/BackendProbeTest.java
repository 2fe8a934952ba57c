package com.questrail.rotator.runtime;

import com.questrail.rotator.config.TranslatorTimingPolicy;
import com.questrail.rotator.transport.FakeBackendLink;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BackendProbeTest {

    private final TranslatorTimingPolicy timing = TranslatorTimingPolicy.defaults();

    @Test
    void reportsPositionFromResponsiveDevice() {
        FakeBackendLink link = new FakeBackendLink().replyWith("045;\r\n");

        Optional<String> result = new BackendProbe(() -> link, timing).probe();

        assertEquals(Optional.of("045;"), result);
        assertEquals(1, link.connectCount());
        assertEquals("AI1\r;", link.sent().get(0));
        assertEquals(timing.connectTimeout(), link.readTimeouts().get(0));
        assertEquals(1, link.closeCount());
    }

    @Test
    void silentDeviceYieldsEmpty() {
        FakeBackendLink link = new FakeBackendLink().closeByDevice();

        assertTrue(new BackendProbe(() -> link, timing).probe().isEmpty());
        assertEquals(1, link.closeCount());
    }

    @Test
    void readTimeoutYieldsEmpty() {
        FakeBackendLink link = new FakeBackendLink().timeoutNextRead();

        assertTrue(new BackendProbe(() -> link, timing).probe().isEmpty());
        assertEquals(1, link.closeCount());
    }

    @Test
    void unreachableDeviceYieldsEmptyAndStillCloses() {
        FakeBackendLink link = new FakeBackendLink().failConnect(new ConnectException("Connection refused"));

        assertTrue(new BackendProbe(() -> link, timing).probe().isEmpty());
        assertTrue(link.sent().isEmpty());
        assertEquals(1, link.closeCount());
    }
}
