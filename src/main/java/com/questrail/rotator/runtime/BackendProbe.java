package com.questrail.rotator.runtime;

import com.questrail.rotator.config.TranslatorTimingPolicy;
import com.questrail.rotator.protocol.AsciiText;
import com.questrail.rotator.protocol.rt21.codec.Rt21CommandEncoder;
import com.questrail.rotator.transport.BackendLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * BackendProbe
 * -----------------------------------------------------------------------------
 * One-shot startup connectivity check against the RT21 device.
 *
 * <p>Opens a short-lived connection, sends a position query, reads one reply and
 * closes. The outcome is logged only; a failed probe never prevents the
 * translator from starting, since the device may come up later.</p>
 *
 * <p>The probe read is bounded by the connect timeout so an unresponsive device
 * cannot hang startup.</p>
 */
public final class BackendProbe {
    private static final Logger log = LoggerFactory.getLogger(BackendProbe.class);

    private final Supplier<BackendLink> linkSupplier;
    private final TranslatorTimingPolicy timing;

    public BackendProbe(Supplier<BackendLink> linkSupplier, TranslatorTimingPolicy timing) {
        this.linkSupplier = Objects.requireNonNull(linkSupplier, "linkSupplier");
        this.timing = Objects.requireNonNull(timing, "timing");
    }

    /**
     * @return the device's raw (stripped) reply, or empty if the device was
     *         unreachable or silent
     */
    public Optional<String> probe() {
        BackendLink link = linkSupplier.get();
        log.info("Testing RT21 connection to {}...", link.remoteAddress());
        try {
            link.connect(timing.connectTimeout());
            link.send(AsciiText.encode(Rt21CommandEncoder.QUERY_POSITION));
            byte[] reply = link.receive(timing.connectTimeout());
            if (reply.length == 0) {
                log.warn("RT21 connected but no response");
                return Optional.empty();
            }
            String text = AsciiText.decodeLenient(reply).strip();
            log.info("RT21 connected - current position: {}", AsciiText.escape(text));
            return Optional.of(text);
        } catch (IOException e) {
            log.warn("Could not connect to RT21 device - {}", e.toString());
            return Optional.empty();
        } finally {
            link.close();
        }
    }
}
