package com.questrail.rotator.protocol.rt21;

import com.questrail.rotator.config.TranslatorTimingPolicy;
import com.questrail.rotator.observability.NullTranslatorObservabilitySink;
import com.questrail.rotator.observability.TrafficEvent;
import com.questrail.rotator.observability.TranslatorErrorEvent;
import com.questrail.rotator.observability.TranslatorObservabilitySink;
import com.questrail.rotator.protocol.AsciiText;
import com.questrail.rotator.protocol.k4.model.K4Command;
import com.questrail.rotator.protocol.rt21.codec.Rt21CommandEncoder;
import com.questrail.rotator.protocol.rt21.codec.Rt21ResponseDecoder;
import com.questrail.rotator.transport.BackendLink;
import com.questrail.rotator.translation.TranslationResult;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Rt21Transport
 * =============================================================================
 * Drives one session's RT21 device connection.
 *
 * <h2>Operations</h2>
 * <pre>
 *   connect()        → open link (bounded by connectTimeout) or BackendConnectException
 *   queryPosition()  → "AI1\r;" → read → first digit run → Position | Failed
 *   send(command)    → encode → write → optional ack read (acknowledgementTimeout)
 *                      → Acknowledged | Failed (write or non-timeout read failure)
 * </pre>
 *
 * <h2>Explicit non-responsibilities</h2>
 * This class MUST NOT retry, reconnect, or decide what the client is told. A
 * {@link TranslationResult.Failed} caused by a broken socket is returned as-is;
 * every later operation on the same link will most likely fail the same way.
 *
 * <p>Not thread-safe. A transport belongs to exactly one session thread.</p>
 */
public final class Rt21Transport
{
    private final String sessionId;
    private final BackendLink link;
    private final Rt21CommandEncoder encoder;
    private final Rt21ResponseDecoder decoder;
    private final TranslatorTimingPolicy timing;
    private final TranslatorObservabilitySink sink;

    public Rt21Transport(String sessionId,
                         BackendLink link,
                         Rt21CommandEncoder encoder,
                         Rt21ResponseDecoder decoder,
                         TranslatorTimingPolicy timing,
                         TranslatorObservabilitySink sink)
    {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.link = Objects.requireNonNull(link, "link");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.sink = Objects.requireNonNullElse(sink, NullTranslatorObservabilitySink.INSTANCE);
    }

    /**
     * Open the device connection.
     *
     * @throws BackendConnectException if the device is unreachable within the connect timeout
     */
    public void connect()
    {
        try {
            link.connect(timing.connectTimeout());
        }
        catch (IOException e) {
            throw new BackendConnectException(link.remoteAddress(), e);
        }
    }

    /**
     * Ask the device for its current heading.
     *
     * <p>The read is bounded only by {@link TranslatorTimingPolicy#queryTimeout()},
     * which defaults to unbounded.</p>
     */
    public TranslationResult queryPosition()
    {
        try {
            write(Rt21CommandEncoder.QUERY_POSITION);

            byte[] reply = link.receive(timing.queryTimeout());
            if (reply.length == 0) {
                return fail("RT21 closed the connection during position query", null);
            }
            traffic(TrafficEvent.Direction.RESPONSE, AsciiText.decodeLenient(reply).strip());

            OptionalInt degrees = decoder.decodePosition(reply);
            if (degrees.isEmpty()) {
                return fail("RT21 position reply carried no usable azimuth: '"
                        + AsciiText.escape(reply) + "'", null);
            }
            return new TranslationResult.Position(degrees.getAsInt());
        }
        catch (IOException e) {
            return fail("RT21 query failed: " + e.getMessage(), e);
        }
    }

    /**
     * Forward a move or stop command.
     *
     * <p>The device may or may not answer. Silence within the acknowledgment
     * window is a normal outcome and yields {@link TranslationResult.Acknowledged}
     * with no reply.</p>
     *
     * @throws IllegalArgumentException if {@code command} is not a move or stop
     */
    public TranslationResult send(K4Command command)
    {
        final String wire = encoder.encode(command);

        try {
            write(wire);
        }
        catch (IOException e) {
            return fail("RT21 communication failed: " + e.getMessage(), e);
        }

        try {
            byte[] ack = link.receive(timing.acknowledgementTimeout());
            if (ack.length == 0) {
                return TranslationResult.Acknowledged.silent();
            }
            String text = AsciiText.decodeLenient(ack);
            traffic(TrafficEvent.Direction.RESPONSE, text);
            return new TranslationResult.Acknowledged(Optional.of(text));
        }
        catch (SocketTimeoutException e) {
            return TranslationResult.Acknowledged.silent();
        }
        catch (IOException e) {
            return fail("RT21 communication failed: " + e.getMessage(), e);
        }
    }

    /**
     * Close the device connection. Idempotent.
     */
    public void close()
    {
        link.close();
    }

    private void write(String wire) throws IOException
    {
        link.send(AsciiText.encode(wire));
        traffic(TrafficEvent.Direction.SENT, wire);
    }

    private TranslationResult fail(String reason, Throwable cause)
    {
        sink.onError(new TranslatorErrorEvent(Instant.now(), sessionId, reason, cause, false));
        return new TranslationResult.Failed(reason, cause);
    }

    private void traffic(TrafficEvent.Direction direction, String payload)
    {
        sink.onTraffic(new TrafficEvent(Instant.now(), sessionId, direction, TrafficEvent.Peer.DEVICE, payload));
    }
}
