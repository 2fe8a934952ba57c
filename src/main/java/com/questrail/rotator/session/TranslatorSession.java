package com.questrail.rotator.session;

import com.questrail.rotator.observability.NullTranslatorObservabilitySink;
import com.questrail.rotator.observability.SessionStateTransitionEvent;
import com.questrail.rotator.observability.TrafficEvent;
import com.questrail.rotator.observability.TranslatorErrorEvent;
import com.questrail.rotator.observability.TranslatorObservabilitySink;
import com.questrail.rotator.protocol.AsciiText;
import com.questrail.rotator.protocol.k4.codec.K4CommandDecoder;
import com.questrail.rotator.protocol.k4.codec.K4ReplyEncoder;
import com.questrail.rotator.protocol.k4.model.Invalid;
import com.questrail.rotator.protocol.k4.model.K4Command;
import com.questrail.rotator.protocol.k4.model.Query;
import com.questrail.rotator.protocol.rt21.BackendConnectException;
import com.questrail.rotator.protocol.rt21.Rt21Transport;
import com.questrail.rotator.transport.ClientConnection;
import com.questrail.rotator.translation.TranslationResult;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * TranslatorSession
 * =============================================================================
 * Couples one K4 client connection to one RT21 device connection for its whole
 * lifetime.
 *
 * <h2>Loop</h2>
 * <pre>
 *   client bytes
 *        → K4CommandDecoder
 *            → Rt21Transport (query | send)       [skipped for Invalid]
 *                → K4ReplyEncoder
 *                    → client bytes
 * </pre>
 *
 * <h2>Threading Model</h2>
 * A session runs entirely on the thread that calls {@link #run()}. Exactly one
 * command is in flight: the next client read starts only after the reply to the
 * previous command has been written. Sessions share no mutable state.
 *
 * <h2>Termination</h2>
 * <ul>
 *   <li>Device connect failure: abort straight to {@link SessionState#CLOSED}.</li>
 *   <li>Client disconnect (empty read): orderly close.</li>
 *   <li>Client I/O failure or any unexpected exception: reported, then closed.</li>
 *   <li>Cancellation: observed before each client read; a read already in
 *       progress ends when the listener closes the session on stop.</li>
 * </ul>
 * A device failure while active is reported for that one command only; the
 * session keeps using the same device connection and never reconnects.
 *
 * <p>Both connections are closed exactly once on every exit path.</p>
 */
public final class TranslatorSession implements Runnable {

    private final String id;
    private final ClientConnection client;
    private final Rt21Transport transport;
    private final K4CommandDecoder commandDecoder;
    private final K4ReplyEncoder replyEncoder;
    private final CancellationToken cancellation;
    private final TranslatorObservabilitySink sink;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile SessionState state = SessionState.CONNECTING;

    public TranslatorSession(String id,
                             ClientConnection client,
                             Rt21Transport transport,
                             K4CommandDecoder commandDecoder,
                             K4ReplyEncoder replyEncoder,
                             CancellationToken cancellation,
                             TranslatorObservabilitySink sink)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.client = Objects.requireNonNull(client, "client");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.commandDecoder = Objects.requireNonNull(commandDecoder, "commandDecoder");
        this.replyEncoder = Objects.requireNonNull(replyEncoder, "replyEncoder");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.sink = Objects.requireNonNullElse(sink, NullTranslatorObservabilitySink.INSTANCE);
    }

    public SessionState state() {
        return state;
    }

    @Override
    public void run() {
        try {
            transport.connect();
        } catch (BackendConnectException e) {
            error(e.getMessage(), e, true);
            close();
            return;
        } catch (RuntimeException e) {
            error("Unexpected error opening RT21 connection", e, true);
            close();
            return;
        }

        transition(SessionState.ACTIVE);

        try {
            while (!cancellation.isCancelled()) {
                byte[] data = client.receive();
                if (data.length == 0) {
                    break;
                }
                serve(data);
            }
        } catch (IOException e) {
            // A read aborted by close() during shutdown is not a client failure.
            if (!cancellation.isCancelled()) {
                error("Client connection failed: " + e.getMessage(), e, true);
            }
        } catch (RuntimeException e) {
            error("Client handler error: " + e.getMessage(), e, true);
        } finally {
            close();
        }
    }

    /**
     * Release both connections. Safe to call from any thread, any number of times.
     * {@link com.questrail.rotator.server.TranslatorListener#stop()} calls this for
     * every live session, which unblocks a session stuck in a read.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (state == SessionState.ACTIVE) {
            transition(SessionState.CLOSING);
        }
        try {
            transport.close();
        } finally {
            client.close();
            transition(SessionState.CLOSED);
        }
    }

    private void serve(byte[] data) throws IOException {
        traffic(TrafficEvent.Direction.RECEIVED, TrafficEvent.Peer.CLIENT,
            AsciiText.decodeLenient(data).strip());

        K4Command command = commandDecoder.decode(data);
        traffic(TrafficEvent.Direction.PARSED, TrafficEvent.Peer.TRANSLATOR, describe(command));

        TranslationResult result = forward(command);

        byte[] reply = replyEncoder.encode(command, result);
        client.send(reply);
        traffic(TrafficEvent.Direction.REPLIED, TrafficEvent.Peer.CLIENT,
            AsciiText.decodeLenient(reply).strip());
    }

    private TranslationResult forward(K4Command command) {
        if (!command.isForwarded()) {
            return new TranslationResult.Failed("Unrecognized command");
        }
        if (command instanceof Query) {
            return transport.queryPosition();
        }
        return transport.send(command);
    }

    private static String describe(K4Command command) {
        if (command instanceof Invalid) {
            return "No valid command found";
        }
        return "Command: " + command;
    }

    private void transition(SessionState next) {
        SessionState previous = state;
        state = next;
        sink.onSessionStateTransition(new SessionStateTransitionEvent(Instant.now(), id, previous, next));
    }

    private void traffic(TrafficEvent.Direction direction, TrafficEvent.Peer peer, String payload) {
        sink.onTraffic(new TrafficEvent(Instant.now(), id, direction, peer, payload));
    }

    private void error(String message, Throwable cause, boolean fatal) {
        sink.onError(new TranslatorErrorEvent(Instant.now(), id, message, cause, fatal));
    }
}
