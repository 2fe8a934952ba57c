package com.questrail.rotator.runtime;

import com.questrail.rotator.config.TranslatorConfig;
import com.questrail.rotator.observability.NullTranslatorObservabilitySink;
import com.questrail.rotator.observability.TranslatorObservabilitySink;
import com.questrail.rotator.protocol.k4.codec.K4CommandDecoder;
import com.questrail.rotator.protocol.k4.codec.K4ReplyEncoder;
import com.questrail.rotator.protocol.k4.codec.impl.DefaultK4CommandDecoder;
import com.questrail.rotator.protocol.k4.codec.impl.DefaultK4ReplyEncoder;
import com.questrail.rotator.protocol.rt21.Rt21Transport;
import com.questrail.rotator.protocol.rt21.codec.Rt21CommandEncoder;
import com.questrail.rotator.protocol.rt21.codec.Rt21ResponseDecoder;
import com.questrail.rotator.protocol.rt21.codec.impl.DefaultRt21CommandEncoder;
import com.questrail.rotator.protocol.rt21.codec.impl.DefaultRt21ResponseDecoder;
import com.questrail.rotator.server.TranslatorListener;
import com.questrail.rotator.session.CancellationToken;
import com.questrail.rotator.session.TranslatorSession;
import com.questrail.rotator.session.TranslatorSessionFactory;
import com.questrail.rotator.transport.BackendLink;
import com.questrail.rotator.transport.tcp.SocketBackendLink;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Function;

/**
 * RotatorTranslatorRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the K4 to RT21 translator.
 *
 * <p>Wires codecs, the per-session device transport and the listener from a
 * {@link TranslatorConfig}. All codecs are stateless and shared; everything that
 * holds a socket is created per session.</p>
 */
public final class RotatorTranslatorRuntime {
    private final TranslatorConfig config;
    private final TranslatorListener listener;
    private final CancellationToken cancellation;
    private final BackendProbe probe;

    private RotatorTranslatorRuntime(
            TranslatorConfig config,
            TranslatorListener listener,
            CancellationToken cancellation,
            BackendProbe probe) {
        this.config = config;
        this.listener = listener;
        this.cancellation = cancellation;
        this.probe = probe;
    }

    /**
     * Run the optional startup probe, then start accepting clients.
     *
     * @throws IOException if the listen port cannot be bound
     */
    public void start() throws IOException {
        if (config.startupProbe()) {
            probe.probe();
        }
        listener.start();
    }

    public void stop() {
        cancellation.cancel();
        listener.stop();
    }

    public int listenPort() {
        return listener.localPort();
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TranslatorConfig config = TranslatorConfig.defaults();
        private TranslatorObservabilitySink observabilitySink = NullTranslatorObservabilitySink.INSTANCE;
        private Function<InetSocketAddress, BackendLink> backendLinkFactory = SocketBackendLink::new;
        private CancellationToken cancellation = new CancellationToken();

        public Builder withConfig(TranslatorConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(TranslatorObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replace how device connections are created (tests, simulators).
         */
        public Builder withBackendLinkFactory(Function<InetSocketAddress, BackendLink> factory) {
            this.backendLinkFactory = factory;
            return this;
        }

        public Builder withCancellationToken(CancellationToken token) {
            this.cancellation = token;
            return this;
        }

        public RotatorTranslatorRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(backendLinkFactory, "backendLinkFactory");
            Objects.requireNonNull(cancellation, "cancellation");

            // 1. Stateless codecs, shared by all sessions
            K4CommandDecoder commandDecoder = new DefaultK4CommandDecoder();
            K4ReplyEncoder replyEncoder = new DefaultK4ReplyEncoder(config.reportMoveFailures());
            Rt21CommandEncoder rt21Encoder = new DefaultRt21CommandEncoder();
            Rt21ResponseDecoder rt21Decoder = new DefaultRt21ResponseDecoder();

            // 2. Per-session wiring: fresh device link and transport for each client
            final TranslatorConfig cfg = config;
            final TranslatorObservabilitySink sink = observabilitySink;
            final Function<InetSocketAddress, BackendLink> links = backendLinkFactory;
            final CancellationToken token = cancellation;

            TranslatorSessionFactory sessionFactory = (sessionId, client) -> {
                Rt21Transport transport = new Rt21Transport(
                    sessionId,
                    links.apply(cfg.backendAddress()),
                    rt21Encoder,
                    rt21Decoder,
                    cfg.timingPolicy(),
                    sink
                );
                return new TranslatorSession(
                    sessionId,
                    client,
                    transport,
                    commandDecoder,
                    replyEncoder,
                    token,
                    sink
                );
            };

            // 3. Listener and startup probe
            TranslatorListener listener = new TranslatorListener(cfg.listenPort(), sessionFactory, token);
            BackendProbe probe = new BackendProbe(() -> links.apply(cfg.backendAddress()), cfg.timingPolicy());

            return new RotatorTranslatorRuntime(cfg, listener, token, probe);
        }
    }
}
