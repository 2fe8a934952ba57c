package com.questrail.rotator.config;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Aggregated configuration for the rotator translator runtime.
 *
 * @param backendAddress     RT21 device address (unresolved addresses are resolved on connect)
 * @param listenPort         port K4 clients connect to; {@code 0} picks an ephemeral port
 * @param timingPolicy       device timeouts
 * @param reportMoveFailures answer {@code ERROR} instead of {@code OK} when a move/stop write fails
 * @param startupProbe       query the device once before accepting clients
 */
public record TranslatorConfig(
    InetSocketAddress backendAddress,
    int listenPort,
    TranslatorTimingPolicy timingPolicy,
    boolean reportMoveFailures,
    boolean startupProbe
) {
    public static final String DEFAULT_BACKEND_HOST = "192.168.1.8";
    public static final int DEFAULT_BACKEND_PORT = 6555;
    public static final int DEFAULT_LISTEN_PORT = 6555;

    public TranslatorConfig {
        Objects.requireNonNull(backendAddress, "backendAddress");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        if (listenPort < 0 || listenPort > 65535) {
            throw new IllegalArgumentException("listenPort must be 0-65535");
        }
    }

    public static TranslatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress backendAddress =
            InetSocketAddress.createUnresolved(DEFAULT_BACKEND_HOST, DEFAULT_BACKEND_PORT);
        private int listenPort = DEFAULT_LISTEN_PORT;
        private TranslatorTimingPolicy timingPolicy = TranslatorTimingPolicy.defaults();
        private boolean reportMoveFailures = false;
        private boolean startupProbe = true;

        public Builder withBackendAddress(InetSocketAddress address) {
            this.backendAddress = address;
            return this;
        }

        public Builder withBackend(String host, int port) {
            return withBackendAddress(InetSocketAddress.createUnresolved(host, port));
        }

        public Builder withListenPort(int port) {
            this.listenPort = port;
            return this;
        }

        public Builder withTimingPolicy(TranslatorTimingPolicy policy) {
            this.timingPolicy = policy;
            return this;
        }

        public Builder withReportMoveFailures(boolean report) {
            this.reportMoveFailures = report;
            return this;
        }

        public Builder withStartupProbe(boolean probe) {
            this.startupProbe = probe;
            return this;
        }

        public TranslatorConfig build() {
            return new TranslatorConfig(backendAddress, listenPort, timingPolicy, reportMoveFailures, startupProbe);
        }
    }
}
