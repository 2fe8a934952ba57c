package com.questrail.rotator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * TranslatorConfigLoader
 * -----------------------------------------------------------------------------
 * Builds a {@link TranslatorConfig} from, in increasing precedence:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>environment variables {@code ROTATOR_BACKEND_HOST}, {@code ROTATOR_BACKEND_PORT},
 *       {@code ROTATOR_LISTEN_PORT}</li>
 *   <li>{@code key=value} command-line arguments</li>
 * </ol>
 *
 * <p>Recognized argument keys: {@code backendHost}, {@code backendPort},
 * {@code listenPort}, {@code connectTimeoutMs}, {@code ackTimeoutMs},
 * {@code queryTimeoutMs} ({@code 0} = unbounded), {@code reportMoveFailures},
 * {@code probe}.</p>
 */
public final class TranslatorConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(TranslatorConfigLoader.class);

    static final String ENV_BACKEND_HOST = "ROTATOR_BACKEND_HOST";
    static final String ENV_BACKEND_PORT = "ROTATOR_BACKEND_PORT";
    static final String ENV_LISTEN_PORT = "ROTATOR_LISTEN_PORT";

    private TranslatorConfigLoader() {}

    public static TranslatorConfig load(String[] args, Map<String, String> env) {
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(env, "env");

        String backendHost = TranslatorConfig.DEFAULT_BACKEND_HOST;
        int backendPort = TranslatorConfig.DEFAULT_BACKEND_PORT;
        int listenPort = TranslatorConfig.DEFAULT_LISTEN_PORT;
        TranslatorTimingPolicy defaults = TranslatorTimingPolicy.defaults();
        Duration connectTimeout = defaults.connectTimeout();
        Duration ackTimeout = defaults.acknowledgementTimeout();
        Duration queryTimeout = defaults.queryTimeout();
        boolean reportMoveFailures = false;
        boolean probe = true;

        String envHost = env.get(ENV_BACKEND_HOST);
        if (envHost != null && !envHost.isBlank()) {
            backendHost = envHost.trim();
        }
        if (env.containsKey(ENV_BACKEND_PORT)) {
            backendPort = parsePort(ENV_BACKEND_PORT, env.get(ENV_BACKEND_PORT));
        }
        if (env.containsKey(ENV_LISTEN_PORT)) {
            listenPort = parsePort(ENV_LISTEN_PORT, env.get(ENV_LISTEN_PORT));
        }

        for (String a : args) {
            String[] kv = a.split("=", 2);
            String k = kv[0];
            String val = kv.length > 1 ? kv[1].trim() : "";
            switch (k) {
                case "backendHost" -> backendHost = requireValue(k, val);
                case "backendPort" -> backendPort = parsePort(k, val);
                case "listenPort" -> listenPort = parsePort(k, val);
                case "connectTimeoutMs" -> connectTimeout = Duration.ofMillis(parseMillis(k, val));
                case "ackTimeoutMs" -> ackTimeout = Duration.ofMillis(parseMillis(k, val));
                case "queryTimeoutMs" -> queryTimeout = Duration.ofMillis(parseMillis(k, val));
                case "reportMoveFailures" -> reportMoveFailures = Boolean.parseBoolean(val);
                case "probe" -> probe = Boolean.parseBoolean(val);
                default -> log.warn("Ignoring unknown argument '{}'", a);
            }
        }

        final TranslatorTimingPolicy timing;
        try {
            timing = new TranslatorTimingPolicy(connectTimeout, ackTimeout, queryTimeout);
        } catch (IllegalArgumentException e) {
            throw new TranslatorConfigException("Invalid timing configuration: " + e.getMessage(), e);
        }

        return TranslatorConfig.builder()
            .withBackend(backendHost, backendPort)
            .withListenPort(listenPort)
            .withTimingPolicy(timing)
            .withReportMoveFailures(reportMoveFailures)
            .withStartupProbe(probe)
            .build();
    }

    private static String requireValue(String key, String val) {
        if (val.isEmpty()) {
            throw new TranslatorConfigException(key + " requires a value");
        }
        return val;
    }

    private static int parsePort(String key, String val) {
        int port = parseInt(key, val);
        if (port < 0 || port > 65535) {
            throw new TranslatorConfigException(key + " must be 0-65535, got " + port);
        }
        return port;
    }

    private static long parseMillis(String key, String val) {
        int millis = parseInt(key, val);
        if (millis < 0) {
            throw new TranslatorConfigException(key + " must be non-negative, got " + millis);
        }
        return millis;
    }

    private static int parseInt(String key, String val) {
        try {
            return Integer.parseInt(val == null ? "" : val.trim());
        } catch (NumberFormatException e) {
            throw new TranslatorConfigException(key + " is not a number: '" + val + "'", e);
        }
    }
}
