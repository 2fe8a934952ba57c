package com.questrail.rotator;

import com.questrail.rotator.config.TranslatorConfig;
import com.questrail.rotator.config.TranslatorConfigException;
import com.questrail.rotator.config.TranslatorConfigLoader;
import com.questrail.rotator.observability.Slf4jTranslatorObservabilitySink;
import com.questrail.rotator.protocol.rt21.codec.impl.DefaultRt21CommandEncoder;
import com.questrail.rotator.runtime.RotatorTranslatorRuntime;
import com.questrail.rotator.selftest.Rt21EncoderSelfCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point.
 *
 * <pre>
 *   java -jar rotator-translator.jar [key=value ...]   run the translator
 *   java -jar rotator-translator.jar selftest          check RT21 formatting and exit
 * </pre>
 */
public final class RotatorTranslatorMain {
    private static final Logger log = LoggerFactory.getLogger(RotatorTranslatorMain.class);

    private RotatorTranslatorMain() {}

    public static void main(String[] args) {
        if (args.length > 0 && "selftest".equals(args[0])) {
            var outcomes = new Rt21EncoderSelfCheck(new DefaultRt21CommandEncoder()).run();
            System.exit(Rt21EncoderSelfCheck.allPassed(outcomes) ? 0 : 1);
            return;
        }

        final TranslatorConfig config;
        try {
            config = TranslatorConfigLoader.load(args, System.getenv());
        } catch (TranslatorConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        log.info("=== ROTATOR PROTOCOL TRANSLATOR ===");
        log.info("Forwarding K4 clients on port {} to RT21 at {}", config.listenPort(), config.backendAddress());

        RotatorTranslatorRuntime runtime = RotatorTranslatorRuntime.builder()
            .withConfig(config)
            .withObservabilitySink(new Slf4jTranslatorObservabilitySink())
            .build();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.stop();
            log.info("Translator stopped.");
            stopped.countDown();
        }, "rotator-shutdown"));

        try {
            runtime.start();
        } catch (IOException e) {
            log.error("Failed to start server on port {}: {}", config.listenPort(), e.getMessage(), e);
            System.exit(1);
            return;
        }

        log.info("Translator running. Press Ctrl+C to stop. Arguments: {}", Arrays.toString(args));

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
