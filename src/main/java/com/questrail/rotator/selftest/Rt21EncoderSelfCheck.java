package com.questrail.rotator.selftest;

import com.questrail.rotator.protocol.AsciiText;
import com.questrail.rotator.protocol.k4.model.K4Command;
import com.questrail.rotator.protocol.k4.model.MoveTo;
import com.questrail.rotator.protocol.k4.model.Stop;
import com.questrail.rotator.protocol.rt21.codec.Rt21CommandEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rt21EncoderSelfCheck
 * -----------------------------------------------------------------------------
 * Field check of the RT21 command formatting table, run with
 * {@code RotatorTranslatorMain selftest}. Not part of the runtime protocol.
 */
public final class Rt21EncoderSelfCheck {
    private static final Logger log = LoggerFactory.getLogger(Rt21EncoderSelfCheck.class);

    /** One formatting expectation. */
    public record Case(String label, K4Command command, String expected) {}

    /** Outcome of one case. */
    public record Outcome(Case testCase, String actual) {
        public boolean passed() {
            return testCase.expected().equals(actual);
        }
    }

    static final List<Case> STANDARD_CASES = List.of(
        new Case("0", MoveTo.degrees(0), "AP0000\r;"),
        new Case("35", MoveTo.degrees(35), "AP0035\r;"),
        new Case("180", MoveTo.degrees(180), "AP0180\r;"),
        new Case("359", MoveTo.degrees(359), "AP0359\r;"),
        new Case("stop", new Stop(), ";")
    );

    private final Rt21CommandEncoder encoder;
    private final List<Case> cases;

    public Rt21EncoderSelfCheck(Rt21CommandEncoder encoder) {
        this(encoder, STANDARD_CASES);
    }

    public Rt21EncoderSelfCheck(Rt21CommandEncoder encoder, List<Case> cases) {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.cases = List.copyOf(cases);
    }

    /**
     * Encode every case and log one pass/fail line per case.
     */
    public List<Outcome> run() {
        log.info("Testing RT21 command formatting:");
        List<Outcome> outcomes = new ArrayList<>(cases.size());
        for (Case c : cases) {
            String actual;
            try {
                actual = encoder.encode(c.command());
            } catch (RuntimeException e) {
                actual = "<" + e.getClass().getSimpleName() + ": " + e.getMessage() + ">";
            }
            Outcome outcome = new Outcome(c, actual);
            outcomes.add(outcome);

            if (outcome.passed()) {
                log.info("PASS {} -> '{}'", c.label(), AsciiText.escape(actual));
            } else {
                log.error("FAIL {} -> '{}' (expected: '{}')",
                    c.label(), AsciiText.escape(actual), AsciiText.escape(c.expected()));
            }
        }
        return outcomes;
    }

    public static boolean allPassed(List<Outcome> outcomes) {
        return outcomes.stream().allMatch(Outcome::passed);
    }
}
