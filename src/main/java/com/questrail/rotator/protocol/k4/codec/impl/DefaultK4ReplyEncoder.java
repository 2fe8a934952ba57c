package com.questrail.rotator.protocol.k4.codec.impl;

import com.questrail.rotator.protocol.AsciiText;
import com.questrail.rotator.protocol.k4.codec.K4ReplyEncoder;
import com.questrail.rotator.protocol.k4.model.Invalid;
import com.questrail.rotator.protocol.k4.model.K4Command;
import com.questrail.rotator.protocol.k4.model.MoveTo;
import com.questrail.rotator.protocol.k4.model.Query;
import com.questrail.rotator.protocol.k4.model.Stop;
import com.questrail.rotator.translation.TranslationResult;

import java.util.Objects;

/**
 * DefaultK4ReplyEncoder
 * -----------------------------------------------------------------------------
 * Maps translation outcomes to K4 replies.
 *
 * <table>
 *   <caption>Reply table</caption>
 *   <tr><th>Command</th><th>Result</th><th>Reply</th></tr>
 *   <tr><td>Query</td><td>Position</td><td>{@code AZ=nnn\r\n} (at least three digits)</td></tr>
 *   <tr><td>Query</td><td>anything else</td><td>{@code ERROR\r\n}</td></tr>
 *   <tr><td>MoveTo / Stop</td><td>any</td><td>{@code OK\r\n} (see below)</td></tr>
 *   <tr><td>Invalid</td><td>ignored</td><td>{@code ERROR\r\n}</td></tr>
 * </table>
 *
 * <h2>Move/stop failure reporting</h2>
 * <p>Deployed K4 controllers expect {@code OK} for every move and stop, so a
 * failed device write is not surfaced by default. Constructing the encoder with
 * {@code reportMoveFailures = true} is the single switch that turns a
 * {@link TranslationResult.Failed} for a move or stop into {@code ERROR}.</p>
 */
public final class DefaultK4ReplyEncoder implements K4ReplyEncoder
{
    public static final String OK = "OK\r\n";
    public static final String ERROR = "ERROR\r\n";
    static final String POSITION_PREFIX = "AZ=";
    static final String LINE_END = "\r\n";

    private final boolean reportMoveFailures;

    /**
     * Encoder with the compatible behavior: move/stop always answer {@code OK}.
     */
    public DefaultK4ReplyEncoder()
    {
        this(false);
    }

    public DefaultK4ReplyEncoder(boolean reportMoveFailures)
    {
        this.reportMoveFailures = reportMoveFailures;
    }

    public boolean reportsMoveFailures()
    {
        return reportMoveFailures;
    }

    @Override
    public byte[] encode(K4Command command, TranslationResult result)
    {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(result, "result");
        return AsciiText.encode(reply(command, result));
    }

    private String reply(K4Command command, TranslationResult result)
    {
        if (command instanceof Invalid) {
            return ERROR;
        }

        if (command instanceof Query) {
            if (result instanceof TranslationResult.Position position) {
                return POSITION_PREFIX + String.format("%03d", position.degrees()) + LINE_END;
            }
            return ERROR;
        }

        if (command instanceof MoveTo || command instanceof Stop) {
            if (reportMoveFailures && result.isFailure()) {
                return ERROR;
            }
            return OK;
        }

        throw new IllegalArgumentException("Unhandled command type: " + command);
    }
}
