package com.questrail.rotator.protocol.rt21.codec.impl;

import com.questrail.rotator.protocol.k4.model.K4Command;
import com.questrail.rotator.protocol.k4.model.MoveTo;
import com.questrail.rotator.protocol.k4.model.Stop;
import com.questrail.rotator.protocol.rt21.codec.Rt21CommandEncoder;

import java.util.Objects;

/**
 * DefaultRt21CommandEncoder
 * -----------------------------------------------------------------------------
 * <ul>
 *   <li>{@code Stop} - {@code ;}</li>
 *   <li>{@code MoveTo(n)} - {@code AP0} + three-digit {@code n} + {@code \r;}
 *       (35 is {@code AP0035\r;})</li>
 * </ul>
 *
 * <p>No clamping is applied. The azimuth type already guarantees the value fits
 * the three-digit field.</p>
 */
public final class DefaultRt21CommandEncoder implements Rt21CommandEncoder
{
    static final String MOVE_PREFIX = "AP0";
    static final String MOVE_SUFFIX = "\r;";

    @Override
    public String encode(K4Command command)
    {
        Objects.requireNonNull(command, "command");

        if (command instanceof Stop) {
            return STOP;
        }
        if (command instanceof MoveTo move) {
            return MOVE_PREFIX + move.azimuth().toField() + MOVE_SUFFIX;
        }
        throw new IllegalArgumentException("Command is not encodable for RT21: " + command);
    }
}
