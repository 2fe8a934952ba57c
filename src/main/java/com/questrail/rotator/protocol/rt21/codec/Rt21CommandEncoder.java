package com.questrail.rotator.protocol.rt21.codec;

import com.questrail.rotator.protocol.k4.model.K4Command;

/**
 * Rt21CommandEncoder
 * -----------------------------------------------------------------------------
 * Maps a semantic command to RT21 device wire syntax.
 *
 * <p>Only {@code MoveTo} and {@code Stop} are encoded here. Position queries use
 * the fixed {@link #QUERY_POSITION} literal issued directly by the transport;
 * {@code Invalid} commands never reach this layer. Passing either is a
 * programming error and raises {@link IllegalArgumentException}.</p>
 */
public interface Rt21CommandEncoder
{
    /** Position query literal. */
    String QUERY_POSITION = "AI1\r;";

    /** Stop literal. */
    String STOP = ";";

    /**
     * Encode {@code command} as an RT21 wire string.
     */
    String encode(K4Command command);
}
