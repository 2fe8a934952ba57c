package com.questrail.rotator.protocol.k4.codec;

import com.questrail.rotator.protocol.k4.model.K4Command;

/**
 * K4CommandDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between raw client bytes and a semantic {@link K4Command}.
 *
 * <p>Implementations MUST be total: every input, including {@code null}, empty
 * and non-ASCII payloads, yields a command. Unrecognized input is reported as
 * {@link com.questrail.rotator.protocol.k4.model.Invalid}, never as an
 * exception. Decoding has no side effects.</p>
 */
public interface K4CommandDecoder
{
    /**
     * Classify one client read.
     *
     * @param raw bytes exactly as received from the client
     * @return the classified command, never {@code null}
     */
    K4Command decode(byte[] raw);
}
