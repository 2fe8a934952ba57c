package com.questrail.rotator.protocol.k4.codec;

import com.questrail.rotator.protocol.k4.model.K4Command;
import com.questrail.rotator.translation.TranslationResult;

/**
 * K4ReplyEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary from a translation outcome back to client-protocol bytes.
 *
 * <p>The client only ever observes three reply shapes: {@code AZ=nnn\r\n},
 * {@code OK\r\n} and {@code ERROR\r\n}.</p>
 */
public interface K4ReplyEncoder
{
    /**
     * Produce the client reply for {@code command} given the outcome of forwarding it.
     *
     * @param command the command the client sent
     * @param result outcome of forwarding; for commands that are never forwarded,
     *               callers pass a {@link TranslationResult.Failed}
     * @return wire-ready reply bytes
     */
    byte[] encode(K4Command command, TranslationResult result);
}
