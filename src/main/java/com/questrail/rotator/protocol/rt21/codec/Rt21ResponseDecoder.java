package com.questrail.rotator.protocol.rt21.codec;

import java.util.OptionalInt;

/**
 * Rt21ResponseDecoder
 * -----------------------------------------------------------------------------
 * Extracts a heading from a raw RT21 position reply.
 */
public interface Rt21ResponseDecoder
{
    /**
     * @param raw bytes exactly as read from the device
     * @return the reported heading in degrees, or empty if the reply carries no
     *         usable one
     */
    OptionalInt decodePosition(byte[] raw);
}
