package com.questrail.rotator.protocol.k4.model;

/**
 * Canonical semantic representation of one K4-format client command.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code K4Command} is what the session layer reasons about once raw client bytes
 * have been classified. Wire concerns (ASCII decoding, whitespace, letter case)
 * are resolved by the command decoder <em>before</em> an instance is created.
 * </p>
 *
 * <p>
 * The variant set is closed:
 * </p>
 * <ul>
 *   <li>{@link Query} - report the current azimuth</li>
 *   <li>{@link MoveTo} - turn to an absolute azimuth</li>
 *   <li>{@link Stop} - halt rotation</li>
 *   <li>{@link Invalid} - anything the decoder did not recognize</li>
 * </ul>
 *
 * <p>
 * {@link Invalid} is never forwarded to the device.
 * </p>
 */
public sealed interface K4Command
        permits Query, MoveTo, Stop, Invalid
{
    /**
     * Returns {@code true} if this command is forwarded to the rotator device.
     */
    default boolean isForwarded()
    {
        return !(this instanceof Invalid);
    }
}
