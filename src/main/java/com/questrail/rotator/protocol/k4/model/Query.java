package com.questrail.rotator.protocol.k4.model;

/**
 * Position query ({@code C...}).
 *
 * <p>Answered with {@code AZ=nnn} when the device reports a position, or
 * {@code ERROR} when it does not.</p>
 */
public record Query() implements K4Command
{
}
