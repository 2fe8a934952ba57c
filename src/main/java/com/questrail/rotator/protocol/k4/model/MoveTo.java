package com.questrail.rotator.protocol.k4.model;

import com.questrail.rotator.api.Azimuth;

import java.util.Objects;

/**
 * Move request ({@code Mnnn}).
 *
 * <p>Carries the absolute target heading exactly as the client sent it; leading
 * zeros in the client text are not significant ({@code M030} targets 30).</p>
 */
public record MoveTo(Azimuth azimuth) implements K4Command
{
    public MoveTo
    {
        Objects.requireNonNull(azimuth, "azimuth");
    }

    public static MoveTo degrees(int degrees)
    {
        return new MoveTo(Azimuth.of(degrees));
    }
}
