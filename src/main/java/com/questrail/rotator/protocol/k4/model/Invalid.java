package com.questrail.rotator.protocol.k4.model;

import java.util.Objects;

/**
 * Unrecognized client input.
 *
 * <p>Keeps the decoded, trimmed text for diagnostics only. It has no protocol
 * meaning and is answered with {@code ERROR} without any device interaction.</p>
 */
public record Invalid(String text) implements K4Command
{
    public Invalid
    {
        Objects.requireNonNull(text, "text");
    }
}
