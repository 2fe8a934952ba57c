package com.questrail.rotator.api;

/**
 * Raised when a heading cannot be carried in the fixed three-digit azimuth field.
 */
public final class AzimuthOutOfRangeException extends IllegalArgumentException
{
    private final long degrees;

    public AzimuthOutOfRangeException(long degrees)
    {
        super("Azimuth " + degrees + " is outside the representable field "
                + Azimuth.MIN_FIELD_VALUE + "-" + Azimuth.MAX_FIELD_VALUE);
        this.degrees = degrees;
    }

    public long degrees()
    {
        return degrees;
    }
}
