package com.questrail.rotator.api;

/**
 * Azimuth
 * -----------------------------------------------------------------------------
 * Compass heading, in whole degrees, that a rotator reports or is asked to turn to.
 *
 * <p>The canonical wire and display form is always zero-padded to three digits
 * ({@code 5} is {@code 005}). Headings are nominally 0-359, but the range accepted
 * here is the full three-digit field, 0-999: values 360-999 are representable on
 * the wire and are passed through to the device unchanged. Anything outside that
 * field cannot be expressed without corrupting the fixed-width device field and is
 * rejected at construction.</p>
 */
public record Azimuth(int degrees)
{
    /** Smallest value representable in the three-digit field. */
    public static final int MIN_FIELD_VALUE = 0;

    /** Largest value representable in the three-digit field. */
    public static final int MAX_FIELD_VALUE = 999;

    public Azimuth
    {
        if (!isRepresentable(degrees)) {
            throw new AzimuthOutOfRangeException(degrees);
        }
    }

    public static Azimuth of(int degrees)
    {
        return new Azimuth(degrees);
    }

    public static boolean isRepresentable(long degrees)
    {
        return degrees >= MIN_FIELD_VALUE && degrees <= MAX_FIELD_VALUE;
    }

    /**
     * Zero-padded three-digit form, e.g. {@code "035"}.
     */
    public String toField()
    {
        return String.format("%03d", degrees);
    }

    @Override
    public String toString()
    {
        return toField();
    }
}
