package com.questrail.rotator.protocol.rt21.codec.impl;

import com.questrail.rotator.protocol.AsciiText;
import com.questrail.rotator.protocol.rt21.codec.Rt21ResponseDecoder;

import java.util.OptionalInt;

/**
 * DefaultRt21ResponseDecoder
 * -----------------------------------------------------------------------------
 * The device answers a position query with free-form bytes such as {@code 030;}.
 * The heading is the <em>first</em> run of decimal digits; any later runs are
 * ignored.
 *
 * <p>A reply without digits is a failure, never zero. The reading is passed on
 * as reported, with no range check; only a run too long for an {@code int} is a
 * failure.</p>
 */
public final class DefaultRt21ResponseDecoder implements Rt21ResponseDecoder
{
    @Override
    public OptionalInt decodePosition(byte[] raw)
    {
        final String text = AsciiText.decodeLenient(raw);

        int start = 0;
        while (start < text.length() && !isAsciiDigit(text.charAt(start))) {
            start++;
        }
        if (start == text.length()) {
            return OptionalInt.empty();
        }

        int end = start;
        long value = 0;
        while (end < text.length() && isAsciiDigit(text.charAt(end))) {
            // Saturate rather than overflow; anything this large is rejected below.
            if (value <= Integer.MAX_VALUE) {
                value = value * 10 + (text.charAt(end) - '0');
            }
            end++;
        }

        if (value > Integer.MAX_VALUE) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) value);
    }

    private static boolean isAsciiDigit(char c)
    {
        return c >= '0' && c <= '9';
    }
}
