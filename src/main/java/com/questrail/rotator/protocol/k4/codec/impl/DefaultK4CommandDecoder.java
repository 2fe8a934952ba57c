package com.questrail.rotator.protocol.k4.codec.impl;

import com.questrail.rotator.api.Azimuth;
import com.questrail.rotator.protocol.AsciiText;
import com.questrail.rotator.protocol.k4.codec.K4CommandDecoder;
import com.questrail.rotator.protocol.k4.model.Invalid;
import com.questrail.rotator.protocol.k4.model.K4Command;
import com.questrail.rotator.protocol.k4.model.MoveTo;
import com.questrail.rotator.protocol.k4.model.Query;
import com.questrail.rotator.protocol.k4.model.Stop;

/**
 * DefaultK4CommandDecoder
 * -----------------------------------------------------------------------------
 * Explicit classifier for the K4 client command grammar.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Lenient ASCII decode (non-ASCII bytes dropped)</li>
 *   <li>Strip surrounding whitespace</li>
 *   <li>Classify, case-insensitively, by first match:
 *     <ul>
 *       <li>leading {@code C} - {@link Query} (anything may follow)</li>
 *       <li>leading {@code M} immediately followed by one or more digits -
 *           {@link MoveTo}; trailing text after the digit run is ignored</li>
 *       <li>exactly {@code S}, {@code STOP} or {@code ;} - {@link Stop}</li>
 *       <li>anything else - {@link Invalid}</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p><strong>Azimuth field:</strong> a digit run whose value does not fit the
 * three-digit device field (greater than 999, including runs too long for an
 * {@code int}) is classified as {@link Invalid}. It is never clamped or
 * truncated.</p>
 */
public final class DefaultK4CommandDecoder implements K4CommandDecoder
{
    private static final char QUERY_PREFIX = 'C';
    private static final char MOVE_PREFIX = 'M';

    @Override
    public K4Command decode(byte[] raw)
    {
        final String text = AsciiText.decodeLenient(raw).strip();
        if (text.isEmpty()) {
            return new Invalid(text);
        }

        final char lead = Character.toUpperCase(text.charAt(0));

        if (lead == QUERY_PREFIX) {
            return new Query();
        }

        if (lead == MOVE_PREFIX) {
            int end = digitRunEnd(text, 1);
            if (end > 1) {
                return moveTo(text, text.substring(1, end));
            }
            // "M" without digits is not a move; fall through to the stop check.
        }

        if (isStop(text)) {
            return new Stop();
        }

        return new Invalid(text);
    }

    private static K4Command moveTo(String text, String digits)
    {
        final String significant = stripLeadingZeros(digits);

        // Anything longer than three significant digits is > 999 (and may not
        // even fit an int), so reject before parsing.
        if (significant.length() > 3) {
            return new Invalid(text);
        }

        final int degrees = significant.isEmpty() ? 0 : Integer.parseInt(significant);
        if (!Azimuth.isRepresentable(degrees)) {
            return new Invalid(text);
        }
        return new MoveTo(Azimuth.of(degrees));
    }

    private static boolean isStop(String text)
    {
        return text.equalsIgnoreCase("S")
                || text.equalsIgnoreCase("STOP")
                || text.equals(";");
    }

    private static int digitRunEnd(String text, int from)
    {
        int i = from;
        while (i < text.length() && isAsciiDigit(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isAsciiDigit(char c)
    {
        return c >= '0' && c <= '9';
    }

    private static String stripLeadingZeros(String digits)
    {
        int i = 0;
        while (i < digits.length() && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
