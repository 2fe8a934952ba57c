package com.questrail.rotator.protocol;

import java.nio.charset.StandardCharsets;

/**
 * AsciiText
 * -----------------------------------------------------------------------------
 * Lenient ASCII helpers shared by the K4 and RT21 codecs.
 *
 * <p>Both protocols are 7-bit text. Bytes outside the ASCII range are dropped
 * rather than rejected, so a stray high byte on the line never turns into a
 * decode failure.</p>
 */
public final class AsciiText
{
    private AsciiText() {}

    /**
     * Decodes {@code raw} as ASCII, silently dropping any byte above {@code 0x7F}.
     *
     * @param raw raw bytes; {@code null} is treated as empty
     * @return decoded text, never {@code null}
     */
    public static String decodeLenient(byte[] raw)
    {
        if (raw == null || raw.length == 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder(raw.length);
        for (byte b : raw) {
            if (b >= 0) {
                sb.append((char) b);
            }
        }
        return sb.toString();
    }

    /**
     * Encodes {@code text} as ASCII bytes.
     */
    public static byte[] encode(String text)
    {
        return text.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Renders control characters visibly ({@code \r}, {@code \n}, {@code \t},
     * {@code \xNN}) for log output.
     */
    public static String escape(String text)
    {
        if (text == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\r' -> sb.append("\\r");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\\' -> sb.append("\\\\");
                default -> {
                    if (c < 0x20 || c == 0x7F) {
                        sb.append(String.format("\\x%02x", (int) c));
                    }
                    else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }

    /**
     * Convenience overload of {@link #escape(String)} for raw bytes.
     */
    public static String escape(byte[] raw)
    {
        return escape(decodeLenient(raw));
    }
}
