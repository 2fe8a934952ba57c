package com.questrail.rotator.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class AsciiTextTest
{
    @Test
    void lenientDecodeDropsHighBytes()
    {
        assertEquals("AZ", AsciiText.decodeLenient(new byte[] { 'A', (byte) 0xE9, 'Z' }));
        assertEquals("", AsciiText.decodeLenient(null));
    }

    @Test
    void escapeShowsControlCharacters()
    {
        assertEquals("AI1\\r;", AsciiText.escape("AI1\r;"));
        assertEquals("OK\\r\\n", AsciiText.escape("OK\r\n"));
        assertEquals("\\x00\\x1b", AsciiText.escape("\u0000\u001b"));
    }
}
