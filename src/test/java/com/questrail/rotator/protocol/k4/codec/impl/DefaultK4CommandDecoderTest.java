package com.questrail.rotator.protocol.k4.codec.impl;

import com.questrail.rotator.protocol.k4.codec.K4CommandDecoder;
import com.questrail.rotator.protocol.k4.model.Invalid;
import com.questrail.rotator.protocol.k4.model.K4Command;
import com.questrail.rotator.protocol.k4.model.MoveTo;
import com.questrail.rotator.protocol.k4.model.Query;
import com.questrail.rotator.protocol.k4.model.Stop;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultK4CommandDecoderTest
{
    private final K4CommandDecoder decoder = new DefaultK4CommandDecoder();

    private K4Command parse(String text)
    {
        return decoder.decode(text.getBytes(StandardCharsets.US_ASCII));
    }

    @Test
    void queryIsCaseInsensitiveAndTrimmed()
    {
        assertEquals(new Query(), parse("C"));
        assertEquals(new Query(), parse("c"));
        assertEquals(new Query(), parse(" c "));
        assertEquals(new Query(), parse("C\r\n"));
    }

    @Test
    void queryMatchesOnPrefixOnly()
    {
        assertEquals(new Query(), parse("C2"));
        assertEquals(new Query(), parse("cstop"));
    }

    @Test
    void moveParsesDigitRunWithLeadingZeros()
    {
        assertEquals(MoveTo.degrees(30), parse("M030"));
        assertEquals(MoveTo.degrees(7), parse("m7"));
        assertEquals(MoveTo.degrees(0), parse("M000"));
        assertEquals(MoveTo.degrees(359), parse("M359\r\n"));
    }

    @Test
    void moveIgnoresTextAfterDigitRun()
    {
        assertEquals(MoveTo.degrees(120), parse("M120;"));
        assertEquals(MoveTo.degrees(12), parse("M12X5"));
    }

    @Test
    void moveWithoutDigitsIsInvalid()
    {
        assertInstanceOf(Invalid.class, parse("M"));
        assertInstanceOf(Invalid.class, parse("MX30"));
        assertInstanceOf(Invalid.class, parse("M 30"));
    }

    @Test
    void moveBeyondThreeDigitFieldIsInvalidNotTruncated()
    {
        assertInstanceOf(Invalid.class, parse("M1000"));
        assertInstanceOf(Invalid.class, parse("M99999999999999999999"));

        // leading zeros do not count against the field width
        assertEquals(MoveTo.degrees(999), parse("M000999"));
    }

    @Test
    void stopForms()
    {
        assertEquals(new Stop(), parse("S"));
        assertEquals(new Stop(), parse("s"));
        assertEquals(new Stop(), parse("stop"));
        assertEquals(new Stop(), parse("STOP"));
        assertEquals(new Stop(), parse(";"));
        assertEquals(new Stop(), parse(" ;\r\n"));
    }

    @Test
    void stopMustMatchExactly()
    {
        assertInstanceOf(Invalid.class, parse("SX"));
        assertInstanceOf(Invalid.class, parse("STOPPED"));
        assertInstanceOf(Invalid.class, parse(";;"));
    }

    @Test
    void unrecognizedInputIsInvalid()
    {
        assertInstanceOf(Invalid.class, parse(""));
        assertInstanceOf(Invalid.class, parse("   "));
        assertInstanceOf(Invalid.class, parse("XYZ"));

        Invalid junk = assertInstanceOf(Invalid.class, parse(" JUNK\r\n"));
        assertEquals("JUNK", junk.text());
    }

    @Test
    void nonAsciiBytesAreDroppedNotRejected()
    {
        byte[] raw = new byte[] { (byte) 0xFF, 'M', (byte) 0x80, '4', '5' };

        assertEquals(MoveTo.degrees(45), decoder.decode(raw));
    }

    @Test
    void nullAndEmptyInputNeverThrow()
    {
        assertInstanceOf(Invalid.class, decoder.decode(null));
        assertInstanceOf(Invalid.class, decoder.decode(new byte[0]));
    }

    @Test
    void onlyRecognizedCommandsAreForwarded()
    {
        assertTrue(parse("C").isForwarded());
        assertTrue(parse("M090").isForwarded());
        assertTrue(parse("S").isForwarded());
        assertFalse(parse("JUNK").isForwarded());
    }
}
