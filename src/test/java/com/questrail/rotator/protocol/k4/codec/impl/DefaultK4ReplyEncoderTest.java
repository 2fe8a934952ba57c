package com.questrail.rotator.protocol.k4.codec.impl;

import com.questrail.rotator.protocol.k4.model.Invalid;
import com.questrail.rotator.protocol.k4.model.MoveTo;
import com.questrail.rotator.protocol.k4.model.Query;
import com.questrail.rotator.protocol.k4.model.Stop;
import com.questrail.rotator.translation.TranslationResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultK4ReplyEncoderTest
{
    private static final TranslationResult BROKEN_PIPE =
            new TranslationResult.Failed("RT21 communication failed", new IOException("Broken pipe"));

    private final DefaultK4ReplyEncoder encoder = new DefaultK4ReplyEncoder();

    private static String text(byte[] reply)
    {
        return new String(reply, StandardCharsets.US_ASCII);
    }

    @Test
    void positionIsReportedAsThreeDigitAzimuth()
    {
        assertEquals("AZ=045\r\n",
                text(encoder.encode(new Query(), new TranslationResult.Position(45))));
        assertEquals("AZ=000\r\n",
                text(encoder.encode(new Query(), new TranslationResult.Position(0))));
    }

    @Test
    void readingsBeyondThreeDigitsAreNotTruncated()
    {
        assertEquals("AZ=1234\r\n",
                text(encoder.encode(new Query(), new TranslationResult.Position(1234))));
    }

    @Test
    void failedQueryIsError()
    {
        assertEquals("ERROR\r\n",
                text(encoder.encode(new Query(), new TranslationResult.Failed("no digits"))));
    }

    @Test
    void moveAndStopAreAlwaysOkByDefault()
    {
        assertFalse(encoder.reportsMoveFailures());

        assertEquals("OK\r\n", text(encoder.encode(MoveTo.degrees(200), TranslationResult.Acknowledged.silent())));
        assertEquals("OK\r\n", text(encoder.encode(new Stop(), new TranslationResult.Acknowledged(Optional.of(";")))));

        // a failed device write is still answered with OK
        assertEquals("OK\r\n", text(encoder.encode(MoveTo.degrees(200), BROKEN_PIPE)));
        assertEquals("OK\r\n", text(encoder.encode(new Stop(), BROKEN_PIPE)));
    }

    @Test
    void moveFailuresBecomeErrorWhenReportingIsEnabled()
    {
        DefaultK4ReplyEncoder strict = new DefaultK4ReplyEncoder(true);

        assertEquals("ERROR\r\n", text(strict.encode(new Stop(), BROKEN_PIPE)));
        assertEquals("ERROR\r\n", text(strict.encode(MoveTo.degrees(10), BROKEN_PIPE)));
        assertEquals("OK\r\n", text(strict.encode(MoveTo.degrees(10), TranslationResult.Acknowledged.silent())));
    }

    @Test
    void invalidIsErrorRegardlessOfResult()
    {
        assertEquals("ERROR\r\n",
                text(encoder.encode(new Invalid("JUNK"), TranslationResult.Acknowledged.silent())));
        assertEquals("ERROR\r\n",
                text(encoder.encode(new Invalid("JUNK"), new TranslationResult.Failed("Unrecognized command"))));
    }
}
