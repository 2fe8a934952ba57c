package com.questrail.rotator.protocol.rt21.codec.impl;

import com.questrail.rotator.protocol.rt21.codec.Rt21ResponseDecoder;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultRt21ResponseDecoderTest
{
    private final Rt21ResponseDecoder decoder = new DefaultRt21ResponseDecoder();

    private OptionalInt decode(String text)
    {
        return decoder.decodePosition(text.getBytes(StandardCharsets.US_ASCII));
    }

    @Test
    void firstDigitRunIsTheAzimuth()
    {
        assertEquals(OptionalInt.of(30), decode("030;"));
        assertEquals(OptionalInt.of(45), decode("045;"));
        assertEquals(OptionalInt.of(180), decode("AZ 180 deg;"));
        assertEquals(OptionalInt.of(12), decode(";12;345;"));
    }

    @Test
    void zeroIsAValidReading()
    {
        assertEquals(OptionalInt.of(0), decode("000;"));
    }

    @Test
    void replyWithoutDigitsIsFailureNotZero()
    {
        assertEquals(OptionalInt.empty(), decode(";;;no digits"));
        assertEquals(OptionalInt.empty(), decode(""));
        assertEquals(OptionalInt.empty(), decoder.decodePosition(new byte[0]));
    }

    @Test
    void readingsAboveThreeDigitsAreKept()
    {
        assertEquals(OptionalInt.of(1000), decode("1000;"));
        assertEquals(OptionalInt.of(1234), decode("1234;"));
        assertEquals(OptionalInt.of(Integer.MAX_VALUE), decode("2147483647;"));
    }

    @Test
    void runTooLongForAnIntIsFailure()
    {
        assertEquals(OptionalInt.empty(), decode("2147483648;"));
        assertEquals(OptionalInt.empty(), decode("123456789012345678901234567890;"));
    }

    @Test
    void nonAsciiBytesAreIgnored()
    {
        byte[] raw = new byte[] { (byte) 0xC3, '2', '7', '0', ';' };

        assertEquals(OptionalInt.of(270), decoder.decodePosition(raw));
    }
}
