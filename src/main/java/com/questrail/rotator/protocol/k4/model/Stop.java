package com.questrail.rotator.protocol.k4.model;

/**
 * Stop request ({@code S}, {@code STOP} or {@code ;}).
 */
public record Stop() implements K4Command
{
}
