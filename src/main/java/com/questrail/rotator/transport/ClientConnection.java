package com.questrail.rotator.transport;

import java.io.IOException;

/**
 * ClientConnection
 * -----------------------------------------------------------------------------
 * Minimal port for the client side of a translator session.
 */
public interface ClientConnection
{
    /**
     * Block until the client sends data.
     *
     * @return the bytes of one read; an empty array signals an orderly disconnect
     * @throws IOException if the connection fails
     */
    byte[] receive() throws IOException;

    /**
     * Write a complete reply to the client.
     */
    void send(byte[] payload) throws IOException;

    /**
     * Release the connection. Idempotent; never throws.
     */
    void close();

    /**
     * Human-readable peer description for diagnostics.
     */
    String describe();
}
