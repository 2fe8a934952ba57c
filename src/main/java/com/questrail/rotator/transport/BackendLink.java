package com.questrail.rotator.transport;

import java.io.IOException;
import java.net.SocketAddress;
import java.time.Duration;

/**
 * BackendLink
 * -----------------------------------------------------------------------------
 * Minimal port for the rotator device side of a translator session.
 *
 * <p>A link is opened once and used for the session's whole lifetime. It never
 * reconnects on its own.</p>
 */
public interface BackendLink
{
    /** Maximum number of bytes returned by one {@link #receive(Duration)}. */
    int READ_BUFFER_SIZE = 1024;

    /**
     * Open the connection, giving up after {@code timeout}.
     *
     * @throws IOException if the device cannot be reached in time
     */
    void connect(Duration timeout) throws IOException;

    /**
     * Write {@code payload} to the device.
     */
    void send(byte[] payload) throws IOException;

    /**
     * Block for one read from the device.
     *
     * @param timeout maximum wait; {@link Duration#ZERO} waits indefinitely
     * @return the bytes read; an empty array if the device closed the connection
     * @throws java.net.SocketTimeoutException if nothing arrived within {@code timeout}
     * @throws IOException on any other read failure
     */
    byte[] receive(Duration timeout) throws IOException;

    /**
     * Release the connection. Idempotent; never throws.
     */
    void close();

    /**
     * The device address this link dials.
     */
    SocketAddress remoteAddress();
}
