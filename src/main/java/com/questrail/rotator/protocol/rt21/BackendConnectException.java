package com.questrail.rotator.protocol.rt21;

import java.net.SocketAddress;

/**
 * Indicates that the RT21 device connection could not be opened.
 *
 * <p>This is fatal to the session that attempted it; no client command is
 * served without a device connection.</p>
 */
public final class BackendConnectException extends RuntimeException
{
    private final SocketAddress address;

    public BackendConnectException(SocketAddress address, Throwable cause)
    {
        super("Could not connect to RT21 device at " + address + ": " + cause.getMessage(), cause);
        this.address = address;
    }

    public SocketAddress address()
    {
        return address;
    }
}
