package com.questrail.rotator.transport.tcp;

import com.questrail.rotator.transport.BackendLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SocketBackendLink
 * -----------------------------------------------------------------------------
 * Blocking TCP implementation of {@link BackendLink}.
 *
 * <p>Read timeouts are applied per call through {@link Socket#setSoTimeout(int)},
 * so a short acknowledgment window never leaks into a later unbounded query.</p>
 *
 * <p>Closing the link from another thread is the only way to abort a read that
 * is already blocked.</p>
 */
public final class SocketBackendLink implements BackendLink
{
    private static final Logger log = LoggerFactory.getLogger(SocketBackendLink.class);

    private final InetSocketAddress address;
    private final Socket socket;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SocketBackendLink(InetSocketAddress address)
    {
        this.address = Objects.requireNonNull(address, "address");
        this.socket = new Socket();
    }

    @Override
    public void connect(Duration timeout) throws IOException
    {
        Objects.requireNonNull(timeout, "timeout");
        // Configured addresses are unresolved; resolve on each connect so DNS changes are picked up.
        InetSocketAddress target = address.isUnresolved()
                ? new InetSocketAddress(address.getHostString(), address.getPort())
                : address;
        if (target.isUnresolved()) {
            throw new UnknownHostException(address.getHostString());
        }
        socket.connect(target, toMillis(timeout));
    }

    @Override
    public void send(byte[] payload) throws IOException
    {
        Objects.requireNonNull(payload, "payload");
        socket.getOutputStream().write(payload);
        socket.getOutputStream().flush();
    }

    @Override
    public byte[] receive(Duration timeout) throws IOException
    {
        Objects.requireNonNull(timeout, "timeout");
        socket.setSoTimeout(toMillis(timeout));

        byte[] buffer = new byte[READ_BUFFER_SIZE];
        int n = socket.getInputStream().read(buffer);
        if (n <= 0) {
            return new byte[0];
        }
        return Arrays.copyOf(buffer, n);
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            socket.close();
        }
        catch (IOException e) {
            log.debug("Error closing device socket {}", address, e);
        }
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return address;
    }

    /** {@link Duration#ZERO} maps to the socket API's "infinite" (0). */
    private static int toMillis(Duration timeout)
    {
        if (timeout.isZero() || timeout.isNegative()) {
            return 0;
        }
        long millis = Math.max(1, timeout.toMillis());
        return (int) Math.min(Integer.MAX_VALUE, millis);
    }
}
