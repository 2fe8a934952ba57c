package com.questrail.rotator.transport.tcp;

import com.questrail.rotator.transport.BackendLink;
import com.questrail.rotator.transport.ClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ClientConnection} over an accepted blocking {@link Socket}.
 */
public final class SocketClientConnection implements ClientConnection
{
    private static final Logger log = LoggerFactory.getLogger(SocketClientConnection.class);

    private final Socket socket;
    private final String description;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SocketClientConnection(Socket socket)
    {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.description = String.valueOf(socket.getRemoteSocketAddress());
    }

    @Override
    public byte[] receive() throws IOException
    {
        InputStream in = socket.getInputStream();
        byte[] buffer = new byte[BackendLink.READ_BUFFER_SIZE];
        int n = in.read(buffer);
        if (n <= 0) {
            return new byte[0];
        }
        return Arrays.copyOf(buffer, n);
    }

    @Override
    public void send(byte[] payload) throws IOException
    {
        Objects.requireNonNull(payload, "payload");
        OutputStream out = socket.getOutputStream();
        out.write(payload);
        out.flush();
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
            log.debug("Error closing client socket {}", description, e);
        }
    }

    @Override
    public String describe()
    {
        return description;
    }
}
