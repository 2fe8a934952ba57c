package com.questrail.rotator.server;

import com.questrail.rotator.session.CancellationToken;
import com.questrail.rotator.session.TranslatorSession;
import com.questrail.rotator.session.TranslatorSessionFactory;
import com.questrail.rotator.transport.ClientConnection;
import com.questrail.rotator.transport.tcp.SocketClientConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TranslatorListener
 * =============================================================================
 * Accepts K4 client connections and runs one {@link TranslatorSession} per
 * connection on its own thread.
 *
 * <p>There is no bound on concurrent sessions, and each session dials its own
 * device connection. An RT21 controller that only admits one connection at a
 * time will refuse (or queue) the second of two concurrent clients; that
 * session then aborts while the first keeps working.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   start()  → bind, then accept on a dedicated thread until cancelled
 *   stop()   → cancel token, close server socket, close live sessions,
 *              shut down session threads
 * </pre>
 * Live sessions are closed from the stopping thread, which releases any read
 * they are blocked in.
 */
public final class TranslatorListener {
    private static final Logger log = LoggerFactory.getLogger(TranslatorListener.class);

    static final int BACKLOG = 5;

    private final int port;
    private final TranslatorSessionFactory sessionFactory;
    private final CancellationToken cancellation;
    private final AtomicInteger sessionCounter = new AtomicInteger(1);
    private final Set<TranslatorSession> activeSessions = ConcurrentHashMap.newKeySet();

    private volatile ServerSocket serverSocket;
    private volatile ExecutorService sessionExecutor;
    private volatile Thread acceptThread;

    public TranslatorListener(int port, TranslatorSessionFactory sessionFactory, CancellationToken cancellation) {
        this.port = port;
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
    }

    /**
     * Bind the listening socket and start accepting.
     *
     * @throws IOException if the port cannot be bound
     * @throws IllegalStateException if already started
     */
    public synchronized void start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Listener already started");
        }

        ServerSocket ss = new ServerSocket();
        try {
            ss.setReuseAddress(true);
            ss.bind(new InetSocketAddress(port), BACKLOG);
        } catch (IOException e) {
            ss.close();
            throw e;
        }

        serverSocket = ss;
        sessionExecutor = Executors.newCachedThreadPool(new SessionThreadFactory());
        acceptThread = new Thread(this::acceptLoop, "rotator-listener");
        acceptThread.start();

        log.info("Protocol translator listening on port {}", ss.getLocalPort());
    }

    /**
     * Port actually bound; useful when configured with port 0.
     */
    public int localPort() {
        ServerSocket ss = serverSocket;
        if (ss == null) {
            throw new IllegalStateException("Listener not started");
        }
        return ss.getLocalPort();
    }

    public synchronized void stop() {
        cancellation.cancel();

        ServerSocket ss = serverSocket;
        if (ss != null) {
            try {
                ss.close();
            } catch (IOException e) {
                log.debug("Error closing listening socket", e);
            }
        }

        Thread t = acceptThread;
        if (t != null) {
            try {
                t.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        for (TranslatorSession session : activeSessions) {
            session.close();
        }

        ExecutorService exec = sessionExecutor;
        if (exec != null) {
            exec.shutdownNow();
            try {
                if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Some sessions are still blocked in I/O after shutdown");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void acceptLoop() {
        ServerSocket ss = serverSocket;
        while (!cancellation.isCancelled()) {
            final Socket socket;
            try {
                socket = ss.accept();
            } catch (IOException e) {
                if (!cancellation.isCancelled()) {
                    log.error("Accept error: {}", e.getMessage(), e);
                }
                if (ss.isClosed()) {
                    break;
                }
                continue;
            }

            ClientConnection client = new SocketClientConnection(socket);
            String sessionId = "session-" + sessionCounter.getAndIncrement();
            log.info("[{}] Client connected: {}", sessionId, client.describe());

            TranslatorSession session = null;
            try {
                session = sessionFactory.create(sessionId, client);
                activeSessions.add(session);
                sessionExecutor.execute(tracked(session));
            } catch (RuntimeException e) {
                log.error("[{}] Could not start session", sessionId, e);
                if (session != null) {
                    activeSessions.remove(session);
                    session.close();
                } else {
                    client.close();
                }
            }
        }
        log.info("Listener stopped accepting");
    }

    private Runnable tracked(TranslatorSession session) {
        return () -> {
            try {
                session.run();
            } finally {
                activeSessions.remove(session);
            }
        };
    }

    int activeSessionCount() {
        return activeSessions.size();
    }

    private static final class SessionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "rotator-session-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
