package com.questrail.rotator.transport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * FakeClientConnection
 * -----------------------------------------------------------------------------
 * Test-only {@link ClientConnection}. Each scripted input is returned by one
 * {@link #receive()}; once the script is exhausted the client "disconnects"
 * (empty read). Replies are recorded as text.
 */
public final class FakeClientConnection implements ClientConnection {

    private final Deque<Object> inbound = new ArrayDeque<>();
    private final List<String> replies = new ArrayList<>();

    private IOException sendFailure;
    private int receiveCount;
    private int closeCount;
    private int sendsAfterClose;

    public static FakeClientConnection sending(String... commands) {
        FakeClientConnection client = new FakeClientConnection();
        for (String c : commands) {
            client.thenSend(c);
        }
        return client;
    }

    public FakeClientConnection thenSend(String command) {
        inbound.add(command.getBytes(StandardCharsets.US_ASCII));
        return this;
    }

    public FakeClientConnection thenSendBytes(byte[] raw) {
        inbound.add(raw);
        return this;
    }

    public FakeClientConnection thenFail(IOException failure) {
        inbound.add(failure);
        return this;
    }

    public FakeClientConnection failSends(IOException failure) {
        this.sendFailure = failure;
        return this;
    }

    @Override
    public byte[] receive() throws IOException {
        receiveCount++;
        Object next = inbound.poll();
        if (next == null) {
            return new byte[0];
        }
        if (next instanceof IOException e) {
            throw e;
        }
        return (byte[]) next;
    }

    @Override
    public void send(byte[] payload) throws IOException {
        if (closeCount > 0) {
            sendsAfterClose++;
        }
        if (sendFailure != null) {
            throw sendFailure;
        }
        replies.add(new String(payload, StandardCharsets.US_ASCII));
    }

    @Override
    public void close() {
        closeCount++;
    }

    @Override
    public String describe() {
        return "fake-client";
    }

    public List<String> replies() {
        return Collections.unmodifiableList(replies);
    }

    public int receiveCount() {
        return receiveCount;
    }

    public int closeCount() {
        return closeCount;
    }

    public int sendsAfterClose() {
        return sendsAfterClose;
    }
}
