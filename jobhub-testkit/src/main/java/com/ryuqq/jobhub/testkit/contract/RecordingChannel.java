package com.ryuqq.jobhub.testkit.contract;

import com.ryuqq.jobhub.core.model.ConnectionId;
import com.ryuqq.jobhub.core.spi.ConnectionChannel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ConnectionChannel} that records everything written to it.
 *
 * <p>Stands in for a real socket in contract tests. Once terminated or closed,
 * {@link #isOpen()} turns false and further writes are dropped.</p>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public class RecordingChannel implements ConnectionChannel {

    private final ConnectionId id;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private final AtomicInteger pings = new AtomicInteger();
    private volatile boolean open = true;
    private volatile boolean terminated;
    private volatile int closeCode = -1;

    public RecordingChannel() {
        this(ConnectionId.random());
    }

    public RecordingChannel(ConnectionId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        this.id = id;
    }

    @Override
    public ConnectionId id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void sendText(String payload) {
        if (open) {
            sent.add(payload);
        }
    }

    @Override
    public void ping() {
        if (open) {
            pings.incrementAndGet();
        }
    }

    @Override
    public void terminate() {
        terminated = true;
        open = false;
    }

    @Override
    public void close(int code, String reason) {
        closeCode = code;
        open = false;
    }

    /**
     * Payloads written so far, in write order.
     */
    public List<String> sent() {
        return List.copyOf(sent);
    }

    public int pingCount() {
        return pings.get();
    }

    public boolean isTerminated() {
        return terminated;
    }

    /**
     * Close code passed to {@link #close(int, String)}, or -1 if never closed that way.
     */
    public int closeCode() {
        return closeCode;
    }
}
