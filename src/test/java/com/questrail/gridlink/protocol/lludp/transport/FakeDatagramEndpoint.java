package com.questrail.gridlink.protocol.lludp.transport;

import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeDatagramEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link DatagramEndpoint} implementation.
 *
 * <p>Contains no LLUDP semantics: it stores outbound datagrams and lets tests
 * inject inbound ones. {@link #failBindWith(Throwable)} makes {@link #start()}
 * report a bind failure instead of coming up.</p>
 */
public final class FakeDatagramEndpoint implements DatagramEndpoint {

    public record Sent(SocketAddress remote, byte[] payload) {}

    private DatagramEndpointListener listener;
    private final List<Sent> sent = new ArrayList<>();
    private Throwable bindFailure;
    private boolean started;
    private boolean stopped;

    public FakeDatagramEndpoint failBindWith(Throwable cause) {
        this.bindFailure = cause;
        return this;
    }

    @Override
    public void setListener(DatagramEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        started = true;
        if (listener == null) {
            return;
        }
        if (bindFailure != null) {
            listener.onTransportDown(bindFailure);
        } else {
            listener.onTransportUp();
        }
    }

    @Override
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        if (listener != null) {
            listener.onTransportDown(null);
        }
    }

    @Override
    public void send(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        if (stopped) {
            return;
        }
        sent.add(new Sent(remote, payload.clone()));
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void injectDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        listener.onDatagram(remote, payload);
    }

    /**
     * Simulate the socket failing underneath the circuit.
     */
    public void failTransport(Throwable cause) {
        listener.onTransportDown(cause);
    }

    public List<Sent> sent() {
        return Collections.unmodifiableList(sent);
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isStopped() {
        return stopped;
    }

    public void clear() {
        sent.clear();
    }
}
