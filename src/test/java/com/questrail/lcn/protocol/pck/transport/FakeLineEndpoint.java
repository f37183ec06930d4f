package com.questrail.lcn.protocol.pck.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeLineEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link LineEndpoint} implementation.
 *
 * <p>Contains no PCK semantics; it records outbound lines and lets tests
 * inject inbound lines and transport failures.</p>
 */
public final class FakeLineEndpoint implements LineEndpoint {

    private LineEndpointListener listener;
    private final List<String> sent = new ArrayList<>();
    private boolean up;
    private boolean autoUp = true;
    private int starts;

    @Override
    public void setListener(LineEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Comes up immediately unless {@link #holdStart()} was called.
     */
    @Override
    public void start() {
        starts++;
        if (autoUp) {
            bringUp();
        }
    }

    @Override
    public void stop() {
        if (up) {
            up = false;
            listener.onTransportDown(null);
        }
    }

    @Override
    public synchronized void send(String line) {
        Objects.requireNonNull(line, "line");
        if (up) {
            sent.add(line);
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void holdStart() {
        autoUp = false;
    }

    public void bringUp() {
        up = true;
        listener.onTransportUp();
    }

    public void fail(Throwable cause) {
        up = false;
        listener.onTransportDown(cause);
    }

    public void inject(String... lines) {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        for (String line : lines) {
            listener.onLine(line);
        }
    }

    public boolean isUp() {
        return up;
    }

    public int starts() {
        return starts;
    }

    public synchronized List<String> sent() {
        return Collections.unmodifiableList(new ArrayList<>(sent));
    }

    public synchronized String lastSent() {
        return sent.isEmpty() ? null : sent.get(sent.size() - 1);
    }

    public synchronized void clear() {
        sent.clear();
    }
}
