package com.questrail.coedit.protocol.transport;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FakePeerTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link PeerTransport}.
 *
 * <p>Records what the session asked for and lets the test decide when and how
 * each request completes. All callbacks run on the test thread.</p>
 */
public final class FakePeerTransport implements PeerTransport {

    private PeerTransportListener listener;
    private final List<InetSocketAddress> listenRequests = new ArrayList<>();
    private final List<InetSocketAddress> connectRequests = new ArrayList<>();
    private final List<Duration> connectTimeouts = new ArrayList<>();
    private final List<FakePeerConnection> connections = new ArrayList<>();

    private InetSocketAddress bound;
    private FakePeerConnection current;
    private long nextLinkId = 1;
    private int closeAllCount;
    private boolean shutdown;
    private RuntimeException rejection;

    @Override
    public void setListener(PeerTransportListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void listen(InetSocketAddress bindAddress) {
        listenRequests.add(bindAddress);
        throwIfRejecting();
    }

    @Override
    public void connect(InetSocketAddress remote, Duration timeout) {
        connectRequests.add(remote);
        connectTimeouts.add(timeout);
        throwIfRejecting();
    }

    @Override
    public void closeAll() {
        closeAllCount++;
        bound = null;
        if (current != null) {
            FakePeerConnection closing = current;
            current = null;
            closing.abort();
        }
    }

    @Override
    public Optional<InetSocketAddress> listeningAddress() {
        return Optional.ofNullable(bound);
    }

    @Override
    public void shutdown() {
        closeAll();
        shutdown = true;
    }

    // ---------------------------------------------------------------------
    // Test helpers: complete requests
    // ---------------------------------------------------------------------

    /**
     * Make the next listen/connect throw synchronously, as a transport that
     * rejects the request outright would.
     */
    public void rejectNextRequest(RuntimeException cause) {
        rejection = cause;
    }

    private void throwIfRejecting() {
        RuntimeException cause = rejection;
        rejection = null;
        if (cause != null) {
            throw cause;
        }
    }

    public void completeListen(int port) {
        bound = new InetSocketAddress("127.0.0.1", port);
        listener().onListening(bound);
    }

    public void failListen(Throwable cause) {
        listener().onListenFailed(cause);
    }

    /**
     * A client connects. Any current connection is aborted first, as the real
     * transport does, but its closure is only reported when the test calls
     * {@link #peerClosed}.
     */
    public FakePeerConnection acceptPeer() {
        FakePeerConnection connection = newConnection();
        listener().onPeerAccepted(connection);
        return connection;
    }

    public FakePeerConnection completeConnect() {
        FakePeerConnection connection = newConnection();
        listener().onConnected(connection);
        return connection;
    }

    public void failConnect(Throwable cause) {
        listener().onConnectFailed(cause);
    }

    public void deliver(long linkId, byte[] bytes) {
        listener().onBytes(linkId, bytes);
    }

    public void peerClosed(long linkId, Throwable cause) {
        if (current != null && current.linkId() == linkId) {
            current = null;
        }
        listener().onPeerClosed(linkId, cause);
    }

    // ---------------------------------------------------------------------
    // Test helpers: inspection
    // ---------------------------------------------------------------------

    public List<InetSocketAddress> listenRequests() {
        return List.copyOf(listenRequests);
    }

    public List<InetSocketAddress> connectRequests() {
        return List.copyOf(connectRequests);
    }

    public List<Duration> connectTimeouts() {
        return List.copyOf(connectTimeouts);
    }

    public List<FakePeerConnection> connections() {
        return List.copyOf(connections);
    }

    public int closeAllCount() {
        return closeAllCount;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private FakePeerConnection newConnection() {
        FakePeerConnection previous = current;
        FakePeerConnection connection = new FakePeerConnection(nextLinkId++);
        connections.add(connection);
        current = connection;
        if (previous != null) {
            previous.abort();
        }
        return connection;
    }

    private PeerTransportListener listener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
