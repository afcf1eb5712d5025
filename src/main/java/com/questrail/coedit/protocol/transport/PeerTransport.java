package com.questrail.coedit.protocol.transport;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Optional;

/**
 * PeerTransport
 * -----------------------------------------------------------------------------
 * Minimal port for a stream transport that carries exactly one peer
 * connection at a time.
 *
 * <p>The transport either listens for a single peer (host side) or dials a
 * single peer (client side). Higher layers are responsible for:</p>
 * <ul>
 *   <li>wrapping each {@link PeerConnection} in a framed link</li>
 *   <li>turning lifecycle callbacks into session events</li>
 *   <li>deciding when to listen, dial or close</li>
 * </ul>
 *
 * <p>All operations are non-blocking. Outcomes are reported through the
 * {@link PeerTransportListener}. Implementations may be backed by Netty,
 * java.nio or a test harness.</p>
 */
public interface PeerTransport
{
    /**
     * Register the listener that receives lifecycle events and inbound bytes.
     *
     * <p>This must be called before {@link #listen} or {@link #connect}.</p>
     */
    void setListener(PeerTransportListener listener);

    /**
     * Begin listening for a peer.
     *
     * <p>Exactly one of {@link PeerTransportListener#onListening} or
     * {@link PeerTransportListener#onListenFailed} follows, unless
     * {@link #closeAll()} cancels the attempt first.</p>
     *
     * <p>While listening, each newly accepted connection replaces the current
     * one: the previous connection is aborted before the new one is
     * announced.</p>
     */
    void listen(InetSocketAddress bindAddress);

    /**
     * Dial a host.
     *
     * <p>Exactly one of {@link PeerTransportListener#onConnected} or
     * {@link PeerTransportListener#onConnectFailed} follows, unless
     * {@link #closeAll()} cancels the attempt first.</p>
     *
     * @param remote host address, possibly unresolved
     * @param timeout bound on the connection attempt
     */
    void connect(InetSocketAddress remote, Duration timeout);

    /**
     * Abort the current connection, stop listening and cancel pending
     * listen/dial attempts. Safe to call in any state, any number of times.
     */
    void closeAll();

    /**
     * The address actually bound while listening, if any.
     */
    Optional<InetSocketAddress> listeningAddress();

    /**
     * Release all transport resources. The transport cannot be reused.
     */
    void shutdown();
}
