package com.questrail.coedit.protocol.transport;

import java.net.InetSocketAddress;

/**
 * PeerTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link PeerTransport}.
 *
 * <p>Callbacks for one connection are delivered serially and in order.
 * Callbacks for different connections may interleave (a replaced host-side
 * connection may report its closure after its successor was announced);
 * receivers use {@link PeerConnection#linkId()} to tell them apart.</p>
 */
public interface PeerTransportListener
{
    /** The host socket is bound and accepting. */
    void onListening(InetSocketAddress localAddress);

    /** The host socket could not be bound. */
    void onListenFailed(Throwable cause);

    /** A peer connected to the listening socket. */
    void onPeerAccepted(PeerConnection connection);

    /** An outbound dial succeeded. */
    void onConnected(PeerConnection connection);

    /** An outbound dial failed or timed out. */
    void onConnectFailed(Throwable cause);

    /**
     * Bytes arrived on a connection.
     *
     * <p>The array is owned by the receiver. Its boundaries mean nothing:
     * it may hold part of a frame or several frames.</p>
     */
    void onBytes(long linkId, byte[] bytes);

    /**
     * A connection closed, for any reason.
     *
     * @param cause the error that closed it, or {@code null} for an orderly close
     */
    void onPeerClosed(long linkId, Throwable cause);
}
