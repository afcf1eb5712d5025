package com.questrail.coedit.protocol.transport;

import java.net.SocketAddress;

/**
 * One live peer socket, as seen from above the transport.
 *
 * <p>Link ids are unique for the lifetime of a transport and increase with
 * every accepted or dialed socket, so a callback about a replaced connection
 * can always be told apart from one about the current connection.</p>
 */
public interface PeerConnection
{
    long linkId();

    SocketAddress remoteAddress();

    boolean isOpen();

    /**
     * Queue bytes for transmission. Fire-and-forget: completion is not awaited.
     *
     * @throws PeerWriteException if the connection is not open or the write
     *         is rejected immediately
     */
    void write(byte[] bytes);

    /**
     * Close immediately, discarding unsent data. Idempotent.
     */
    void abort();
}
