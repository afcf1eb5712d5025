package com.questrail.coedit.protocol.transport;

/**
 * Indicates that bytes could not be handed to a peer connection.
 *
 * <p>From the process's point of view this is recoverable: the session ends,
 * the process carries on.</p>
 */
public final class PeerWriteException extends RuntimeException
{
    public PeerWriteException(String message)
    {
        super(message);
    }

    public PeerWriteException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
