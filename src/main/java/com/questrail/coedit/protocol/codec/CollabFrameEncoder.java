package com.questrail.coedit.protocol.codec;

import com.questrail.coedit.protocol.model.CollabMessage;

/**
 * CollabFrameEncoder
 * -----------------------------------------------------------------------------
 * Outbound wire boundary: turns one {@link CollabMessage} into one
 * self-delimited frame.
 *
 * <p>The encoder does not decide what to send. It applies the mechanical
 * rules of the envelope and the length prefix only.</p>
 */
public interface CollabFrameEncoder
{
    /**
     * Encode a message into a wire-ready frame.
     *
     * <p>The returned bytes are suitable for immediate transmission on a
     * stream transport without further modification.</p>
     *
     * @param message message to encode
     * @return complete frame bytes, length prefix included
     */
    byte[] encode(CollabMessage message);
}
