package com.questrail.coedit.protocol.link;

import com.questrail.coedit.protocol.codec.FramingException;
import com.questrail.coedit.protocol.model.CollabMessage;

/**
 * Receives what a {@link PeerLink} reads from its peer.
 *
 * <p>Calls for one link are made serially, in wire order.</p>
 */
public interface PeerLinkListener
{
    /** A complete message arrived. */
    void onMessage(PeerLink link, CollabMessage message);

    /** A malformed frame was skipped; the link is still open. */
    default void onFrameDiscarded(PeerLink link, FramingException cause) {}

    /**
     * The link closed. Called exactly once per link.
     *
     * @param cause why, or {@code null} for an orderly close
     */
    void onClosed(PeerLink link, Throwable cause);
}
