package com.questrail.coedit.api;

/**
 * LinkState
 * -----------------------------------------------------------------------------
 * Coarse-grained, externally visible state of the peer link.
 *
 * <p>Attempts in flight (a bind that has not completed, a dial that has not
 * connected) are reported as {@link #IDLE}. Callers never observe a
 * half-connected link.</p>
 */
public enum LinkState
{
    /** No listening socket and no peer. */
    IDLE,

    /** Host only: bound and waiting for a peer. */
    LISTENING,

    /** A peer link is up. */
    CONNECTED
}
