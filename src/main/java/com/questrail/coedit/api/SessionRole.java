package com.questrail.coedit.api;

/**
 * Which side of the link this process plays.
 */
public enum SessionRole
{
    /** No session. */
    NONE,

    /** Accepts the peer and makes every control-arbitration decision. */
    HOST,

    /** Dials out to a host. */
    CLIENT
}
