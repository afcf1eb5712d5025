package com.questrail.coedit.api;

import java.util.Objects;

/**
 * SessionStatus
 * -----------------------------------------------------------------------------
 * Immutable snapshot of the session as the rest of the application sees it.
 *
 * <p>{@code hasControl} says whether local edits are currently transmitted. It
 * is only meaningful while {@link LinkState#CONNECTED}; a listening host
 * reports {@code true} because it will start out as the writer.</p>
 *
 * @param role session role
 * @param linkState link state
 * @param hasControl whether this side currently owns editing control
 */
public record SessionStatus(SessionRole role, LinkState linkState, boolean hasControl)
{
    private static final SessionStatus IDLE = new SessionStatus(SessionRole.NONE, LinkState.IDLE, false);

    public SessionStatus {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(linkState, "linkState");
        if ((role == SessionRole.NONE) != (linkState == LinkState.IDLE)) {
            throw new IllegalArgumentException("role " + role + " is inconsistent with " + linkState);
        }
        if (role == SessionRole.NONE && hasControl) {
            throw new IllegalArgumentException("an idle session cannot hold control");
        }
    }

    /**
     * The state a process starts in and returns to after every session.
     */
    public static SessionStatus idle()
    {
        return IDLE;
    }

    public boolean isConnected()
    {
        return linkState == LinkState.CONNECTED;
    }

    /**
     * True when local edits would be sent to the peer right now.
     */
    public boolean isWriter()
    {
        return isConnected() && hasControl;
    }
}
