package com.questrail.coedit.api;

import java.time.Instant;
import java.util.Objects;

/**
 * A human-readable event for whatever notification channel the application
 * has (status line, dialog, console).
 *
 * @param timestamp when the event was produced
 * @param kind what happened
 * @param message text suitable for display
 */
public record SessionNotification(Instant timestamp, Kind kind, String message)
{
    public SessionNotification {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public boolean isError()
    {
        return kind.error;
    }

    public enum Kind
    {
        HOSTING_STARTED(false),
        HOST_START_FAILED(true),
        CONNECT_FAILED(true),
        SESSION_ALREADY_ACTIVE(true),
        PEER_CONNECTED(false),
        PEER_REPLACED(false),
        PEER_DISCONNECTED(false),
        /** Client: request sent. Host: a request arrived and awaits a decision. */
        CONTROL_REQUESTED(false),
        /** Client received control. */
        CONTROL_GRANTED(false),
        /** Host handed control to the client. */
        CONTROL_RELEASED(false),
        /** A control request was declined (reported on both sides). */
        CONTROL_DECLINED(false),
        /** Client lost control to the host. */
        CONTROL_REVOKED(false),
        /** Host took control back. */
        CONTROL_RECLAIMED(false),
        /** Host approved a request whose requester had already gone. */
        CONTROL_RETAINED(false),
        /** A user command was not valid in the current state. */
        COMMAND_REJECTED(true),
        /** The peer sent a control message that makes no sense for our role. */
        PROTOCOL_ANOMALY(true);

        private final boolean error;

        Kind(boolean error)
        {
            this.error = error;
        }
    }
}
