package com.questrail.coedit.protocol.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionCommandEvent
 * -----------------------------------------------------------------------------
 * Events that originate from the local user or editor.
 */
public sealed interface SessionCommandEvent extends SessionEvent
        permits SessionCommandEvent.StartHosting,
                SessionCommandEvent.ConnectToHost,
                SessionCommandEvent.StopSession,
                SessionCommandEvent.RequestControl,
                SessionCommandEvent.ReclaimControl,
                SessionCommandEvent.LocalDocumentChanged,
                SessionCommandEvent.ControlRequestDecided
{
    /** Listen for a peer on {@code port}. */
    final class StartHosting extends SessionEvent.Base implements SessionCommandEvent {
        private final int port;

        public StartHosting(Instant timestamp, int port) {
            super(timestamp);
            this.port = port;
        }

        public int port() {
            return port;
        }

        @Override
        public String toString() {
            return "StartHosting[" + port + "]";
        }
    }

    /** Dial {@code host:port}. */
    final class ConnectToHost extends SessionEvent.Base implements SessionCommandEvent {
        private final String host;
        private final int port;

        public ConnectToHost(Instant timestamp, String host, int port) {
            super(timestamp);
            this.host = host;
            this.port = port;
        }

        /** May be {@code null} or blank; the reducer rejects such input. */
        public String host() {
            return host;
        }

        public int port() {
            return port;
        }

        @Override
        public String toString() {
            return "ConnectToHost[" + host + ":" + port + "]";
        }
    }

    /** End the session. */
    final class StopSession extends SessionEvent.Base implements SessionCommandEvent {
        public StopSession(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Client asks for control. */
    final class RequestControl extends SessionEvent.Base implements SessionCommandEvent {
        public RequestControl(Instant timestamp) {
            super(timestamp);
        }
    }

    /** The user tried to type while read-only. */
    final class ReclaimControl extends SessionEvent.Base implements SessionCommandEvent {
        public ReclaimControl(Instant timestamp) {
            super(timestamp);
        }
    }

    /**
     * The editor changed the document.
     *
     * <p>Changes caused by applying a remote update never become this event;
     * they are filtered before submission.</p>
     */
    final class LocalDocumentChanged extends SessionEvent.Base implements SessionCommandEvent {
        private final String text;

        public LocalDocumentChanged(Instant timestamp, String text) {
            super(timestamp);
            this.text = Objects.requireNonNull(text, "text");
        }

        public String text() {
            return text;
        }

        @Override
        public String toString() {
            return "LocalDocumentChanged[" + text.length() + " chars]";
        }
    }

    /** The host answered the control request received on {@code linkId}. */
    final class ControlRequestDecided extends SessionEvent.Base implements SessionCommandEvent {
        private final long linkId;
        private final boolean approved;

        public ControlRequestDecided(Instant timestamp, long linkId, boolean approved) {
            super(timestamp);
            this.linkId = linkId;
            this.approved = approved;
        }

        public long linkId() {
            return linkId;
        }

        public boolean approved() {
            return approved;
        }

        @Override
        public String toString() {
            return "ControlRequestDecided[link=" + linkId + ", approved=" + approved + "]";
        }
    }
}
