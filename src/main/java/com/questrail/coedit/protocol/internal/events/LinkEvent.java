package com.questrail.coedit.protocol.internal.events;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * LinkEvent
 * -----------------------------------------------------------------------------
 * Base type for events that originate from the transport.
 *
 * These events describe the availability of the listening socket and the
 * peer link, not protocol correctness. Events that concern a specific socket
 * carry its link id so that news about a replaced socket can be recognised.
 */
public sealed interface LinkEvent extends SessionEvent
        permits LinkEvent.ListenStarted,
                LinkEvent.ListenFailed,
                LinkEvent.PeerAccepted,
                LinkEvent.DialSucceeded,
                LinkEvent.DialFailed,
                LinkEvent.LinkClosed
{
    /** The host socket is bound. */
    final class ListenStarted extends SessionEvent.Base implements LinkEvent {
        private final InetSocketAddress localAddress;

        public ListenStarted(Instant timestamp, InetSocketAddress localAddress) {
            super(timestamp);
            this.localAddress = Objects.requireNonNull(localAddress, "localAddress");
        }

        public InetSocketAddress localAddress() {
            return localAddress;
        }
    }

    /** The host socket could not be bound. */
    final class ListenFailed extends SessionEvent.Base implements LinkEvent {
        private final Throwable cause;

        public ListenFailed(Instant timestamp, Throwable cause) {
            super(timestamp);
            this.cause = cause;
        }

        public Throwable cause() {
            return cause;
        }
    }

    /** A peer connected to the host socket. */
    final class PeerAccepted extends SessionEvent.Base implements LinkEvent {
        private final long linkId;
        private final SocketAddress remoteAddress;

        public PeerAccepted(Instant timestamp, long linkId, SocketAddress remoteAddress) {
            super(timestamp);
            this.linkId = linkId;
            this.remoteAddress = remoteAddress;
        }

        public long linkId() {
            return linkId;
        }

        public SocketAddress remoteAddress() {
            return remoteAddress;
        }

        @Override
        public String toString() {
            return "PeerAccepted[link=" + linkId + ", " + remoteAddress + "]";
        }
    }

    /** The client's dial connected. */
    final class DialSucceeded extends SessionEvent.Base implements LinkEvent {
        private final long linkId;
        private final SocketAddress remoteAddress;

        public DialSucceeded(Instant timestamp, long linkId, SocketAddress remoteAddress) {
            super(timestamp);
            this.linkId = linkId;
            this.remoteAddress = remoteAddress;
        }

        public long linkId() {
            return linkId;
        }

        public SocketAddress remoteAddress() {
            return remoteAddress;
        }

        @Override
        public String toString() {
            return "DialSucceeded[link=" + linkId + ", " + remoteAddress + "]";
        }
    }

    /** The client's dial failed (refused, unreachable, unresolvable, timed out). */
    final class DialFailed extends SessionEvent.Base implements LinkEvent {
        private final Throwable cause;

        public DialFailed(Instant timestamp, Throwable cause) {
            super(timestamp);
            this.cause = cause;
        }

        public Throwable cause() {
            return cause;
        }
    }

    /**
     * A peer link went away: orderly close, socket error, write failure or an
     * unrecoverable framing error.
     */
    final class LinkClosed extends SessionEvent.Base implements LinkEvent {
        private final long linkId;
        private final Throwable cause;

        public LinkClosed(Instant timestamp, long linkId, Throwable cause) {
            super(timestamp);
            this.linkId = linkId;
            this.cause = cause;
        }

        public long linkId() {
            return linkId;
        }

        /** {@code null} for an orderly close. */
        public Throwable cause() {
            return cause;
        }

        @Override
        public String toString() {
            return "LinkClosed[link=" + linkId + "]";
        }
    }
}
