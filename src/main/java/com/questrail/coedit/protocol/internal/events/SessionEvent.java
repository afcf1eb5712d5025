package com.questrail.coedit.protocol.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionEvent
 * -----------------------------------------------------------------------------
 * Marker interface for all internal events processed by the session state
 * machine.
 *
 * <h2>Role in the architecture</h2>
 * The session is modeled as an event-driven, actor-style system. All changes
 * to session state occur strictly in response to {@link SessionEvent}s that are
 * serialized and processed one at a time. This includes:
 * <ul>
 *   <li>User commands (host, connect, stop, request, reclaim, local edits)</li>
 *   <li>Transport lifecycle changes (bound, accepted, dialed, closed)</li>
 *   <li>Messages decoded from the peer</li>
 *   <li>The host's answer to a control request</li>
 * </ul>
 *
 * Events are immutable and carry only what is needed to advance state.
 */
public interface SessionEvent
{
    /**
     * Time at which the event occurred or was generated.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements SessionEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName();
        }
    }
}
