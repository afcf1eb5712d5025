package com.questrail.coedit.protocol.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a protocol-level occurrence worth tracing: traffic,
 * discarded frames, ignored updates and anomalies.
 *
 * @param linkId link the occurrence belongs to, {@code 0} if none
 * @param detail short human-readable description
 */
public record CollabProtocolObservabilityEvent(
    Instant timestamp,
    Kind kind,
    long linkId,
    String detail
) {
    public CollabProtocolObservabilityEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }

    public enum Kind {
        MESSAGE_SENT,
        MESSAGE_RECEIVED,
        /** A malformed frame was dropped and the link kept going. */
        FRAME_DISCARDED,
        /** A local change was not sent because it matched the last synced text. */
        UPDATE_SUPPRESSED,
        /** An inbound text update reached the side that holds control. */
        UPDATE_IGNORED,
        /** A transport or message event about a link that is no longer current. */
        STALE_EVENT_IGNORED,
        /** A user command that does not apply in the current state. */
        COMMAND_IGNORED,
        /** A control message that contradicts our role. */
        PROTOCOL_ANOMALY,
        /** An approval arrived after the requesting peer had gone. */
        CONTROL_RETAINED;

        /** Kinds that deserve a warning rather than a trace line. */
        public boolean isWarning() {
            return this == UPDATE_IGNORED || this == PROTOCOL_ANOMALY
                    || this == FRAME_DISCARDED || this == CONTROL_RETAINED;
        }
    }
}
