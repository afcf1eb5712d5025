package com.questrail.coedit.protocol.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a transport lifecycle change.
 *
 * @param linkId socket the change belongs to, {@code 0} for listen/dial level events
 * @param detail address or failure description
 */
public record CollabTransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    long linkId,
    String detail
) {
    public CollabTransportObservabilityEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }

    public enum Kind {
        LISTENING,
        LISTEN_FAILED,
        PEER_ACCEPTED,
        CONNECTED,
        CONNECT_FAILED,
        LINK_CLOSED
    }
}
