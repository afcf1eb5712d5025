package com.questrail.coedit.protocol.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the collaboration stack.
 */
public record CollabErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
