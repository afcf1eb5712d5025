package com.questrail.coedit.protocol.observability;

/**
 * Main interface for receiving collaboration-session observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface CollabObservabilitySink {
    /**
     * Called when the session state machine processes an event.
     * @param event the transition event details
     */
    void onStateTransition(CollabStateTransitionEvent event);

    /**
     * Called when a protocol-level observability event occurs (traffic, ignored update, anomaly).
     * @param event the protocol event
     */
    void onProtocolEvent(CollabProtocolObservabilityEvent event);

    /**
     * Called when a transport-level event occurs (listening, connected, closed).
     * @param event the transport event
     */
    void onTransportEvent(CollabTransportObservabilityEvent event);

    /**
     * Called when an error occurs in the stack.
     * @param event the error event
     */
    void onError(CollabErrorEvent event);
}
