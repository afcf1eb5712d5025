package com.questrail.coedit.protocol.observability;

/**
 * No-op implementation of CollabObservabilitySink.
 */
public final class NullObservabilitySink implements CollabObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(CollabStateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(CollabProtocolObservabilityEvent event) {}

    @Override
    public void onTransportEvent(CollabTransportObservabilityEvent event) {}

    @Override
    public void onError(CollabErrorEvent event) {}
}
