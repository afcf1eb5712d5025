package com.questrail.coedit.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CollabObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCollabObservabilitySink implements CollabObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCollabObservabilitySink.class);

    @Override
    public void onStateTransition(CollabStateTransitionEvent event) {
        if (event.isPhaseChange()) {
            log.info("Session phase: {} -> {} ({})",
                event.oldState().phase(),
                event.newState().phase(),
                event.triggeringEvent());
        }

        if (event.isControlChange()) {
            log.info("Control: {} -> {} as {}",
                event.oldState().hasControl() ? "writer" : "viewer",
                event.newState().hasControl() ? "writer" : "viewer",
                event.newState().role());
        }

        if (log.isTraceEnabled()) {
            log.trace("{} -> {}", event.triggeringEvent(), event.resultingIntents().kinds());
        }
    }

    @Override
    public void onProtocolEvent(CollabProtocolObservabilityEvent event) {
        if (event.kind().isWarning()) {
            log.warn("Link {}: {} {}", event.linkId(), event.kind(), event.detail());
        }
        else {
            log.debug("Link {}: {} {}", event.linkId(), event.kind(), event.detail());
        }
    }

    @Override
    public void onTransportEvent(CollabTransportObservabilityEvent event) {
        if (event.kind() == CollabTransportObservabilityEvent.Kind.LISTEN_FAILED
                || event.kind() == CollabTransportObservabilityEvent.Kind.CONNECT_FAILED) {
            log.warn("Transport: {} {}", event.kind(), event.detail());
        }
        else {
            log.info("Transport: {} link={} {}", event.kind(), event.linkId(), event.detail());
        }
    }

    @Override
    public void onError(CollabErrorEvent event) {
        log.error("Collab error: {}", event.message(), event.cause());
    }
}
