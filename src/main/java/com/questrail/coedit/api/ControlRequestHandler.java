package com.questrail.coedit.api;

/**
 * Host-side decision point for control requests (typically a yes/no dialog).
 *
 * <p>Invoked when the client asks for control. The handler must not block
 * the calling thread waiting for a user; it answers through the supplied
 * {@link ControlDecision} whenever the answer is known.</p>
 */
@FunctionalInterface
public interface ControlRequestHandler
{
    ControlRequestHandler ALWAYS_APPROVE = ControlDecision::approve;
    ControlRequestHandler ALWAYS_DECLINE = ControlDecision::decline;

    void onControlRequested(ControlDecision decision);
}
