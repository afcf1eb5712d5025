package com.questrail.coedit.protocol.observability;

import com.questrail.coedit.protocol.internal.events.SessionEvent;
import com.questrail.coedit.protocol.internal.state.SessionIntents;
import com.questrail.coedit.protocol.internal.state.SessionState;

import java.time.Instant;

/**
 * Record representing a state transition of the session state machine.
 */
public record CollabStateTransitionEvent(
    Instant timestamp,
    SessionState oldState,
    SessionState newState,
    SessionEvent triggeringEvent,
    SessionIntents resultingIntents
) {
    /**
     * Checks if the internal phase changed during this transition.
     */
    public boolean isPhaseChange() {
        return oldState.phase() != newState.phase();
    }

    /**
     * Checks if control ownership flipped during this transition.
     */
    public boolean isControlChange() {
        return oldState.hasControl() != newState.hasControl();
    }
}
