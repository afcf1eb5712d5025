package com.questrail.coedit.protocol.internal.exec;

import com.questrail.coedit.api.ControlDecision;
import com.questrail.coedit.protocol.internal.events.SessionCommandEvent;
import com.questrail.coedit.protocol.internal.events.SessionEvent;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One-shot answer to a control request received on a specific link.
 *
 * <p>The answer is fed back to the state machine as an event, so a peer that
 * left in the meantime is detected there.</p>
 */
final class PendingControlDecision implements ControlDecision
{
    private final long linkId;
    private final Consumer<SessionEvent> events;
    private final Clock clock;
    private final AtomicBoolean decided = new AtomicBoolean();

    PendingControlDecision(long linkId, Consumer<SessionEvent> events, Clock clock)
    {
        this.linkId = linkId;
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void approve()
    {
        decide(true);
    }

    @Override
    public void decline()
    {
        decide(false);
    }

    @Override
    public boolean isDecided()
    {
        return decided.get();
    }

    long linkId()
    {
        return linkId;
    }

    private void decide(boolean approved)
    {
        if (decided.compareAndSet(false, true)) {
            events.accept(new SessionCommandEvent.ControlRequestDecided(clock.instant(), linkId, approved));
        }
    }
}
