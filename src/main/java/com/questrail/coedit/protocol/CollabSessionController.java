package com.questrail.coedit.protocol;

import com.questrail.coedit.api.SessionListener;
import com.questrail.coedit.api.SessionStatus;
import com.questrail.coedit.protocol.internal.events.SessionEvent;
import com.questrail.coedit.protocol.internal.exec.SessionIntentExecutor;
import com.questrail.coedit.protocol.internal.state.SessionReducer;
import com.questrail.coedit.protocol.internal.state.SessionState;
import com.questrail.coedit.protocol.observability.CollabErrorEvent;
import com.questrail.coedit.protocol.observability.CollabObservabilitySink;
import com.questrail.coedit.protocol.observability.CollabStateTransitionEvent;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * CollabSessionController
 * -----------------------------------------------------------------------------
 * Owner of the session event loop.
 *
 * <h2>Execution model</h2>
 * <pre>
 *   event → reducer → new state → intents → executor
 * </pre>
 * Events come from several threads: the user's, the transport's event loop and
 * whichever thread answers a control request. {@link #submit(SessionEvent)}
 * enqueues the event; the first submitter to find the loop idle drains the
 * queue, and everyone else returns immediately. Events submitted while an event
 * is being executed (for example a decision made synchronously inside the
 * approval prompt) are processed after it, never re-entrantly.
 *
 * <p>No lock is held while the executor or the listener runs.</p>
 *
 * <h2>Status</h2>
 * After each transition whose public {@link SessionStatus} differs from the
 * previous one, {@link SessionListener#onStatusChanged} is called before the
 * transition's intents run.
 */
public class CollabSessionController
{
    private final SessionReducer reducer;
    private final SessionIntentExecutor executor;
    private final SessionListener listener;
    private final CollabObservabilitySink sink;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<SessionEvent> queue = new ArrayDeque<>();
    private boolean draining;

    private volatile SessionState state;

    public CollabSessionController(SessionState initialState,
                                   SessionReducer reducer,
                                   SessionIntentExecutor executor,
                                   SessionListener listener,
                                   CollabObservabilitySink sink,
                                   Clock clock)
    {
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Enqueue an event and process the queue unless another thread already is.
     */
    public void submit(SessionEvent event)
    {
        Objects.requireNonNull(event, "event");

        lock.lock();
        try {
            queue.addLast(event);
            if (draining) {
                return;
            }
            draining = true;
        } finally {
            lock.unlock();
        }

        drain();
    }

    private void drain()
    {
        boolean drained = false;
        try {
            while (true) {
                SessionEvent next;
                lock.lock();
                try {
                    next = queue.pollFirst();
                    if (next == null) {
                        draining = false;
                        drained = true;
                        return;
                    }
                } finally {
                    lock.unlock();
                }

                try {
                    process(next);
                } catch (RuntimeException e) {
                    // One bad event must not wedge the loop.
                    sink.onError(new CollabErrorEvent(clock.instant(), "Failed to process " + next, e));
                }
            }
        } finally {
            if (!drained) {
                // An Error is on its way out; the next submitter takes over the queue.
                lock.lock();
                try {
                    draining = false;
                } finally {
                    lock.unlock();
                }
            }
        }
    }

    private void process(SessionEvent event)
    {
        SessionState previous = state;
        SessionReducer.Result result = reducer.apply(previous, event);
        state = result.newState();

        sink.onStateTransition(new CollabStateTransitionEvent(
                clock.instant(), previous, result.newState(), event, result.intents()));

        SessionStatus before = previous.status();
        SessionStatus after = result.newState().status();
        if (!before.equals(after)) {
            try {
                listener.onStatusChanged(before, after);
            } catch (RuntimeException e) {
                sink.onError(new CollabErrorEvent(clock.instant(), "Session listener failed on status change", e));
            }
        }

        executor.execute(result.newState(), result.intents());
    }

    /**
     * Current immutable session state snapshot.
     */
    public SessionState state()
    {
        return state;
    }

    public int queuedEventCount()
    {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }
}
