package com.questrail.coedit.protocol.internal.state;

import com.questrail.coedit.api.LinkState;
import com.questrail.coedit.api.SessionRole;
import com.questrail.coedit.api.SessionStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of the session's <em>logical state</em>.
 *
 * <h2>Role in the architecture</h2>
 * This class is the state consumed and produced by {@link SessionReducer}.
 * It replaces scattered boolean flags with one explicit value:
 * <pre>
 *   IDLE | BINDING | LISTENING | DIALING | CONNECTED{role, hasControl, linkId}
 * </pre>
 *
 * <h2>Phases vs public status</h2>
 * {@link Phase#BINDING} and {@link Phase#DIALING} exist so that a second
 * host/connect command can be refused while an attempt is in flight. They are
 * reported to the outside as idle (see {@link #status()}).
 *
 * <h2>Link identity</h2>
 * {@code linkId} names the current peer socket. Transport and message events
 * for any other id are stale and must not affect the session.
 */
public final class SessionState
{
    /**
     * Internal lifecycle phase.
     */
    public enum Phase {
        IDLE,
        /** Host bind in flight. */
        BINDING,
        LISTENING,
        /** Client dial in flight. */
        DIALING,
        CONNECTED
    }

    /** Link id meaning "no peer socket". */
    public static final long NO_LINK = 0L;

    private final Phase phase;
    private final SessionRole role;
    private final boolean hasControl;
    private final long linkId;
    private final Instant lastTransition;

    private SessionState(Phase phase, SessionRole role, boolean hasControl, long linkId, Instant lastTransition) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.role = Objects.requireNonNull(role, "role");
        this.hasControl = hasControl;
        this.linkId = linkId;
        this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
    }

    public Phase phase() {
        return phase;
    }

    public SessionRole role() {
        return role;
    }

    public boolean hasControl() {
        return hasControl;
    }

    public long linkId() {
        return linkId;
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    public boolean isConnected() {
        return phase == Phase.CONNECTED;
    }

    public boolean isHost() {
        return role == SessionRole.HOST;
    }

    public boolean isClient() {
        return role == SessionRole.CLIENT;
    }

    /**
     * True if {@code id} names the current peer socket.
     */
    public boolean isCurrentLink(long id) {
        return isConnected() && id == linkId;
    }

    /**
     * Projects this state onto the public {@link SessionStatus}.
     */
    public SessionStatus status() {
        return switch (phase) {
            case IDLE, BINDING, DIALING -> SessionStatus.idle();
            case LISTENING -> new SessionStatus(SessionRole.HOST, LinkState.LISTENING, hasControl);
            case CONNECTED -> new SessionStatus(role, LinkState.CONNECTED, hasControl);
        };
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    /**
     * The state every process starts in: no role, no link, no control.
     */
    public static SessionState idle(Instant now) {
        return new SessionState(Phase.IDLE, SessionRole.NONE, false, NO_LINK, now);
    }

    public static SessionState binding(Instant now) {
        return new SessionState(Phase.BINDING, SessionRole.NONE, false, NO_LINK, now);
    }

    public static SessionState dialing(Instant now) {
        return new SessionState(Phase.DIALING, SessionRole.NONE, false, NO_LINK, now);
    }

    /**
     * A bound host waiting for its peer. The host is the writer from the start.
     */
    public static SessionState listening(Instant now) {
        return new SessionState(Phase.LISTENING, SessionRole.HOST, true, NO_LINK, now);
    }

    /**
     * A connected session. Hosts start with control, clients without.
     */
    public static SessionState connected(SessionRole role, long linkId, Instant now) {
        if (role == SessionRole.NONE) {
            throw new IllegalArgumentException("a connected session needs a role");
        }
        return new SessionState(Phase.CONNECTED, role, role == SessionRole.HOST, linkId, now);
    }

    /**
     * Returns a new state with control ownership replaced.
     */
    public SessionState withControl(boolean control, Instant now) {
        return new SessionState(phase, role, control, linkId, now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionState that)) return false;
        return hasControl == that.hasControl
                && linkId == that.linkId
                && phase == that.phase
                && role == that.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(phase, role, hasControl, linkId);
    }

    @Override
    public String toString() {
        return "SessionState[" + phase + ", " + role + ", control=" + hasControl + ", link=" + linkId + "]";
    }
}
