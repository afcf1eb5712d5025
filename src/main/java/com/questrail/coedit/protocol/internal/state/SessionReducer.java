package com.questrail.coedit.protocol.internal.state;

import com.questrail.coedit.api.SessionNotification;
import com.questrail.coedit.api.SessionRole;
import com.questrail.coedit.protocol.internal.events.LinkEvent;
import com.questrail.coedit.protocol.internal.events.MessageEvent;
import com.questrail.coedit.protocol.internal.events.SessionCommandEvent;
import com.questrail.coedit.protocol.internal.events.SessionEvent;
import com.questrail.coedit.protocol.model.CollabMessage;
import com.questrail.coedit.protocol.model.MessageKind;
import com.questrail.coedit.protocol.observability.CollabProtocolObservabilityEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * SessionReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for a collaboration session.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link SessionState} and a single {@link SessionEvent}, the
 * reducer computes:
 * <ul>
 *   <li>a new {@link SessionState}</li>
 *   <li>the {@link SessionIntents} describing what should happen next</li>
 * </ul>
 * It performs no I/O. Sockets, the editor and the user are reached only through
 * the intents, executed by {@code SessionIntentExecutor}.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   IDLE --host--&gt; BINDING --bound--&gt; LISTENING --accepted--&gt; CONNECTED(HOST)
 *   IDLE --connect--&gt; DIALING --dialed--&gt; CONNECTED(CLIENT)
 *   any --stop / current link closed / bind or dial failed--&gt; IDLE
 * </pre>
 *
 * Control arbitration is delegated to {@link ControlArbitration}.
 */
public final class SessionReducer
{
    static final String ALREADY_ACTIVE = "Session is already active (hosting or connected).";

    /**
     * Result of applying an event to a session state.
     *
     * @param newState the updated session state
     * @param intents  intentions to be executed by the caller
     */
    public record Result(SessionState newState,
                         SessionIntents intents) {}

    private final ControlArbitration arbitration = new ControlArbitration();

    /**
     * Applies a single event to the current session state.
     *
     * @param state the current state (must not be {@code null})
     * @param event the event to apply (must not be {@code null})
     * @return the resulting state and intentions
     */
    public Result apply(SessionState state, SessionEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        // Commands
        if (event instanceof SessionCommandEvent.StartHosting e) {
            return onStartHosting(state, e);
        }
        if (event instanceof SessionCommandEvent.ConnectToHost e) {
            return onConnectToHost(state, e);
        }
        if (event instanceof SessionCommandEvent.StopSession e) {
            return onStopSession(state, e);
        }
        if (event instanceof SessionCommandEvent.RequestControl e) {
            return arbitration.request(state, e.timestamp());
        }
        if (event instanceof SessionCommandEvent.ReclaimControl e) {
            return arbitration.reclaim(state, e.timestamp());
        }
        if (event instanceof SessionCommandEvent.ControlRequestDecided e) {
            return arbitration.decide(state, e.linkId(), e.approved(), e.timestamp());
        }
        if (event instanceof SessionCommandEvent.LocalDocumentChanged e) {
            return onLocalDocumentChanged(state, e);
        }

        // Transport
        if (event instanceof LinkEvent.ListenStarted e) {
            return onListenStarted(state, e);
        }
        if (event instanceof LinkEvent.ListenFailed e) {
            return onListenFailed(state, e);
        }
        if (event instanceof LinkEvent.PeerAccepted e) {
            return onPeerAccepted(state, e);
        }
        if (event instanceof LinkEvent.DialSucceeded e) {
            return onDialSucceeded(state, e);
        }
        if (event instanceof LinkEvent.DialFailed e) {
            return onDialFailed(state, e);
        }
        if (event instanceof LinkEvent.LinkClosed e) {
            return onLinkClosed(state, e);
        }

        // Peer
        if (event instanceof MessageEvent.MessageReceived e) {
            return onMessageReceived(state, e);
        }

        return new Result(state, SessionIntents.none());
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    private Result onStartHosting(SessionState state, SessionCommandEvent.StartHosting e) {
        if (state.phase() != SessionState.Phase.IDLE) {
            return notifyOnly(state, SessionNotification.Kind.SESSION_ALREADY_ACTIVE, ALREADY_ACTIVE);
        }
        if (e.port() < 0 || e.port() > 0xFFFF) {
            return notifyOnly(state, SessionNotification.Kind.HOST_START_FAILED,
                    "Server could not start: invalid port " + e.port());
        }

        return new Result(SessionState.binding(e.timestamp()),
                SessionIntents.of(new SessionIntent.BindListener(e.port())));
    }

    private Result onConnectToHost(SessionState state, SessionCommandEvent.ConnectToHost e) {
        if (state.phase() != SessionState.Phase.IDLE) {
            return notifyOnly(state, SessionNotification.Kind.SESSION_ALREADY_ACTIVE, ALREADY_ACTIVE);
        }
        if (e.host() == null || e.host().isBlank()) {
            return notifyOnly(state, SessionNotification.Kind.CONNECT_FAILED,
                    "Connection failed: no host address given");
        }
        if (e.port() < 1 || e.port() > 0xFFFF) {
            return notifyOnly(state, SessionNotification.Kind.CONNECT_FAILED,
                    "Connection failed: invalid port " + e.port());
        }

        return new Result(SessionState.dialing(e.timestamp()),
                SessionIntents.of(new SessionIntent.Dial(e.host().trim(), e.port())));
    }

    private Result onStopSession(SessionState state, SessionCommandEvent.StopSession e) {
        SessionState.Phase phase = state.phase();
        if (phase == SessionState.Phase.IDLE) {
            return new Result(state, SessionIntents.none());
        }

        SessionIntents.Builder intents = SessionIntents.builder()
                .add(new SessionIntent.CloseTransport());
        if (phase == SessionState.Phase.LISTENING || phase == SessionState.Phase.CONNECTED) {
            intents.add(new SessionIntent.Notify(SessionNotification.Kind.PEER_DISCONNECTED, "Session stopped"));
        }
        return new Result(SessionState.idle(e.timestamp()), intents.build());
    }

    private Result onLocalDocumentChanged(SessionState state, SessionCommandEvent.LocalDocumentChanged e) {
        // Viewers never transmit; unconnected edits have nowhere to go.
        if (!state.isConnected() || !state.hasControl()) {
            return new Result(state, SessionIntents.none());
        }
        return new Result(state, SessionIntents.of(new SessionIntent.SyncDocument(e.text())));
    }

    // ---------------------------------------------------------------------
    // Transport
    // ---------------------------------------------------------------------

    private Result onListenStarted(SessionState state, LinkEvent.ListenStarted e) {
        if (state.phase() == SessionState.Phase.BINDING) {
            return new Result(SessionState.listening(e.timestamp()), SessionIntents.of(
                    new SessionIntent.Notify(SessionNotification.Kind.HOSTING_STARTED,
                            "Hosting on " + e.localAddress().getHostString() + ":" + e.localAddress().getPort())));
        }
        if (state.phase() == SessionState.Phase.IDLE) {
            // Stopped while the bind was in flight.
            return new Result(state, SessionIntents.of(new SessionIntent.CloseTransport()));
        }
        return stale(state, "listen started in phase " + state.phase());
    }

    private Result onListenFailed(SessionState state, LinkEvent.ListenFailed e) {
        if (state.phase() != SessionState.Phase.BINDING) {
            return stale(state, "listen failure in phase " + state.phase());
        }
        return new Result(SessionState.idle(e.timestamp()), SessionIntents.of(
                new SessionIntent.Notify(SessionNotification.Kind.HOST_START_FAILED,
                        "Server could not start: " + describe(e.cause()))));
    }

    private Result onPeerAccepted(SessionState state, LinkEvent.PeerAccepted e) {
        if (state.phase() == SessionState.Phase.LISTENING) {
            return new Result(SessionState.connected(SessionRole.HOST, e.linkId(), e.timestamp()),
                    SessionIntents.of(
                            new SessionIntent.PushDocument(),
                            new SessionIntent.Notify(SessionNotification.Kind.PEER_CONNECTED,
                                    "Client connected from " + e.remoteAddress())));
        }
        if (state.isConnected() && state.isHost()) {
            // A newer client preempts the current one. Control reverts to the host.
            return new Result(SessionState.connected(SessionRole.HOST, e.linkId(), e.timestamp()),
                    SessionIntents.of(
                            new SessionIntent.PushDocument(),
                            new SessionIntent.Notify(SessionNotification.Kind.PEER_REPLACED,
                                    "New client connected from " + e.remoteAddress() + "; previous client dropped")));
        }
        if (state.phase() == SessionState.Phase.IDLE) {
            // Accepted just before a stop took effect.
            return new Result(state, SessionIntents.of(new SessionIntent.CloseTransport()));
        }
        return stale(state, "peer accepted on link " + e.linkId() + " in phase " + state.phase());
    }

    private Result onDialSucceeded(SessionState state, LinkEvent.DialSucceeded e) {
        if (state.phase() == SessionState.Phase.DIALING) {
            return new Result(SessionState.connected(SessionRole.CLIENT, e.linkId(), e.timestamp()),
                    SessionIntents.of(new SessionIntent.Notify(SessionNotification.Kind.PEER_CONNECTED,
                            "Connected to host " + e.remoteAddress())));
        }
        if (state.phase() == SessionState.Phase.IDLE) {
            // Stopped while the dial was in flight.
            return new Result(state, SessionIntents.of(new SessionIntent.CloseTransport()));
        }
        return stale(state, "dial succeeded on link " + e.linkId() + " in phase " + state.phase());
    }

    private Result onDialFailed(SessionState state, LinkEvent.DialFailed e) {
        if (state.phase() != SessionState.Phase.DIALING) {
            return stale(state, "dial failure in phase " + state.phase());
        }
        return new Result(SessionState.idle(e.timestamp()), SessionIntents.of(
                new SessionIntent.Notify(SessionNotification.Kind.CONNECT_FAILED,
                        "Connection failed: " + describe(e.cause()))));
    }

    private Result onLinkClosed(SessionState state, LinkEvent.LinkClosed e) {
        if (!state.isCurrentLink(e.linkId())) {
            return stale(state, "close of link " + e.linkId());
        }

        String who = state.isHost() ? "Client" : "Host";
        String message = e.cause() == null
                ? who + " disconnected"
                : who + " disconnected: " + describe(e.cause());

        return new Result(SessionState.idle(e.timestamp()), SessionIntents.of(
                new SessionIntent.CloseTransport(),
                new SessionIntent.Notify(SessionNotification.Kind.PEER_DISCONNECTED, message)));
    }

    // ---------------------------------------------------------------------
    // Peer messages
    // ---------------------------------------------------------------------

    private Result onMessageReceived(SessionState state, MessageEvent.MessageReceived e) {
        if (!state.isCurrentLink(e.linkId())) {
            return stale(state, "message on link " + e.linkId());
        }

        CollabMessage message = e.message();
        if (message.kind() != MessageKind.TEXT_UPDATE) {
            return arbitration.onControlMessage(state, message.kind(), e.timestamp());
        }

        if (state.hasControl()) {
            // The writer's document is authoritative.
            return new Result(state, SessionIntents.of(new SessionIntent.Observe(
                    CollabProtocolObservabilityEvent.Kind.UPDATE_IGNORED,
                    "update of " + message.payload().length() + " chars received while in control")));
        }
        return new Result(state, SessionIntents.of(new SessionIntent.ApplyDocument(message.payload())));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static Result notifyOnly(SessionState state, SessionNotification.Kind kind, String message) {
        return new Result(state, SessionIntents.of(new SessionIntent.Notify(kind, message)));
    }

    private static Result stale(SessionState state, String detail) {
        return new Result(state, SessionIntents.of(new SessionIntent.Observe(
                CollabProtocolObservabilityEvent.Kind.STALE_EVENT_IGNORED, detail)));
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
