package com.questrail.coedit.protocol.internal.state;

import com.questrail.coedit.api.SessionNotification;
import com.questrail.coedit.protocol.model.CollabMessage;
import com.questrail.coedit.protocol.model.MessageKind;
import com.questrail.coedit.protocol.observability.CollabProtocolObservabilityEvent;

import java.time.Instant;

/**
 * ControlArbitration
 * -----------------------------------------------------------------------------
 * Pure rules for "who owns the pen".
 *
 * <h2>Handshake</h2>
 * <pre>
 *   client                                 host
 *     | --- REQ_CONTROL ------------------&gt; |  ask the host's user
 *     | &lt;-- GRANT_CONTROL ---------------- |  approve: host becomes viewer
 *     | &lt;-- DECLINE_CONTROL -------------- |  decline: nothing changes
 *     | &lt;-- REVOKE_CONTROL --------------- |  reclaim: host is writer again, unasked
 * </pre>
 *
 * <h2>Authority</h2>
 * Only the host grants and only the host revokes. When a message contradicts a
 * side's role, that side logs the anomaly and falls back to the safe default:
 * the host holds control, the client does not. A host that had to take control
 * back this way also sends {@code REVOKE_CONTROL}, so the client self-corrects
 * and at most one side believes it is the writer.
 *
 * <p>Called only by {@link SessionReducer}, and only for connected states
 * unless noted otherwise.</p>
 */
final class ControlArbitration
{
    /**
     * Client command: ask the host for control.
     */
    SessionReducer.Result request(SessionState state, Instant now) {
        if (!state.isConnected()) {
            return rejected(state, "Not connected to a peer");
        }
        if (!state.isClient()) {
            return rejected(state, "Only the client can request control");
        }
        if (state.hasControl()) {
            return rejected(state, "Already in control");
        }

        // No local change yet: the request is pending until the host answers.
        return new SessionReducer.Result(state, SessionIntents.of(
                new SessionIntent.SendMessage(CollabMessage.requestControl()),
                new SessionIntent.Notify(SessionNotification.Kind.CONTROL_REQUESTED,
                        "Control requested from host")));
    }

    /**
     * Host command (from an attempted edit while read-only): take control back.
     */
    SessionReducer.Result reclaim(SessionState state, Instant now) {
        if (!state.isConnected() || !state.isHost() || state.hasControl()) {
            return new SessionReducer.Result(state, SessionIntents.of(
                    observe(CollabProtocolObservabilityEvent.Kind.COMMAND_IGNORED,
                            "reclaim does not apply as " + state.role() + " with control=" + state.hasControl())));
        }

        return new SessionReducer.Result(state.withControl(true, now), SessionIntents.of(
                new SessionIntent.SendMessage(CollabMessage.revokeControl()),
                new SessionIntent.Notify(SessionNotification.Kind.CONTROL_RECLAIMED,
                        "You have reclaimed editing control")));
    }

    /**
     * Host: the user answered a request that arrived on {@code linkId}.
     *
     * <p>May be called in any phase: the peer can vanish between request and
     * answer.</p>
     */
    SessionReducer.Result decide(SessionState state, long linkId, boolean approved, Instant now) {
        if (!state.isHost() || !state.isCurrentLink(linkId)) {
            if (!approved) {
                return new SessionReducer.Result(state, SessionIntents.of(
                        observe(CollabProtocolObservabilityEvent.Kind.STALE_EVENT_IGNORED,
                                "decline for link " + linkId + " after the peer left")));
            }
            // Granting into the void would leave nobody in control.
            return new SessionReducer.Result(state, SessionIntents.of(
                    observe(CollabProtocolObservabilityEvent.Kind.CONTROL_RETAINED,
                            "approval for link " + linkId + " arrived after the peer left"),
                    new SessionIntent.Notify(SessionNotification.Kind.CONTROL_RETAINED,
                            "The requesting peer is no longer connected; keeping control")));
        }

        if (!approved) {
            return new SessionReducer.Result(state, SessionIntents.of(
                    new SessionIntent.SendMessage(CollabMessage.declineControl()),
                    new SessionIntent.Notify(SessionNotification.Kind.CONTROL_DECLINED,
                            "Control request declined")));
        }

        return new SessionReducer.Result(state.withControl(false, now), SessionIntents.of(
                new SessionIntent.SendMessage(CollabMessage.grantControl()),
                new SessionIntent.Notify(SessionNotification.Kind.CONTROL_RELEASED,
                        "Control granted to the client; you are now viewing")));
    }

    /**
     * A control message arrived on the current link.
     */
    SessionReducer.Result onControlMessage(SessionState state, MessageKind kind, Instant now) {
        return state.isHost() ? hostReceives(state, kind, now) : clientReceives(state, kind, now);
    }

    private SessionReducer.Result hostReceives(SessionState state, MessageKind kind, Instant now) {
        if (kind == MessageKind.REQUEST_CONTROL) {
            return new SessionReducer.Result(state, SessionIntents.of(
                    new SessionIntent.AskControlApproval(state.linkId()),
                    new SessionIntent.Notify(SessionNotification.Kind.CONTROL_REQUESTED,
                            "The client is requesting editing control")));
        }

        // GRANT, REVOKE and DECLINE are host-to-client messages only.
        SessionIntents.Builder intents = SessionIntents.builder()
                .add(observe(CollabProtocolObservabilityEvent.Kind.PROTOCOL_ANOMALY,
                        "host received " + kind.wireName()))
                .add(new SessionIntent.Notify(SessionNotification.Kind.PROTOCOL_ANOMALY,
                        "Unexpected " + kind.wireName() + " from client ignored"));

        if (state.hasControl()) {
            return new SessionReducer.Result(state, intents.build());
        }

        intents.add(new SessionIntent.SendMessage(CollabMessage.revokeControl()));
        return new SessionReducer.Result(state.withControl(true, now), intents.build());
    }

    private SessionReducer.Result clientReceives(SessionState state, MessageKind kind, Instant now) {
        switch (kind) {
            case GRANT_CONTROL -> {
                if (state.hasControl()) {
                    return new SessionReducer.Result(state, SessionIntents.of(
                            observe(CollabProtocolObservabilityEvent.Kind.COMMAND_IGNORED,
                                    "grant received while already in control")));
                }
                return new SessionReducer.Result(state.withControl(true, now), SessionIntents.of(
                        new SessionIntent.Notify(SessionNotification.Kind.CONTROL_GRANTED,
                                "The host granted you editing control")));
            }
            case REVOKE_CONTROL -> {
                // Host is authoritative: always end up a viewer, whatever we believed.
                return new SessionReducer.Result(state.withControl(false, now), SessionIntents.of(
                        new SessionIntent.Notify(SessionNotification.Kind.CONTROL_REVOKED,
                                "The host has taken back editing control")));
            }
            case DECLINE_CONTROL -> {
                return new SessionReducer.Result(state, SessionIntents.of(
                        new SessionIntent.Notify(SessionNotification.Kind.CONTROL_DECLINED,
                                "The host declined your control request")));
            }
            default -> {
                // REQ_CONTROL is client-to-host only.
                return new SessionReducer.Result(state.withControl(false, now), SessionIntents.of(
                        observe(CollabProtocolObservabilityEvent.Kind.PROTOCOL_ANOMALY,
                                "client received " + kind.wireName()),
                        new SessionIntent.Notify(SessionNotification.Kind.PROTOCOL_ANOMALY,
                                "Unexpected " + kind.wireName() + " from host ignored")));
            }
        }
    }

    private static SessionReducer.Result rejected(SessionState state, String reason) {
        return new SessionReducer.Result(state, SessionIntents.of(
                new SessionIntent.Notify(SessionNotification.Kind.COMMAND_REJECTED, reason)));
    }

    private static SessionIntent.Observe observe(CollabProtocolObservabilityEvent.Kind kind, String detail) {
        return new SessionIntent.Observe(kind, detail);
    }
}
