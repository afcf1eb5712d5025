package com.questrail.coedit.protocol.internal.state;

import com.questrail.coedit.api.SessionNotification;
import com.questrail.coedit.api.SessionRole;
import com.questrail.coedit.protocol.internal.events.MessageEvent;
import com.questrail.coedit.protocol.internal.events.SessionCommandEvent;
import com.questrail.coedit.protocol.internal.events.SessionEvent;
import com.questrail.coedit.protocol.model.CollabMessage;
import com.questrail.coedit.protocol.model.MessageKind;
import com.questrail.coedit.protocol.observability.CollabProtocolObservabilityEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ControlArbitrationTest
 * -----------------------------------------------------------------------------
 * The request / grant / decline / revoke handshake, driven through the
 * reducer, including messages that contradict the receiver's role.
 *
 * <p>Both sides are simulated by applying each side's outbound messages to the
 * other side's state, so "at most one writer" can be checked after every
 * step.</p>
 */
public class ControlArbitrationTest {

    private static final long LINK = 5;

    private SessionReducer reducer;
    private Instant now;
    private SessionState host;
    private SessionState client;

    @BeforeEach
    void setUp() {
        reducer = new SessionReducer();
        now = Instant.parse("2026-01-01T00:00:00Z");
        host = SessionState.connected(SessionRole.HOST, LINK, now);
        client = SessionState.connected(SessionRole.CLIENT, LINK, now);
    }

    // ---------------------------------------------------------------------
    // Handshake
    // ---------------------------------------------------------------------

    @Test
    void requestThenApproveTransfersControl() {
        SessionReducer.Result request = clientApplies(new SessionCommandEvent.RequestControl(now));
        assertEquals(List.of(MessageKind.REQUEST_CONTROL), sent(request));
        assertFalse(client.hasControl());

        SessionReducer.Result asked = hostApplies(received(MessageKind.REQUEST_CONTROL));
        assertEquals(LINK, asked.intents().ofType(SessionIntent.AskControlApproval.class).get(0).linkId());
        assertTrue(host.hasControl());

        SessionReducer.Result approved = hostApplies(new SessionCommandEvent.ControlRequestDecided(now, LINK, true));
        assertEquals(List.of(MessageKind.GRANT_CONTROL), sent(approved));
        assertFalse(host.hasControl());
        assertEquals(SessionNotification.Kind.CONTROL_RELEASED, notified(approved).get(0));

        SessionReducer.Result granted = clientApplies(received(MessageKind.GRANT_CONTROL));
        assertTrue(client.hasControl());
        assertEquals(SessionNotification.Kind.CONTROL_GRANTED, notified(granted).get(0));
        assertAtMostOneWriter();
    }

    @Test
    void requestThenDeclineChangesNothing() {
        clientApplies(new SessionCommandEvent.RequestControl(now));
        hostApplies(received(MessageKind.REQUEST_CONTROL));

        SessionReducer.Result declined = hostApplies(new SessionCommandEvent.ControlRequestDecided(now, LINK, false));
        assertEquals(List.of(MessageKind.DECLINE_CONTROL), sent(declined));
        assertTrue(host.hasControl());

        SessionReducer.Result told = clientApplies(received(MessageKind.DECLINE_CONTROL));
        assertFalse(client.hasControl());
        assertEquals(SessionNotification.Kind.CONTROL_DECLINED, notified(told).get(0));
    }

    @Test
    void hostReclaimsWithoutAsking() {
        host = host.withControl(false, now);
        client = client.withControl(true, now);

        SessionReducer.Result reclaim = hostApplies(new SessionCommandEvent.ReclaimControl(now));
        assertEquals(List.of(MessageKind.REVOKE_CONTROL), sent(reclaim));
        assertTrue(host.hasControl());

        SessionReducer.Result revoked = clientApplies(received(MessageKind.REVOKE_CONTROL));
        assertFalse(client.hasControl());
        assertEquals(SessionNotification.Kind.CONTROL_REVOKED, notified(revoked).get(0));
        assertAtMostOneWriter();
    }

    @Test
    void repeatedRequestsAreEachAnswered() {
        for (int i = 0; i < 3; i++) {
            clientApplies(new SessionCommandEvent.RequestControl(now));
            hostApplies(received(MessageKind.REQUEST_CONTROL));
            hostApplies(new SessionCommandEvent.ControlRequestDecided(now, LINK, false));
            clientApplies(received(MessageKind.DECLINE_CONTROL));
        }
        assertTrue(host.hasControl());
        assertFalse(client.hasControl());
    }

    // ---------------------------------------------------------------------
    // Commands in the wrong place
    // ---------------------------------------------------------------------

    @Test
    void requestIsRejectedForHostWriterAndUnconnected() {
        assertEquals(SessionNotification.Kind.COMMAND_REJECTED,
                notified(hostApplies(new SessionCommandEvent.RequestControl(now))).get(0));

        client = client.withControl(true, now);
        assertEquals(SessionNotification.Kind.COMMAND_REJECTED,
                notified(clientApplies(new SessionCommandEvent.RequestControl(now))).get(0));

        SessionReducer.Result idle = reducer.apply(SessionState.idle(now), new SessionCommandEvent.RequestControl(now));
        assertTrue(sent(idle).isEmpty());
        assertEquals(SessionNotification.Kind.COMMAND_REJECTED, notified(idle).get(0));
    }

    @Test
    void reclaimIsIgnoredWhenItDoesNotApply() {
        SessionReducer.Result whileWriter = hostApplies(new SessionCommandEvent.ReclaimControl(now));
        SessionReducer.Result asClient = clientApplies(new SessionCommandEvent.ReclaimControl(now));

        assertTrue(sent(whileWriter).isEmpty());
        assertTrue(sent(asClient).isEmpty());
        assertFalse(client.hasControl());
        assertEquals(CollabProtocolObservabilityEvent.Kind.COMMAND_IGNORED,
                asClient.intents().ofType(SessionIntent.Observe.class).get(0).observation());
    }

    @Test
    void approvalAfterThePeerLeftKeepsControl() {
        SessionState listening = SessionState.listening(now);

        SessionReducer.Result r = reducer.apply(listening, new SessionCommandEvent.ControlRequestDecided(now, LINK, true));

        assertTrue(r.newState().hasControl());
        assertTrue(sent(r).isEmpty());
        assertEquals(SessionNotification.Kind.CONTROL_RETAINED, notified(r).get(0));
    }

    @Test
    void approvalForAPreemptedLinkKeepsControl() {
        host = SessionState.connected(SessionRole.HOST, LINK + 1, now);

        SessionReducer.Result r = hostApplies(new SessionCommandEvent.ControlRequestDecided(now, LINK, true));

        assertTrue(host.hasControl());
        assertTrue(sent(r).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Anomalies
    // ---------------------------------------------------------------------

    @Test
    void hostIgnoresGrantAndDeclineFromClient() {
        for (MessageKind kind : List.of(MessageKind.GRANT_CONTROL, MessageKind.DECLINE_CONTROL, MessageKind.REVOKE_CONTROL)) {
            SessionReducer.Result r = hostApplies(received(kind));

            assertTrue(host.hasControl(), kind.toString());
            assertTrue(sent(r).isEmpty());
            assertEquals(SessionNotification.Kind.PROTOCOL_ANOMALY, notified(r).get(0));
            assertEquals(CollabProtocolObservabilityEvent.Kind.PROTOCOL_ANOMALY,
                    r.intents().ofType(SessionIntent.Observe.class).get(0).observation());
        }
    }

    @Test
    void viewerHostTakesControlBackOnAnomalyAndTellsTheClient() {
        host = host.withControl(false, now);
        client = client.withControl(true, now);

        SessionReducer.Result r = hostApplies(received(MessageKind.REVOKE_CONTROL));

        assertTrue(host.hasControl());
        assertEquals(List.of(MessageKind.REVOKE_CONTROL), sent(r));

        clientApplies(received(MessageKind.REVOKE_CONTROL));
        assertAtMostOneWriter();
    }

    @Test
    void clientDropsControlOnRequestFromHost() {
        client = client.withControl(true, now);

        SessionReducer.Result r = clientApplies(received(MessageKind.REQUEST_CONTROL));

        assertFalse(client.hasControl());
        assertEquals(SessionNotification.Kind.PROTOCOL_ANOMALY, notified(r).get(0));
    }

    @Test
    void duplicateGrantIsHarmless() {
        client = client.withControl(true, now);

        SessionReducer.Result r = clientApplies(received(MessageKind.GRANT_CONTROL));

        assertTrue(client.hasControl());
        assertTrue(notified(r).isEmpty());
    }

    @Test
    void revokeWhileAlreadyViewerStaysViewer() {
        clientApplies(received(MessageKind.REVOKE_CONTROL));
        assertFalse(client.hasControl());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private SessionReducer.Result hostApplies(SessionEvent event) {
        SessionReducer.Result r = reducer.apply(host, event);
        host = r.newState();
        return r;
    }

    private SessionReducer.Result clientApplies(SessionEvent event) {
        SessionReducer.Result r = reducer.apply(client, event);
        client = r.newState();
        return r;
    }

    private MessageEvent.MessageReceived received(MessageKind kind) {
        return new MessageEvent.MessageReceived(now, LINK, new CollabMessage(kind, ""));
    }

    private static List<MessageKind> sent(SessionReducer.Result r) {
        return r.intents().ofType(SessionIntent.SendMessage.class).stream()
                .map(s -> s.message().kind())
                .collect(Collectors.toList());
    }

    private static List<SessionNotification.Kind> notified(SessionReducer.Result r) {
        return r.intents().ofType(SessionIntent.Notify.class).stream()
                .map(SessionIntent.Notify::notification)
                .collect(Collectors.toList());
    }

    private void assertAtMostOneWriter() {
        assertFalse(host.hasControl() && client.hasControl(), "both sides believe they hold control");
    }
}
