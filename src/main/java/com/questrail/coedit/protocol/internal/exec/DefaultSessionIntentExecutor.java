package com.questrail.coedit.protocol.internal.exec;

import com.questrail.coedit.api.ControlRequestHandler;
import com.questrail.coedit.api.DocumentEditor;
import com.questrail.coedit.api.SessionListener;
import com.questrail.coedit.api.SessionNotification;
import com.questrail.coedit.protocol.config.CollabRuntimeConfig;
import com.questrail.coedit.protocol.internal.events.LinkEvent;
import com.questrail.coedit.protocol.internal.events.SessionEvent;
import com.questrail.coedit.protocol.internal.state.SessionIntent;
import com.questrail.coedit.protocol.internal.state.SessionIntents;
import com.questrail.coedit.protocol.internal.state.SessionState;
import com.questrail.coedit.protocol.link.PeerLink;
import com.questrail.coedit.protocol.link.PeerLinks;
import com.questrail.coedit.protocol.model.CollabMessage;
import com.questrail.coedit.protocol.observability.CollabErrorEvent;
import com.questrail.coedit.protocol.observability.CollabObservabilitySink;
import com.questrail.coedit.protocol.observability.CollabProtocolObservabilityEvent;
import com.questrail.coedit.protocol.sync.DocumentSyncPolicy;
import com.questrail.coedit.protocol.transport.PeerTransport;
import com.questrail.coedit.protocol.transport.PeerWriteException;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * DefaultSessionIntentExecutor
 * -----------------------------------------------------------------------------
 * Production {@link SessionIntentExecutor}.
 *
 * <h2>Failure handling</h2>
 * Nothing thrown below this layer escapes it. A failed write closes the link
 * (and the resulting closure event ends the session); a misbehaving editor,
 * listener or decision handler is reported to the observability sink and the
 * session carries on.
 */
public final class DefaultSessionIntentExecutor implements SessionIntentExecutor
{
    private final PeerTransport transport;
    private final PeerLinks links;
    private final DocumentEditor editor;
    private final DocumentSyncPolicy syncPolicy;
    private final ControlRequestHandler controlRequestHandler;
    private final SessionListener listener;
    private final CollabObservabilitySink sink;
    private final CollabRuntimeConfig config;
    private final Consumer<SessionEvent> events;
    private final Clock clock;

    public DefaultSessionIntentExecutor(PeerTransport transport,
                                        PeerLinks links,
                                        DocumentEditor editor,
                                        DocumentSyncPolicy syncPolicy,
                                        ControlRequestHandler controlRequestHandler,
                                        SessionListener listener,
                                        CollabObservabilitySink sink,
                                        CollabRuntimeConfig config,
                                        Consumer<SessionEvent> events,
                                        Clock clock)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.links = Objects.requireNonNull(links, "links");
        this.editor = Objects.requireNonNull(editor, "editor");
        this.syncPolicy = Objects.requireNonNull(syncPolicy, "syncPolicy");
        this.controlRequestHandler = Objects.requireNonNull(controlRequestHandler, "controlRequestHandler");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.config = Objects.requireNonNull(config, "config");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void execute(SessionState state, SessionIntents intents)
    {
        for (SessionIntent intent : intents.all()) {
            executeOne(state, intent);
        }
    }

    private void executeOne(SessionState state, SessionIntent intent)
    {
        switch (intent.kind()) {
            case BIND_LISTENER -> bind((SessionIntent.BindListener) intent);
            case DIAL -> dial((SessionIntent.Dial) intent);
            case CLOSE_TRANSPORT -> closeTransport();
            case SEND_MESSAGE -> send(state, ((SessionIntent.SendMessage) intent).message());
            case PUSH_DOCUMENT -> pushDocument(state);
            case SYNC_DOCUMENT -> syncDocument(state, ((SessionIntent.SyncDocument) intent).text());
            case APPLY_DOCUMENT -> applyDocument(((SessionIntent.ApplyDocument) intent).text());
            case ASK_CONTROL_APPROVAL -> askApproval(((SessionIntent.AskControlApproval) intent).linkId());
            case NOTIFY -> notifyListener((SessionIntent.Notify) intent);
            case OBSERVE -> {
                SessionIntent.Observe o = (SessionIntent.Observe) intent;
                observe(o.observation(), state.linkId(), o.detail());
            }
        }
    }

    // ---------------------------------------------------------------------
    // Transport
    // ---------------------------------------------------------------------

    private void bind(SessionIntent.BindListener intent)
    {
        syncPolicy.reset();
        try {
            transport.listen(new InetSocketAddress(config.bindHost(), intent.port()));
        }
        catch (RuntimeException e) {
            // Rejected before any callback could report it; the session must not stay in BINDING.
            events.accept(new LinkEvent.ListenFailed(clock.instant(), e));
        }
    }

    private void dial(SessionIntent.Dial intent)
    {
        syncPolicy.reset();
        try {
            // Resolution happens on the transport's thread, not here.
            transport.connect(InetSocketAddress.createUnresolved(intent.host(), intent.port()),
                    config.connectTimeout());
        }
        catch (RuntimeException e) {
            events.accept(new LinkEvent.DialFailed(clock.instant(), e));
        }
    }

    private void closeTransport()
    {
        syncPolicy.reset();
        links.closeAll();
        transport.closeAll();
    }

    // ---------------------------------------------------------------------
    // Messages
    // ---------------------------------------------------------------------

    private boolean send(SessionState state, CollabMessage message)
    {
        Optional<PeerLink> link = links.get(state.linkId());
        if (link.isEmpty()) {
            observe(CollabProtocolObservabilityEvent.Kind.STALE_EVENT_IGNORED, state.linkId(),
                    "no open link for " + message.kind().wireName());
            return false;
        }

        try {
            link.get().send(message);
        } catch (PeerWriteException e) {
            error("Failed to send " + message.kind().wireName() + " on link " + state.linkId(), e);
            return false;
        } catch (IllegalArgumentException e) {
            error("Message " + message.kind().wireName() + " too large to send", e);
            return false;
        }

        observe(CollabProtocolObservabilityEvent.Kind.MESSAGE_SENT, state.linkId(),
                message.kind().wireName() + " " + message.preview());
        return true;
    }

    private void pushDocument(SessionState state)
    {
        String text = editor.text();
        if (send(state, CollabMessage.textUpdate(text))) {
            syncPolicy.markSent(text);
        }
    }

    private void syncDocument(SessionState state, String text)
    {
        if (!syncPolicy.isNewerThanPeer(text)) {
            observe(CollabProtocolObservabilityEvent.Kind.UPDATE_SUPPRESSED, state.linkId(),
                    "unchanged document (" + text.length() + " chars)");
            return;
        }
        if (send(state, CollabMessage.textUpdate(text))) {
            syncPolicy.markSent(text);
        }
    }

    private void applyDocument(String text)
    {
        try {
            syncPolicy.applyRemote(editor, text);
        } catch (RuntimeException e) {
            error("Editor failed to apply a remote update", e);
        }
    }

    // ---------------------------------------------------------------------
    // User
    // ---------------------------------------------------------------------

    private void askApproval(long linkId)
    {
        PendingControlDecision decision = new PendingControlDecision(linkId, events, clock);
        try {
            controlRequestHandler.onControlRequested(decision);
        } catch (RuntimeException e) {
            error("Control request handler failed; declining", e);
            decision.decline();
        }
    }

    private void notifyListener(SessionIntent.Notify intent)
    {
        try {
            listener.onNotification(new SessionNotification(clock.instant(), intent.notification(), intent.message()));
        } catch (RuntimeException e) {
            error("Session listener failed on " + intent.notification(), e);
        }
    }

    // ---------------------------------------------------------------------
    // Observability
    // ---------------------------------------------------------------------

    private void observe(CollabProtocolObservabilityEvent.Kind kind, long linkId, String detail)
    {
        sink.onProtocolEvent(new CollabProtocolObservabilityEvent(clock.instant(), kind, linkId, detail));
    }

    private void error(String message, Throwable cause)
    {
        sink.onError(new CollabErrorEvent(clock.instant(), message, cause));
    }
}
