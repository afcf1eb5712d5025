package com.questrail.coedit.protocol.runtime;

import com.questrail.coedit.api.CollabSession;
import com.questrail.coedit.api.ControlRequestHandler;
import com.questrail.coedit.api.DocumentEditor;
import com.questrail.coedit.api.SessionListener;
import com.questrail.coedit.api.SessionStatus;
import com.questrail.coedit.protocol.CollabSessionController;
import com.questrail.coedit.protocol.codec.impl.DefaultCollabFrameDecoder;
import com.questrail.coedit.protocol.codec.impl.DefaultCollabFrameEncoder;
import com.questrail.coedit.protocol.config.CollabRuntimeConfig;
import com.questrail.coedit.protocol.internal.events.SessionCommandEvent;
import com.questrail.coedit.protocol.internal.events.SessionEvent;
import com.questrail.coedit.protocol.internal.exec.DefaultSessionIntentExecutor;
import com.questrail.coedit.protocol.internal.state.SessionReducer;
import com.questrail.coedit.protocol.internal.state.SessionState;
import com.questrail.coedit.protocol.link.PeerLinks;
import com.questrail.coedit.protocol.observability.CollabObservabilitySink;
import com.questrail.coedit.protocol.observability.NullObservabilitySink;
import com.questrail.coedit.protocol.sync.DocumentSyncPolicy;
import com.questrail.coedit.protocol.transport.PeerTransport;
import com.questrail.coedit.protocol.transport.tcp.netty.NettyTcpPeerTransport;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * CollabSessionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a collaboration session.
 *
 * <p>Every {@link CollabSession} command becomes an event for the
 * {@link CollabSessionController}; nothing here decides what a command means.
 * The one exception is {@link #onLocalDocumentChanged()}, which drops the
 * editor's echo of a remote update before it can become an event.</p>
 *
 * <pre>
 *   CollabSessionRuntime session = CollabSessionRuntime.builder()
 *           .withEditor(editor)
 *           .withControlRequestHandler(dialog)
 *           .withListener(statusBar)
 *           .build();
 *   session.startHosting(54321);
 * </pre>
 */
public final class CollabSessionRuntime implements CollabSession
{
    private final CollabSessionController controller;
    private final CollabTcpRuntime tcpRuntime;
    private final DocumentEditor editor;
    private final DocumentSyncPolicy syncPolicy;
    private final Clock clock;

    private CollabSessionRuntime(Builder builder)
    {
        this.editor = builder.editor;
        this.clock = builder.clock;
        this.syncPolicy = new DocumentSyncPolicy();

        PeerLinks links = new PeerLinks();
        DefaultSessionIntentExecutor executor = new DefaultSessionIntentExecutor(
                builder.transport,
                links,
                builder.editor,
                syncPolicy,
                builder.controlRequestHandler,
                builder.listener,
                builder.observabilitySink,
                builder.config,
                this::submit,
                clock);

        this.controller = new CollabSessionController(
                SessionState.idle(clock.instant()),
                new SessionReducer(),
                executor,
                builder.listener,
                builder.observabilitySink,
                clock);

        this.tcpRuntime = new CollabTcpRuntime(
                builder.transport,
                links,
                new DefaultCollabFrameEncoder(builder.config.maxFrameBytes()),
                new DefaultCollabFrameDecoder(builder.config.maxFrameBytes()),
                this::submit,
                builder.observabilitySink,
                clock);
    }

    private void submit(SessionEvent event)
    {
        controller.submit(event);
    }

    @Override
    public void startHosting(int port)
    {
        submit(new SessionCommandEvent.StartHosting(clock.instant(), port));
    }

    @Override
    public void connectToHost(String host, int port)
    {
        submit(new SessionCommandEvent.ConnectToHost(clock.instant(), host, port));
    }

    @Override
    public void stopSession()
    {
        submit(new SessionCommandEvent.StopSession(clock.instant()));
    }

    @Override
    public void requestControl()
    {
        submit(new SessionCommandEvent.RequestControl(clock.instant()));
    }

    @Override
    public void onLocalDocumentChanged()
    {
        if (syncPolicy.isApplyingRemote()) {
            // Echo of a remote update being applied.
            return;
        }
        submit(new SessionCommandEvent.LocalDocumentChanged(clock.instant(), editor.text()));
    }

    @Override
    public void onUserRequestedReclaim()
    {
        submit(new SessionCommandEvent.ReclaimControl(clock.instant()));
    }

    @Override
    public SessionStatus status()
    {
        return controller.state().status();
    }

    /**
     * The address actually bound while hosting; useful after hosting on port 0.
     */
    public Optional<InetSocketAddress> listeningAddress()
    {
        return tcpRuntime.listeningAddress();
    }

    /**
     * Stop the session and release the transport. The runtime cannot be reused.
     */
    public void shutdown()
    {
        stopSession();
        tcpRuntime.shutdown();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private CollabRuntimeConfig config = CollabRuntimeConfig.defaults();
        private DocumentEditor editor;
        private ControlRequestHandler controlRequestHandler = ControlRequestHandler.ALWAYS_DECLINE;
        private SessionListener listener = SessionListener.NONE;
        private CollabObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private PeerTransport transport;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder withConfig(CollabRuntimeConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withEditor(DocumentEditor editor)
        {
            this.editor = editor;
            return this;
        }

        public Builder withControlRequestHandler(ControlRequestHandler handler)
        {
            this.controlRequestHandler = handler;
            return this;
        }

        public Builder withListener(SessionListener listener)
        {
            this.listener = listener;
            return this;
        }

        public Builder withObservabilitySink(CollabObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replace the transport. Defaults to a fresh {@link NettyTcpPeerTransport}.
         */
        public Builder withTransport(PeerTransport transport)
        {
            this.transport = transport;
            return this;
        }

        public Builder withClock(Clock clock)
        {
            this.clock = clock;
            return this;
        }

        public CollabSessionRuntime build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(editor, "editor");
            Objects.requireNonNull(controlRequestHandler, "controlRequestHandler");
            Objects.requireNonNull(listener, "listener");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");
            if (transport == null) {
                transport = new NettyTcpPeerTransport();
            }
            return new CollabSessionRuntime(this);
        }
    }
}
