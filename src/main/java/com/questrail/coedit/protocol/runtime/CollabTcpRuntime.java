package com.questrail.coedit.protocol.runtime;

import com.questrail.coedit.protocol.codec.CollabFrameDecoder;
import com.questrail.coedit.protocol.codec.CollabFrameEncoder;
import com.questrail.coedit.protocol.codec.FramingException;
import com.questrail.coedit.protocol.internal.events.LinkEvent;
import com.questrail.coedit.protocol.internal.events.MessageEvent;
import com.questrail.coedit.protocol.internal.events.SessionEvent;
import com.questrail.coedit.protocol.link.PeerLink;
import com.questrail.coedit.protocol.link.PeerLinkListener;
import com.questrail.coedit.protocol.link.PeerLinks;
import com.questrail.coedit.protocol.model.CollabMessage;
import com.questrail.coedit.protocol.observability.CollabObservabilitySink;
import com.questrail.coedit.protocol.observability.CollabProtocolObservabilityEvent;
import com.questrail.coedit.protocol.observability.CollabTransportObservabilityEvent;
import com.questrail.coedit.protocol.transport.PeerConnection;
import com.questrail.coedit.protocol.transport.PeerTransport;
import com.questrail.coedit.protocol.transport.PeerTransportListener;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * CollabTcpRuntime
 * =============================================================================
 * Wiring between a {@link PeerTransport} and the session event loop.
 *
 * <h2>Inbound data flow (decode-before-event)</h2>
 * <pre>
 *   PeerTransport
 *        → PeerLink (buffering + CollabFrameDecoder)
 *            → Semantic event (MessageReceived)
 *                → CollabSessionController
 * </pre>
 * The reducer never sees bytes. Malformed frames are dropped at the link and
 * only observed.
 *
 * <h2>Lifecycle</h2>
 * Every accepted or dialed connection is wrapped in a {@link PeerLink} and
 * registered before the corresponding event is submitted, so the executor can
 * reply on it as soon as the state machine has adopted it. Link closure is
 * reported once per link, whichever side noticed it first.
 *
 * <p>No session semantics live here.</p>
 */
public final class CollabTcpRuntime
{
    private final PeerTransport transport;
    private final PeerLinks links;
    private final CollabFrameEncoder encoder;
    private final CollabFrameDecoder decoder;
    private final Consumer<SessionEvent> events;
    private final CollabObservabilitySink sink;
    private final Clock clock;

    private final LinkListener linkListener = new LinkListener();

    public CollabTcpRuntime(PeerTransport transport,
                            PeerLinks links,
                            CollabFrameEncoder encoder,
                            CollabFrameDecoder decoder,
                            Consumer<SessionEvent> events,
                            CollabObservabilitySink sink,
                            Clock clock)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.links = Objects.requireNonNull(links, "links");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.events = Objects.requireNonNull(events, "events");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.transport.setListener(new TransportListener());
    }

    public Optional<InetSocketAddress> listeningAddress()
    {
        return transport.listeningAddress();
    }

    public void shutdown()
    {
        links.closeAll();
        transport.shutdown();
    }

    private PeerLink adopt(PeerConnection connection)
    {
        PeerLink link = new PeerLink(connection, encoder, decoder, linkListener);
        links.register(link);
        return link;
    }

    private void transportEvent(CollabTransportObservabilityEvent.Kind kind, long linkId, String detail)
    {
        sink.onTransportEvent(new CollabTransportObservabilityEvent(clock.instant(), kind, linkId, detail));
    }

    private void protocolEvent(CollabProtocolObservabilityEvent.Kind kind, long linkId, String detail)
    {
        sink.onProtocolEvent(new CollabProtocolObservabilityEvent(clock.instant(), kind, linkId, detail));
    }

    private static String describe(Throwable cause)
    {
        if (cause == null) {
            return "closed";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    // -------------------------------------------------------------------------
    // Transport listener
    // -------------------------------------------------------------------------

    private final class TransportListener implements PeerTransportListener
    {
        @Override
        public void onListening(InetSocketAddress localAddress)
        {
            transportEvent(CollabTransportObservabilityEvent.Kind.LISTENING, 0, String.valueOf(localAddress));
            events.accept(new LinkEvent.ListenStarted(clock.instant(), localAddress));
        }

        @Override
        public void onListenFailed(Throwable cause)
        {
            transportEvent(CollabTransportObservabilityEvent.Kind.LISTEN_FAILED, 0, describe(cause));
            events.accept(new LinkEvent.ListenFailed(clock.instant(), cause));
        }

        @Override
        public void onPeerAccepted(PeerConnection connection)
        {
            PeerLink link = adopt(connection);
            transportEvent(CollabTransportObservabilityEvent.Kind.PEER_ACCEPTED, link.linkId(),
                    String.valueOf(link.remoteAddress()));
            events.accept(new LinkEvent.PeerAccepted(clock.instant(), link.linkId(), link.remoteAddress()));
        }

        @Override
        public void onConnected(PeerConnection connection)
        {
            PeerLink link = adopt(connection);
            transportEvent(CollabTransportObservabilityEvent.Kind.CONNECTED, link.linkId(),
                    String.valueOf(link.remoteAddress()));
            events.accept(new LinkEvent.DialSucceeded(clock.instant(), link.linkId(), link.remoteAddress()));
        }

        @Override
        public void onConnectFailed(Throwable cause)
        {
            transportEvent(CollabTransportObservabilityEvent.Kind.CONNECT_FAILED, 0, describe(cause));
            events.accept(new LinkEvent.DialFailed(clock.instant(), cause));
        }

        @Override
        public void onBytes(long linkId, byte[] bytes)
        {
            Optional<PeerLink> link = links.get(linkId);
            if (link.isEmpty()) {
                protocolEvent(CollabProtocolObservabilityEvent.Kind.STALE_EVENT_IGNORED, linkId,
                        bytes.length + " bytes on a retired link");
                return;
            }
            link.get().onBytes(bytes);
        }

        @Override
        public void onPeerClosed(long linkId, Throwable cause)
        {
            transportEvent(CollabTransportObservabilityEvent.Kind.LINK_CLOSED, linkId, describe(cause));
            links.get(linkId).ifPresent(link -> link.onTransportClosed(cause));
        }
    }

    // -------------------------------------------------------------------------
    // Link listener
    // -------------------------------------------------------------------------

    private final class LinkListener implements PeerLinkListener
    {
        @Override
        public void onMessage(PeerLink link, CollabMessage message)
        {
            protocolEvent(CollabProtocolObservabilityEvent.Kind.MESSAGE_RECEIVED, link.linkId(),
                    message.kind().wireName() + " " + message.preview());
            events.accept(new MessageEvent.MessageReceived(clock.instant(), link.linkId(), message));
        }

        @Override
        public void onFrameDiscarded(PeerLink link, FramingException cause)
        {
            protocolEvent(CollabProtocolObservabilityEvent.Kind.FRAME_DISCARDED, link.linkId(),
                    cause.getMessage() + " (" + cause.discardLength() + " bytes)");
        }

        @Override
        public void onClosed(PeerLink link, Throwable cause)
        {
            links.remove(link.linkId());
            events.accept(new LinkEvent.LinkClosed(clock.instant(), link.linkId(), cause));
        }
    }
}
