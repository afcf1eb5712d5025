package com.questrail.coedit.protocol.transport.tcp.netty;

import com.questrail.coedit.protocol.transport.PeerConnection;
import com.questrail.coedit.protocol.transport.PeerTransportListener;
import com.questrail.coedit.protocol.transport.PeerWriteException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.questrail.coedit.test.Eventually.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTcpPeerTransportTest
 * -----------------------------------------------------------------------------
 * Loopback tests for {@link NettyTcpPeerTransport}. Ports are ephemeral.
 */
final class NettyTcpPeerTransportTest
{
    private static final Duration TIMEOUT = Duration.ofSeconds(2);
    private static final InetSocketAddress ANY_LOOPBACK_PORT = new InetSocketAddress("127.0.0.1", 0);

    private final List<NettyTcpPeerTransport> transports = new ArrayList<>();

    @AfterEach
    void tearDown()
    {
        transports.forEach(NettyTcpPeerTransport::shutdown);
    }

    @Test
    void listensOnAnEphemeralPort()
    {
        Recorder host = new Recorder();
        NettyTcpPeerTransport transport = transport(host);

        transport.listen(ANY_LOOPBACK_PORT);

        await("listening", () -> host.listening() != null);
        assertTrue(host.listening().getPort() > 0);
        assertEquals(host.listening(), transport.listeningAddress().orElseThrow());
    }

    @Test
    void connectsAndCarriesBytesBothWays()
    {
        Recorder hostEvents = new Recorder();
        Recorder clientEvents = new Recorder();
        NettyTcpPeerTransport host = transport(hostEvents);
        NettyTcpPeerTransport client = transport(clientEvents);

        int port = listen(host, hostEvents);
        client.connect(InetSocketAddress.createUnresolved("127.0.0.1", port), TIMEOUT);

        await("client connected", () -> clientEvents.connections().size() == 1);
        await("host accepted", () -> hostEvents.connections().size() == 1);

        PeerConnection toHost = clientEvents.connections().get(0);
        PeerConnection toClient = hostEvents.connections().get(0);
        assertTrue(toHost.isOpen());

        toHost.write("ping".getBytes(StandardCharsets.UTF_8));
        toClient.write("pong".getBytes(StandardCharsets.UTF_8));

        await("host received", () -> hostEvents.received(toClient.linkId()).equals("ping"));
        await("client received", () -> clientEvents.received(toHost.linkId()).equals("pong"));
    }

    @Test
    void bindConflictIsReportedAsListenFailure()
    {
        Recorder firstEvents = new Recorder();
        Recorder secondEvents = new Recorder();
        int port = listen(transport(firstEvents), firstEvents);

        transport(secondEvents).listen(new InetSocketAddress("127.0.0.1", port));

        await("listen failure", () -> secondEvents.listenFailure() != null);
        assertNull(secondEvents.listening());
    }

    @Test
    void refusedDialIsReportedAsConnectFailure() throws IOException
    {
        int port;
        try (ServerSocket probe = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = probe.getLocalPort();
        }

        Recorder clientEvents = new Recorder();
        transport(clientEvents).connect(new InetSocketAddress("127.0.0.1", port), TIMEOUT);

        await("connect failure", () -> clientEvents.connectFailure() != null);
        assertTrue(clientEvents.connections().isEmpty());
    }

    @Test
    void newPeerPreemptsTheCurrentOne()
    {
        Recorder hostEvents = new Recorder();
        Recorder firstEvents = new Recorder();
        Recorder secondEvents = new Recorder();
        NettyTcpPeerTransport host = transport(hostEvents);
        int port = listen(host, hostEvents);

        transport(firstEvents).connect(new InetSocketAddress("127.0.0.1", port), TIMEOUT);
        await("first accepted", () -> hostEvents.connections().size() == 1);
        long firstLink = hostEvents.connections().get(0).linkId();

        transport(secondEvents).connect(new InetSocketAddress("127.0.0.1", port), TIMEOUT);
        await("second accepted", () -> hostEvents.connections().size() == 2);
        long secondLink = hostEvents.connections().get(1).linkId();

        assertTrue(secondLink > firstLink);
        await("first link closed on host", () -> hostEvents.closed().contains(firstLink));
        await("first client sees closure", () -> !firstEvents.closed().isEmpty());
        assertTrue(hostEvents.connections().get(1).isOpen());
        assertFalse(hostEvents.closed().contains(secondLink));
    }

    @Test
    void closeAllDropsThePeerAndStopsListening()
    {
        Recorder hostEvents = new Recorder();
        Recorder clientEvents = new Recorder();
        NettyTcpPeerTransport host = transport(hostEvents);
        int port = listen(host, hostEvents);
        transport(clientEvents).connect(new InetSocketAddress("127.0.0.1", port), TIMEOUT);
        await("accepted", () -> hostEvents.connections().size() == 1);
        PeerConnection toClient = hostEvents.connections().get(0);

        host.closeAll();
        host.closeAll();

        await("client sees closure", () -> !clientEvents.closed().isEmpty());
        assertTrue(host.listeningAddress().isEmpty());
        await("connection closed", () -> !toClient.isOpen());
        assertThrows(PeerWriteException.class, () -> toClient.write(new byte[] { 1 }));
    }

    @Test
    void listenWithoutListenerIsRejected()
    {
        NettyTcpPeerTransport transport = new NettyTcpPeerTransport();
        transports.add(transport);

        assertThrows(IllegalStateException.class, () -> transport.listen(ANY_LOOPBACK_PORT));
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private NettyTcpPeerTransport transport(Recorder listener)
    {
        NettyTcpPeerTransport transport = new NettyTcpPeerTransport();
        transport.setListener(listener);
        transports.add(transport);
        return transport;
    }

    private static int listen(NettyTcpPeerTransport transport, Recorder events)
    {
        transport.listen(ANY_LOOPBACK_PORT);
        await("listening", () -> events.listening() != null);
        return events.listening().getPort();
    }

    private static final class Recorder implements PeerTransportListener
    {
        private InetSocketAddress listening;
        private Throwable listenFailure;
        private Throwable connectFailure;
        private final List<PeerConnection> connections = new ArrayList<>();
        private final List<Long> closed = new ArrayList<>();
        private final List<Long> byteLinks = new ArrayList<>();
        private final List<byte[]> bytes = new ArrayList<>();

        @Override
        public synchronized void onListening(InetSocketAddress localAddress)
        {
            listening = localAddress;
        }

        @Override
        public synchronized void onListenFailed(Throwable cause)
        {
            listenFailure = cause;
        }

        @Override
        public synchronized void onPeerAccepted(PeerConnection connection)
        {
            connections.add(connection);
        }

        @Override
        public synchronized void onConnected(PeerConnection connection)
        {
            connections.add(connection);
        }

        @Override
        public synchronized void onConnectFailed(Throwable cause)
        {
            connectFailure = cause;
        }

        @Override
        public synchronized void onBytes(long linkId, byte[] chunk)
        {
            byteLinks.add(linkId);
            bytes.add(chunk);
        }

        @Override
        public synchronized void onPeerClosed(long linkId, Throwable cause)
        {
            closed.add(linkId);
        }

        synchronized InetSocketAddress listening()
        {
            return listening;
        }

        synchronized Throwable listenFailure()
        {
            return listenFailure;
        }

        synchronized Throwable connectFailure()
        {
            return connectFailure;
        }

        synchronized List<PeerConnection> connections()
        {
            return new ArrayList<>(connections);
        }

        synchronized List<Long> closed()
        {
            return new ArrayList<>(closed);
        }

        synchronized String received(long linkId)
        {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            for (int i = 0; i < bytes.size(); i++) {
                if (byteLinks.get(i) == linkId) {
                    out.writeBytes(bytes.get(i));
                }
            }
            return out.toString(StandardCharsets.UTF_8);
        }
    }
}
