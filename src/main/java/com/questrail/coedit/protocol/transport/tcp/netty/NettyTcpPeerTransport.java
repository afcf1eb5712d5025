package com.questrail.coedit.protocol.transport.tcp.netty;

import com.questrail.coedit.protocol.transport.PeerTransport;
import com.questrail.coedit.protocol.transport.PeerTransportListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyTcpPeerTransport
 * =============================================================================
 * Netty-backed implementation of the {@link PeerTransport} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode frames or messages</li>
 *   <li>Interpret control ownership or session state</li>
 *   <li>Retry binds or dials</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound bytes are copied into {@code byte[]}
 * and reference-counted buffers are released internally.
 *
 * <h2>Single peer</h2>
 * At most one connection is current. When listening, a newly accepted
 * connection preempts the current one: the old one is aborted first, then the
 * new one is announced. This is the one-peer model, not a broadcast group.
 *
 * <h2>Cancellation</h2>
 * Every {@link #listen}/{@link #connect} captures a generation number;
 * {@link #closeAll()} advances it, so results of cancelled attempts are closed
 * and never reported.
 *
 * <h2>Locking</h2>
 * The internal lock is never held while calling the listener. The listener
 * typically takes the session controller's lock, and the controller calls
 * back into this transport while holding it.
 */
public final class NettyTcpPeerTransport implements PeerTransport
{
    private final EventLoopGroup group;
    private final AtomicLong linkIds = new AtomicLong();
    private final Object lock = new Object();

    private volatile PeerTransportListener listener;

    // Guarded by lock.
    private long generation;
    private ChannelFuture pendingBind;
    private ChannelFuture pendingConnect;
    private Channel serverChannel;
    private NettyPeerConnection current;

    /**
     * We use a dedicated single-threaded {@link NioEventLoopGroup}. With at most
     * one listening socket and one peer there is nothing to spread across
     * threads, and one thread keeps callbacks serialized.
     */
    public NettyTcpPeerTransport()
    {
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public void setListener(PeerTransportListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void listen(InetSocketAddress bindAddress)
    {
        Objects.requireNonNull(bindAddress, "bindAddress");
        PeerTransportListener l = requireListener();

        final long gen;
        final ChannelFuture bind;
        synchronized (lock) {
            gen = generation;
            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(group)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch)
                        {
                            ch.pipeline().addLast(new PeerHandler(gen, true));
                        }
                    });
            bind = bootstrap.bind(bindAddress);
            pendingBind = bind;
        }

        bind.addListener((ChannelFutureListener) future -> {
            boolean report;
            synchronized (lock) {
                report = gen == generation;
                if (pendingBind == future) {
                    pendingBind = null;
                }
                if (report && future.isSuccess()) {
                    serverChannel = future.channel();
                }
            }

            if (!report) {
                if (future.isSuccess()) {
                    future.channel().close();
                }
                return;
            }

            if (future.isSuccess()) {
                l.onListening((InetSocketAddress) future.channel().localAddress());
            }
            else {
                l.onListenFailed(future.cause());
            }
        });
    }

    @Override
    public void connect(InetSocketAddress remote, Duration timeout)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(timeout, "timeout");
        PeerTransportListener l = requireListener();

        final long gen;
        final ChannelFuture dial;
        synchronized (lock) {
            gen = generation;
            Bootstrap bootstrap = new Bootstrap()
                    .group(group)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch)
                        {
                            ch.pipeline().addLast(new PeerHandler(gen, false));
                        }
                    });
            dial = bootstrap.connect(remote);
            pendingConnect = dial;
        }

        // Success is announced from channelActive; only failure is reported here.
        dial.addListener((ChannelFutureListener) future -> {
            boolean report;
            synchronized (lock) {
                report = gen == generation;
                if (pendingConnect == future) {
                    pendingConnect = null;
                }
            }
            if (report && !future.isSuccess()) {
                l.onConnectFailed(future.cause());
            }
        });
    }

    @Override
    public void closeAll()
    {
        final ChannelFuture bind;
        final ChannelFuture dial;
        final Channel server;
        final NettyPeerConnection peer;
        synchronized (lock) {
            generation++;
            bind = pendingBind;
            dial = pendingConnect;
            server = serverChannel;
            peer = current;
            pendingBind = null;
            pendingConnect = null;
            serverChannel = null;
            current = null;
        }

        if (bind != null) {
            bind.cancel(false);
        }
        if (dial != null) {
            dial.cancel(false);
        }
        if (server != null) {
            server.close();
        }
        if (peer != null) {
            peer.abort();
        }
    }

    @Override
    public Optional<InetSocketAddress> listeningAddress()
    {
        synchronized (lock) {
            return serverChannel == null
                    ? Optional.empty()
                    : Optional.of((InetSocketAddress) serverChannel.localAddress());
        }
    }

    /**
     * Closes everything and shuts the event loop down without waiting for it.
     * Must not be called expecting reuse.
     */
    @Override
    public void shutdown()
    {
        closeAll();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    private PeerTransportListener requireListener()
    {
        PeerTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("PeerTransportListener must be set before listen() or connect()");
        }
        return l;
    }

    /**
     * PeerHandler
     * -------------------------------------------------------------------------
     * One instance per socket. Announces the connection when it becomes
     * active, forwards inbound bytes, and reports closure exactly once for an
     * announced connection.
     */
    private final class PeerHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private final long gen;
        private final boolean accepted;

        private NettyPeerConnection connection;

        PeerHandler(long gen, boolean accepted)
        {
            this.gen = gen;
            this.accepted = accepted;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            NettyPeerConnection created = new NettyPeerConnection(linkIds.incrementAndGet(), ctx.channel());
            NettyPeerConnection previous;
            synchronized (lock) {
                if (gen != generation) {
                    ctx.close();
                    return;
                }
                previous = current;
                current = created;
            }
            connection = created;

            if (previous != null) {
                previous.abort();
            }

            PeerTransportListener l = listener;
            if (l != null) {
                if (accepted) {
                    l.onPeerAccepted(created);
                }
                else {
                    l.onConnected(created);
                }
            }
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            PeerTransportListener l = listener;
            if (l == null || connection == null) {
                return;
            }

            // Copy out of the ByteBuf (Netty containment rule); the base class releases it.
            byte[] bytes = new byte[msg.readableBytes()];
            msg.getBytes(msg.readerIndex(), bytes);
            l.onBytes(connection.linkId(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            NettyPeerConnection closed = connection;
            if (closed != null) {
                synchronized (lock) {
                    if (current == closed) {
                        current = null;
                    }
                }
                PeerTransportListener l = listener;
                if (l != null) {
                    l.onPeerClosed(closed.linkId(), closed.failure());
                }
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (connection != null) {
                connection.recordFailure(cause);
            }
            ctx.close();
        }
    }
}
