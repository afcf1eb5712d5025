package com.questrail.coedit.protocol.transport.tcp.netty;

import com.questrail.coedit.protocol.transport.PeerConnection;
import com.questrail.coedit.protocol.transport.PeerWriteException;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * {@link PeerConnection} backed by a Netty {@link Channel}.
 *
 * <p>The channel never leaves this package. Writes are fire-and-forget; a
 * write that fails asynchronously closes the channel, which surfaces as
 * {@code onPeerClosed} carrying the write failure.</p>
 */
final class NettyPeerConnection implements PeerConnection
{
    private final long linkId;
    private final Channel channel;

    private volatile Throwable failure;

    NettyPeerConnection(long linkId, Channel channel)
    {
        this.linkId = linkId;
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public long linkId()
    {
        return linkId;
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public void write(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        if (!channel.isActive()) {
            throw new PeerWriteException("Link " + linkId + " is not connected");
        }

        channel.writeAndFlush(Unpooled.wrappedBuffer(bytes))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        recordFailure(future.cause());
                        future.channel().close();
                    }
                });
    }

    @Override
    public void abort()
    {
        if (channel.isOpen()) {
            try {
                // Linger 0 turns the close into a reset instead of a graceful FIN.
                channel.config().setOption(ChannelOption.SO_LINGER, 0);
            }
            catch (RuntimeException e) {
                recordFailure(e);
            }
        }
        channel.close();
    }

    void recordFailure(Throwable cause)
    {
        if (failure == null) {
            failure = cause;
        }
    }

    Throwable failure()
    {
        return failure;
    }

    @Override
    public String toString()
    {
        return "NettyPeerConnection[" + linkId + " " + channel.remoteAddress() + "]";
    }
}
