package com.questrail.coedit.protocol.link;

import com.questrail.coedit.protocol.codec.CollabFrameDecoder;
import com.questrail.coedit.protocol.codec.CollabFrameEncoder;
import com.questrail.coedit.protocol.codec.DecodeResult;
import com.questrail.coedit.protocol.codec.FramingException;
import com.questrail.coedit.protocol.model.CollabMessage;
import com.questrail.coedit.protocol.transport.PeerConnection;
import com.questrail.coedit.protocol.transport.PeerWriteException;

import java.net.SocketAddress;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PeerLink
 * -----------------------------------------------------------------------------
 * A framed, message-level view of one {@link PeerConnection}.
 *
 * <h2>Inbound</h2>
 * Raw reads are appended to a private buffer and every complete frame at its
 * front is decoded and handed to the {@link PeerLinkListener}, in order. A
 * trailing partial frame stays buffered until the rest arrives. A frame that is
 * malformed but whose length is known is skipped; a frame whose length cannot be
 * trusted closes the link.
 *
 * <h2>Outbound</h2>
 * {@link #send(CollabMessage)} encodes and writes one frame. A write failure
 * closes the link before the exception reaches the caller.
 *
 * <h2>Closure</h2>
 * However the link ends (local {@link #close}, peer close reported by the
 * transport, write failure, unrecoverable framing error),
 * {@link PeerLinkListener#onClosed} fires exactly once.
 *
 * <p>{@link #onBytes(byte[])} must be called by a single reader thread, as the
 * transport does. {@link #send} and {@link #close} may be called from any
 * thread.</p>
 */
public final class PeerLink
{
    private static final int INITIAL_BUFFER = 4096;

    private final PeerConnection connection;
    private final CollabFrameEncoder encoder;
    private final CollabFrameDecoder decoder;
    private final PeerLinkListener listener;
    private final AtomicBoolean closed = new AtomicBoolean();

    private byte[] readBuffer = new byte[INITIAL_BUFFER];
    private int readLength;

    public PeerLink(PeerConnection connection,
                    CollabFrameEncoder encoder,
                    CollabFrameDecoder decoder,
                    PeerLinkListener listener)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public long linkId()
    {
        return connection.linkId();
    }

    public SocketAddress remoteAddress()
    {
        return connection.remoteAddress();
    }

    public boolean isOpen()
    {
        return !closed.get() && connection.isOpen();
    }

    /**
     * Number of received bytes not yet forming a complete frame.
     */
    public int bufferedBytes()
    {
        return readLength;
    }

    // ---------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------

    /**
     * Encode and transmit one message.
     *
     * @throws PeerWriteException if the link is closed or the write fails;
     *         in the latter case the link is closed first
     * @throws IllegalArgumentException if the message exceeds the frame limit
     */
    public void send(CollabMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (closed.get()) {
            throw new PeerWriteException("link " + linkId() + " is closed");
        }

        byte[] frame = encoder.encode(message);
        try {
            connection.write(frame);
        } catch (PeerWriteException e) {
            close(e);
            throw e;
        }
    }

    // ---------------------------------------------------------------------
    // Inbound
    // ---------------------------------------------------------------------

    /**
     * Feed bytes read from the connection.
     */
    public void onBytes(byte[] bytes)
    {
        if (closed.get() || bytes.length == 0) {
            return;
        }

        append(bytes);

        int position = 0;
        while (!closed.get() && position < readLength) {
            DecodeResult result;
            try {
                result = decoder.decode(readBuffer, position, readLength - position);
            } catch (FramingException e) {
                if (!e.recoverable()) {
                    readLength = 0;
                    close(e);
                    return;
                }
                position += Math.min(e.discardLength(), readLength - position);
                listener.onFrameDiscarded(this, e);
                continue;
            }

            if (!result.isComplete()) {
                break;
            }
            position += result.bytesConsumed();
            listener.onMessage(this, result.message().get());
        }

        compact(position);
    }

    /**
     * The transport reported that the connection ended.
     */
    public void onTransportClosed(Throwable cause)
    {
        signalClosed(cause);
    }

    // ---------------------------------------------------------------------
    // Closure
    // ---------------------------------------------------------------------

    /**
     * Close the link. Idempotent.
     *
     * @param cause reason, or {@code null} for a deliberate local close
     */
    public void close(Throwable cause)
    {
        if (signalClosed(cause)) {
            connection.abort();
        }
    }

    private boolean signalClosed(Throwable cause)
    {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        listener.onClosed(this, cause);
        return true;
    }

    // ---------------------------------------------------------------------
    // Buffer management
    // ---------------------------------------------------------------------

    private void append(byte[] bytes)
    {
        int needed = readLength + bytes.length;
        if (needed > readBuffer.length) {
            readBuffer = Arrays.copyOf(readBuffer, Math.max(needed, readBuffer.length * 2));
        }
        System.arraycopy(bytes, 0, readBuffer, readLength, bytes.length);
        readLength = needed;
    }

    private void compact(int consumed)
    {
        if (consumed <= 0) {
            return;
        }
        int remaining = readLength - consumed;
        if (remaining > 0) {
            System.arraycopy(readBuffer, consumed, readBuffer, 0, remaining);
        }
        readLength = Math.max(remaining, 0);
    }

    @Override
    public String toString()
    {
        return "PeerLink[" + linkId() + ", " + remoteAddress() + (closed.get() ? ", closed" : "") + "]";
    }
}
