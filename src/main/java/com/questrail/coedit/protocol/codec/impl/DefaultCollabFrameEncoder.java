package com.questrail.coedit.protocol.codec.impl;

import com.questrail.coedit.protocol.codec.CollabFrameEncoder;
import com.questrail.coedit.protocol.model.CollabMessage;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * DefaultCollabFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link CollabFrameEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultCollabFrameDecoder}:</p>
 * <ol>
 *   <li>Render the JSON envelope</li>
 *   <li>Encode it as UTF-8</li>
 *   <li>Prepend the 4-byte big-endian body length</li>
 * </ol>
 */
public final class DefaultCollabFrameEncoder implements CollabFrameEncoder
{
    private final int maxFrameLength;

    public DefaultCollabFrameEncoder()
    {
        this(CollabFraming.DEFAULT_MAX_FRAME_LENGTH);
    }

    /**
     * @param maxFrameLength largest body the peer is expected to accept
     */
    public DefaultCollabFrameEncoder(int maxFrameLength)
    {
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be positive");
        }
        this.maxFrameLength = maxFrameLength;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if the encoded body exceeds the
     *         configured maximum frame length
     */
    @Override
    public byte[] encode(CollabMessage message)
    {
        Objects.requireNonNull(message, "message");

        byte[] body = CollabJsonEnvelope.toJson(message).getBytes(StandardCharsets.UTF_8);
        if (body.length > maxFrameLength) {
            throw new IllegalArgumentException("Frame body of " + body.length
                    + " bytes exceeds limit of " + maxFrameLength);
        }
        return CollabFraming.frame(body);
    }
}
