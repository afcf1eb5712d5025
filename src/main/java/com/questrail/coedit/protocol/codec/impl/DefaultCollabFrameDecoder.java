package com.questrail.coedit.protocol.codec.impl;

import com.questrail.coedit.protocol.codec.CollabFrameDecoder;
import com.questrail.coedit.protocol.codec.DecodeResult;
import com.questrail.coedit.protocol.codec.FramingException;
import com.questrail.coedit.protocol.model.CollabMessage;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * DefaultCollabFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link CollabFrameDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Wait for the 4-byte length prefix</li>
 *   <li>Reject lengths beyond the configured maximum (unrecoverable: the
 *       prefix itself cannot be trusted)</li>
 *   <li>Wait for the full body</li>
 *   <li>Strict UTF-8 decode of the body</li>
 *   <li>Envelope parse into a {@link CollabMessage}</li>
 * </ol>
 *
 * <p>Failures in steps 4 and 5 are recoverable: the frame extent is known, so
 * the caller can skip exactly that frame.</p>
 */
public final class DefaultCollabFrameDecoder implements CollabFrameDecoder
{
    private final int maxFrameLength;

    public DefaultCollabFrameDecoder()
    {
        this(CollabFraming.DEFAULT_MAX_FRAME_LENGTH);
    }

    /**
     * @param maxFrameLength largest accepted body length in bytes
     */
    public DefaultCollabFrameDecoder(int maxFrameLength)
    {
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be positive");
        }
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    public DecodeResult decode(byte[] buffer, int offset, int length) throws FramingException
    {
        Objects.requireNonNull(buffer, "buffer");
        Objects.checkFromIndexSize(offset, length, buffer.length);

        // 1) Length prefix
        if (length < CollabFraming.HEADER_LENGTH) {
            return DecodeResult.incomplete();
        }
        final long bodyLength = CollabFraming.readBodyLength(buffer, offset);

        // 2) Bounds. A wild prefix means we have lost frame alignment.
        if (bodyLength > maxFrameLength) {
            throw FramingException.unrecoverable("Declared frame length " + bodyLength
                    + " exceeds limit of " + maxFrameLength);
        }

        // 3) Body
        final int frameLength = CollabFraming.HEADER_LENGTH + (int) bodyLength;
        if (length < frameLength) {
            return DecodeResult.incomplete();
        }

        // 4) UTF-8
        final String json;
        try {
            json = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(buffer, offset + CollabFraming.HEADER_LENGTH, (int) bodyLength))
                    .toString();
        }
        catch (CharacterCodingException e) {
            throw FramingException.recoverable("Frame body is not valid UTF-8", e, frameLength);
        }

        // 5) Envelope
        try {
            CollabMessage message = CollabJsonEnvelope.fromJson(json);
            return DecodeResult.of(message, frameLength);
        }
        catch (CollabJsonEnvelope.EnvelopeException e) {
            throw FramingException.recoverable(e.getMessage(), e, frameLength);
        }
    }
}
