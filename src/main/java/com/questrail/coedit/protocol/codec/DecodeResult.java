package com.questrail.coedit.protocol.codec;

import com.questrail.coedit.protocol.model.CollabMessage;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single {@link CollabFrameDecoder#decode} call.
 *
 * @param message the decoded message, or empty when the frame is incomplete
 * @param bytesConsumed length of the decoded frame; {@code 0} when incomplete
 */
public record DecodeResult(Optional<CollabMessage> message, int bytesConsumed)
{
    private static final DecodeResult INCOMPLETE = new DecodeResult(Optional.empty(), 0);

    public DecodeResult {
        Objects.requireNonNull(message, "message");
        if (bytesConsumed < 0) {
            throw new IllegalArgumentException("bytesConsumed must not be negative");
        }
        if (message.isEmpty() && bytesConsumed != 0) {
            throw new IllegalArgumentException("an incomplete result consumes nothing");
        }
    }

    public static DecodeResult incomplete()
    {
        return INCOMPLETE;
    }

    public static DecodeResult of(CollabMessage message, int bytesConsumed)
    {
        return new DecodeResult(Optional.of(message), bytesConsumed);
    }

    public boolean isComplete()
    {
        return message.isPresent();
    }
}
