package com.questrail.coedit.protocol.codec;

/**
 * CollabFrameDecoder
 * -----------------------------------------------------------------------------
 * Inbound wire boundary for a byte stream that has no framing of its own.
 *
 * <p>TCP delivers bytes, not messages: one read may hold half a frame or
 * several frames. The decoder therefore looks only at the front of the
 * supplied region and reports how many bytes it consumed. Accumulating bytes
 * across reads is the caller's job.</p>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Interpreting what a message means for the session</li>
 *   <li>Buffering partial data between calls</li>
 *   <li>Deciding whether the link survives a framing failure</li>
 * </ul>
 */
public interface CollabFrameDecoder
{
    /**
     * Attempt to extract one complete message from the front of a byte region.
     *
     * @param buffer backing array
     * @param offset index of the first unread byte
     * @param length number of unread bytes available from {@code offset}
     * @return a decoded message with its frame length, or
     *         {@link DecodeResult#incomplete()} if more bytes are needed
     * @throws FramingException if the frame at the front is structurally
     *         invalid; {@link FramingException#recoverable()} tells the caller
     *         whether skipping {@link FramingException#discardLength()} bytes
     *         lands on the next frame
     */
    DecodeResult decode(byte[] buffer, int offset, int length) throws FramingException;

    /**
     * Convenience overload that decodes from the start of {@code buffer}.
     */
    default DecodeResult decode(byte[] buffer) throws FramingException
    {
        return decode(buffer, 0, buffer.length);
    }
}
