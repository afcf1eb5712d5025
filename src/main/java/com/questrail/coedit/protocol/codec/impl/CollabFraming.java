package com.questrail.coedit.protocol.codec.impl;

/**
 * CollabFraming
 * -----------------------------------------------------------------------------
 * Length-prefix mechanics for the collaboration wire format.
 *
 * <p>Every frame starts with a 4-byte big-endian unsigned length {@code N},
 * followed by exactly {@code N} body bytes. The prefix is the only frame
 * delimiter; the body is never scanned for boundaries.</p>
 *
 * <p>This class knows nothing about JSON. It only reads and writes the prefix.</p>
 */
final class CollabFraming
{
    /** Size of the length prefix in bytes. */
    static final int HEADER_LENGTH = 4;

    /** Default upper bound for a single frame body (16 MiB). */
    static final int DEFAULT_MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private CollabFraming() {}

    /**
     * Reads the unsigned big-endian body length at {@code offset}.
     *
     * <p>The caller must ensure at least {@link #HEADER_LENGTH} bytes are
     * available. A {@code long} is returned because the prefix is unsigned.</p>
     */
    static long readBodyLength(byte[] buffer, int offset)
    {
        return ((long) (buffer[offset] & 0xFF) << 24)
                | ((buffer[offset + 1] & 0xFF) << 16)
                | ((buffer[offset + 2] & 0xFF) << 8)
                | (buffer[offset + 3] & 0xFF);
    }

    /**
     * Returns a new array holding the length prefix followed by {@code body}.
     */
    static byte[] frame(byte[] body)
    {
        final int n = body.length;
        byte[] frame = new byte[HEADER_LENGTH + n];
        frame[0] = (byte) (n >>> 24);
        frame[1] = (byte) (n >>> 16);
        frame[2] = (byte) (n >>> 8);
        frame[3] = (byte) n;
        System.arraycopy(body, 0, frame, HEADER_LENGTH, n);
        return frame;
    }
}
