package com.questrail.coedit.protocol.codec;

/**
 * Raised when the frame at the front of the inbound stream is structurally
 * invalid.
 *
 * <p>A <em>recoverable</em> failure names exactly how many bytes belong to the
 * bad frame, so the reader can drop them and continue with the next frame. An
 * unrecoverable failure means the frame boundary itself is lost; the only safe
 * reaction is to drop the connection.</p>
 */
public final class FramingException extends Exception
{
    private final boolean recoverable;
    private final int discardLength;

    private FramingException(String message, Throwable cause, boolean recoverable, int discardLength)
    {
        super(message, cause);
        this.recoverable = recoverable;
        this.discardLength = discardLength;
    }

    /**
     * A bad frame whose extent is known.
     *
     * @param message diagnostic text
     * @param discardLength total bytes of the bad frame, prefix included
     */
    public static FramingException recoverable(String message, int discardLength)
    {
        return recoverable(message, null, discardLength);
    }

    public static FramingException recoverable(String message, Throwable cause, int discardLength)
    {
        if (discardLength <= 0) {
            throw new IllegalArgumentException("discardLength must be positive");
        }
        return new FramingException(message, cause, true, discardLength);
    }

    /**
     * A failure after which no later frame boundary can be trusted.
     */
    public static FramingException unrecoverable(String message)
    {
        return new FramingException(message, null, false, 0);
    }

    public boolean recoverable()
    {
        return recoverable;
    }

    /**
     * Bytes to drop from the front of the stream; {@code 0} when unrecoverable.
     */
    public int discardLength()
    {
        return discardLength;
    }
}
