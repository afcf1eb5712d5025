package com.questrail.coedit.protocol.model;

import java.util.Objects;

/**
 * CollabMessage
 * -----------------------------------------------------------------------------
 * One protocol message: a {@link MessageKind} plus its payload string.
 *
 * <p>Messages are transient. They are constructed, encoded, sent and
 * discarded; nothing retains them between frames.</p>
 *
 * <p>Payload rules:</p>
 * <ul>
 *   <li>{@link MessageKind#TEXT_UPDATE}: the full document text. It may be the
 *       empty string (an emptied document is still a document).</li>
 *   <li>Control kinds: always the empty string.</li>
 * </ul>
 *
 * @param kind message kind
 * @param payload document text for text updates, empty otherwise
 */
public record CollabMessage(MessageKind kind, String payload)
{
    public CollabMessage {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        if (kind.isControl() && !payload.isEmpty()) {
            throw new IllegalArgumentException(kind + " must not carry a payload");
        }
    }

    public static CollabMessage textUpdate(String documentText)
    {
        return new CollabMessage(MessageKind.TEXT_UPDATE, documentText);
    }

    public static CollabMessage requestControl()
    {
        return new CollabMessage(MessageKind.REQUEST_CONTROL, "");
    }

    public static CollabMessage grantControl()
    {
        return new CollabMessage(MessageKind.GRANT_CONTROL, "");
    }

    public static CollabMessage revokeControl()
    {
        return new CollabMessage(MessageKind.REVOKE_CONTROL, "");
    }

    public static CollabMessage declineControl()
    {
        return new CollabMessage(MessageKind.DECLINE_CONTROL, "");
    }

    /**
     * Short, single-line rendering of the payload for logs.
     */
    public String preview()
    {
        String flat = payload.replace('\n', ' ').replace('\r', ' ');
        return flat.length() <= 50 ? flat : flat.substring(0, 50) + "...";
    }

    @Override
    public String toString()
    {
        return kind.isControl()
                ? "CollabMessage[" + kind + "]"
                : "CollabMessage[" + kind + ", " + payload.length() + " chars]";
    }
}
