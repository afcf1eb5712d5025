package com.questrail.coedit.protocol.model;

import java.util.Optional;

/**
 * MessageKind
 * -----------------------------------------------------------------------------
 * The five message kinds exchanged between host and client.
 *
 * <p>Each kind carries its wire name, which is the value of the {@code "type"}
 * field in the JSON envelope. Only {@link #TEXT_UPDATE} carries content; the
 * four control kinds always travel with an empty {@code "content"}.</p>
 */
public enum MessageKind
{
    /** Full-document replacement. */
    TEXT_UPDATE("TEXT_UPDATE"),

    /** Client asks the host for editing control. */
    REQUEST_CONTROL("REQ_CONTROL"),

    /** Host hands editing control to the client. */
    GRANT_CONTROL("GRANT_CONTROL"),

    /** Host takes editing control back, unconditionally. */
    REVOKE_CONTROL("REVOKE_CONTROL"),

    /** Host refuses a pending control request. */
    DECLINE_CONTROL("DECLINE_CONTROL");

    private final String wireName;

    MessageKind(String wireName)
    {
        this.wireName = wireName;
    }

    public String wireName()
    {
        return wireName;
    }

    public boolean isControl()
    {
        return this != TEXT_UPDATE;
    }

    /**
     * Resolves a wire name back to its kind.
     *
     * @param wireName value of the envelope {@code "type"} field
     * @return the matching kind, or empty if the name is unknown
     */
    public static Optional<MessageKind> fromWireName(String wireName)
    {
        if (wireName == null) {
            return Optional.empty();
        }
        for (MessageKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
