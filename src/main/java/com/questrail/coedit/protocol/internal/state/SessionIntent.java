package com.questrail.coedit.protocol.internal.state;

import com.questrail.coedit.api.SessionNotification;
import com.questrail.coedit.protocol.model.CollabMessage;
import com.questrail.coedit.protocol.observability.CollabProtocolObservabilityEvent;

import java.util.Objects;

/**
 * SessionIntent
 * -----------------------------------------------------------------------------
 * One desired action emitted by {@link SessionReducer}. Intents describe
 * <em>what</em> should happen; the executor decides <em>how</em>.
 */
public sealed interface SessionIntent
        permits SessionIntent.BindListener,
                SessionIntent.Dial,
                SessionIntent.CloseTransport,
                SessionIntent.SendMessage,
                SessionIntent.PushDocument,
                SessionIntent.SyncDocument,
                SessionIntent.ApplyDocument,
                SessionIntent.AskControlApproval,
                SessionIntent.Notify,
                SessionIntent.Observe
{
    /**
     * Enumerates the kinds of actions the session may need to perform.
     */
    enum Kind {
        /** Bind the host socket. */
        BIND_LISTENER,

        /** Dial a host. */
        DIAL,

        /** Close the peer link and the listening socket; cancel attempts. */
        CLOSE_TRANSPORT,

        /** Send one message to the peer. */
        SEND_MESSAGE,

        /** Read the editor and send the whole document, unconditionally. */
        PUSH_DOCUMENT,

        /** Send this document text unless it equals the last synced text. */
        SYNC_DOCUMENT,

        /** Replace the editor content with the peer's document. */
        APPLY_DOCUMENT,

        /** Ask the host's user whether to hand over control. */
        ASK_CONTROL_APPROVAL,

        /** Tell the application something it should show the user. */
        NOTIFY,

        /** Record a protocol observation (ignored update, anomaly, stale event). */
        OBSERVE
    }

    Kind kind();

    record BindListener(int port) implements SessionIntent {
        @Override public Kind kind() { return Kind.BIND_LISTENER; }
    }

    record Dial(String host, int port) implements SessionIntent {
        public Dial {
            Objects.requireNonNull(host, "host");
        }

        @Override public Kind kind() { return Kind.DIAL; }
    }

    record CloseTransport() implements SessionIntent {
        @Override public Kind kind() { return Kind.CLOSE_TRANSPORT; }
    }

    record SendMessage(CollabMessage message) implements SessionIntent {
        public SendMessage {
            Objects.requireNonNull(message, "message");
        }

        @Override public Kind kind() { return Kind.SEND_MESSAGE; }
    }

    record PushDocument() implements SessionIntent {
        @Override public Kind kind() { return Kind.PUSH_DOCUMENT; }
    }

    record SyncDocument(String text) implements SessionIntent {
        public SyncDocument {
            Objects.requireNonNull(text, "text");
        }

        @Override public Kind kind() { return Kind.SYNC_DOCUMENT; }
    }

    record ApplyDocument(String text) implements SessionIntent {
        public ApplyDocument {
            Objects.requireNonNull(text, "text");
        }

        @Override public Kind kind() { return Kind.APPLY_DOCUMENT; }
    }

    /**
     * @param linkId the link the request arrived on; the answer is bound to it
     */
    record AskControlApproval(long linkId) implements SessionIntent {
        @Override public Kind kind() { return Kind.ASK_CONTROL_APPROVAL; }
    }

    record Notify(SessionNotification.Kind notification, String message) implements SessionIntent {
        public Notify {
            Objects.requireNonNull(notification, "notification");
            Objects.requireNonNull(message, "message");
        }

        @Override public Kind kind() { return Kind.NOTIFY; }
    }

    record Observe(CollabProtocolObservabilityEvent.Kind observation, String detail) implements SessionIntent {
        public Observe {
            Objects.requireNonNull(observation, "observation");
            Objects.requireNonNull(detail, "detail");
        }

        @Override public Kind kind() { return Kind.OBSERVE; }
    }
}
