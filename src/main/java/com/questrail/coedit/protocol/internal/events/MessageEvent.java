package com.questrail.coedit.protocol.internal.events;

import com.questrail.coedit.protocol.model.CollabMessage;

import java.time.Instant;
import java.util.Objects;

/**
 * Events carrying a fully decoded message from the peer.
 */
public sealed interface MessageEvent extends SessionEvent
        permits MessageEvent.MessageReceived
{
    /** A message arrived on link {@code linkId}. */
    final class MessageReceived extends SessionEvent.Base implements MessageEvent {
        private final long linkId;
        private final CollabMessage message;

        public MessageReceived(Instant timestamp, long linkId, CollabMessage message) {
            super(timestamp);
            this.linkId = linkId;
            this.message = Objects.requireNonNull(message, "message");
        }

        public long linkId() {
            return linkId;
        }

        public CollabMessage message() {
            return message;
        }

        @Override
        public String toString() {
            return "MessageReceived[link=" + linkId + ", " + message + "]";
        }
    }
}
