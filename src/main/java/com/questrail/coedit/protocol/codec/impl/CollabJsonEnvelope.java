package com.questrail.coedit.protocol.codec.impl;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.Strictness;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.questrail.coedit.protocol.model.CollabMessage;
import com.questrail.coedit.protocol.model.MessageKind;

import java.io.IOException;
import java.io.StringReader;
import java.util.Optional;

/**
 * CollabJsonEnvelope
 * -----------------------------------------------------------------------------
 * Maps a {@link CollabMessage} to and from the JSON object
 * {@code {"type": <wire name>, "content": <text>}}.
 *
 * <p>Failures are reported with {@link EnvelopeException}; the decoder turns
 * those into recoverable framing failures because the frame extent is already
 * known by the time the body is parsed.</p>
 */
final class CollabJsonEnvelope
{
    static final String TYPE_FIELD = "type";
    static final String CONTENT_FIELD = "content";

    // HTML escaping would turn '<' and '=' into < sequences in document text.
    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .create();

    private CollabJsonEnvelope() {}

    static String toJson(CollabMessage message)
    {
        JsonObject envelope = new JsonObject();
        envelope.addProperty(TYPE_FIELD, message.kind().wireName());
        envelope.addProperty(CONTENT_FIELD, message.payload());
        return GSON.toJson(envelope);
    }

    static CollabMessage fromJson(String json) throws EnvelopeException
    {
        final JsonElement root;
        try {
            JsonReader reader = new JsonReader(new StringReader(json));
            // The default parse is lenient: single quotes, bare words and ';' separators would pass.
            reader.setStrictness(Strictness.STRICT);
            root = JsonParser.parseReader(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new EnvelopeException("Trailing data after JSON envelope");
            }
        }
        catch (JsonParseException | IOException | IllegalStateException e) {
            throw new EnvelopeException("Malformed JSON envelope", e);
        }

        if (!root.isJsonObject()) {
            throw new EnvelopeException("Envelope is not a JSON object");
        }
        JsonObject envelope = root.getAsJsonObject();

        String type = stringField(envelope, TYPE_FIELD)
                .orElseThrow(() -> new EnvelopeException("Envelope has no string 'type' field"));

        MessageKind kind = MessageKind.fromWireName(type)
                .orElseThrow(() -> new EnvelopeException("Unknown message type '" + type + "'"));

        Optional<String> content = stringField(envelope, CONTENT_FIELD);

        if (kind == MessageKind.TEXT_UPDATE) {
            return CollabMessage.textUpdate(content
                    .orElseThrow(() -> new EnvelopeException("TEXT_UPDATE without string 'content'")));
        }

        if (content.isPresent() && !content.get().isEmpty()) {
            throw new EnvelopeException(type + " must carry empty content");
        }
        return new CollabMessage(kind, "");
    }

    private static Optional<String> stringField(JsonObject envelope, String name) throws EnvelopeException
    {
        JsonElement element = envelope.get(name);
        if (element == null || element.isJsonNull()) {
            return Optional.empty();
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new EnvelopeException("Field '" + name + "' is not a string");
        }
        return Optional.of(element.getAsString());
    }

    static final class EnvelopeException extends Exception
    {
        EnvelopeException(String message)
        {
            super(message);
        }

        EnvelopeException(String message, Throwable cause)
        {
            super(message, cause);
        }
    }
}
