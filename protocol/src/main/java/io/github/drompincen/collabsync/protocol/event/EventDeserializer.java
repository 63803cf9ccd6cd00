package io.github.drompincen.collabsync.protocol.event;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.io.IOException;
import java.time.Instant;

/**
 * Resolves the payload record from the sibling {@code type} field. Unknown types are rejected here
 * so nothing past the codec ever sees an untyped payload.
 */
public class EventDeserializer extends StdDeserializer<Event> {

    public EventDeserializer() {
        super(Event.class);
    }

    @Override
    public Event deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        String typeName = node.path("type").asText("");
        EventType type;
        try {
            type = EventType.valueOf(typeName);
        } catch (IllegalArgumentException e) {
            throw InvalidFormatException.from(p, "Unknown event type: " + typeName, typeName, EventType.class);
        }

        JsonNode payloadNode = node.hasNonNull("payload")
                ? node.get("payload") : JsonNodeFactory.instance.objectNode();
        EventPayload payload = ctxt.readTreeAsValue(payloadNode, type.payloadType());
        Instant timestamp = node.hasNonNull("timestamp")
                ? ctxt.readTreeAsValue(node.get("timestamp"), Instant.class) : null;

        try {
            return new Event(
                    node.path("id").asText(null),
                    type,
                    node.path("sessionId").asText(null),
                    node.path("authorId").asText(null),
                    timestamp,
                    payload,
                    node.path("version").asLong(0),
                    node.path("acknowledged").asBoolean(false));
        } catch (RuntimeException e) {
            throw ValueInstantiationException.from(p, "Invalid event: " + e.getMessage(),
                    ctxt.constructType(Event.class), e);
        }
    }
}
