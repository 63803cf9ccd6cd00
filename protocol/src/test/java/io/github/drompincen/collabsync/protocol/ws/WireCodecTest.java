package io.github.drompincen.collabsync.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.collabsync.protocol.api.Operation;
import io.github.drompincen.collabsync.protocol.api.OperationKind;
import io.github.drompincen.collabsync.protocol.api.Participant;
import io.github.drompincen.collabsync.protocol.api.Role;
import io.github.drompincen.collabsync.protocol.error.ProtocolException;
import io.github.drompincen.collabsync.protocol.event.Event;
import io.github.drompincen.collabsync.protocol.event.EventPayload;
import io.github.drompincen.collabsync.protocol.event.EventType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WireCodecTest {

    private final WireCodec codec = new WireCodec();

    @Test
    void heartbeatEnvelopeIsFieldExact() throws Exception {
        String json = codec.encode(new WsMessage.Heartbeat(1700000000000L));

        JsonNode node = codec.mapper().readTree(json);
        assertThat(node.path("type").asText()).isEqualTo("HEARTBEAT");
        assertThat(node.path("timestamp").asLong()).isEqualTo(1700000000000L);
        assertThat(node.size()).isEqualTo(2);
    }

    @Test
    void joinSessionCarriesSessionIdAndUser() throws Exception {
        Participant alice = Participant.of("u1", "Alice", "alice@example.com", Role.EDITOR);

        String json = codec.encode(new WsMessage.JoinSession("s1", alice));

        JsonNode node = codec.mapper().readTree(json);
        assertThat(node.path("type").asText()).isEqualTo("JOIN_SESSION");
        assertThat(node.path("sessionId").asText()).isEqualTo("s1");
        assertThat(node.path("user").path("id").asText()).isEqualTo("u1");
        assertThat(node.path("user").path("role").asText()).isEqualTo("EDITOR");
    }

    @Test
    void decodesEventWithTypedPayload() {
        String frame = """
                {"type":"EVENT","event":{"id":"e1","type":"USER_LEFT","sessionId":"s1","authorId":"u2",
                 "timestamp":"2025-01-15T10:00:00Z","payload":{"userId":"u2"},"version":7,"acknowledged":false}}
                """;

        WsMessage message = codec.decode(frame);

        assertThat(message).isInstanceOf(WsMessage.EventMessage.class);
        Event event = ((WsMessage.EventMessage) message).event();
        assertThat(event.type()).isEqualTo(EventType.USER_LEFT);
        assertThat(event.payload()).isEqualTo(new EventPayload.UserLeft("u2"));
        assertThat(event.version()).isEqualTo(7);
        assertThat(event.timestamp()).isEqualTo(Instant.parse("2025-01-15T10:00:00Z"));
    }

    @Test
    void decodesTypingEventWithoutPayload() {
        String frame = """
                {"type":"EVENT","event":{"id":"e2","type":"TYPING_START","sessionId":"s1","authorId":"u2","version":3}}
                """;

        Event event = ((WsMessage.EventMessage) codec.decode(frame)).event();

        assertThat(event.payload()).isInstanceOf(EventPayload.TypingStart.class);
    }

    @Test
    void encodeThenDecodeKeepsOperationFields() {
        Operation op = new Operation("op1", OperationKind.INSERT, 4, "u1",
                Instant.parse("2025-01-15T10:00:00Z"), 2, "hello", null, null);

        WsMessage decoded = codec.decode(codec.encode(new WsMessage.OperationMessage(op)));

        assertThat(decoded).isEqualTo(new WsMessage.OperationMessage(op));
    }

    @Test
    void syncResponseDecodesEventList() {
        Event joined = new Event("e1", EventType.USER_JOINED, "s1", "u1", Instant.parse("2025-01-15T10:00:00Z"),
                new EventPayload.UserJoined(Participant.of("u1", "Alice", "a@example.com", Role.OWNER)), 1, false);

        WsMessage decoded = codec.decode(codec.encode(new WsMessage.SyncResponse("s1", List.of(joined), 1)));

        WsMessage.SyncResponse response = (WsMessage.SyncResponse) decoded;
        assertThat(response.events()).hasSize(1);
        assertThat(response.events().get(0).payload()).isInstanceOf(EventPayload.UserJoined.class);
        assertThat(response.version()).isEqualTo(1);
    }

    @Test
    void unknownMessageTypeIsProtocolError() {
        assertThatThrownBy(() -> codec.decode("{\"type\":\"SUBSCRIBE_PROJECT\",\"projectId\":\"p1\"}"))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    void unknownEventTypeIsProtocolError() {
        String frame = "{\"type\":\"EVENT\",\"event\":{\"id\":\"e1\",\"type\":\"TELEPORTED\",\"payload\":{}}}";

        assertThatThrownBy(() -> codec.decode(frame)).isInstanceOf(ProtocolException.class);
    }

    @Test
    void missingRequiredFieldIsProtocolError() {
        assertThatThrownBy(() -> codec.decode("{\"type\":\"JOIN_SESSION\",\"sessionId\":\"s1\"}"))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    void garbageFrameIsProtocolError() {
        assertThatThrownBy(() -> codec.decode("not json")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> codec.decode("  ")).isInstanceOf(ProtocolException.class);
    }

    @Test
    void errorMessageCodeIsOptional() {
        WsMessage decoded = codec.decode("{\"type\":\"ERROR\",\"error\":\"boom\"}");

        assertThat(decoded).isEqualTo(new WsMessage.ErrorMessage("boom", null));
    }
}
