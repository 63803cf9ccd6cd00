package io.github.drompincen.collabsync.protocol.ws;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.github.drompincen.collabsync.protocol.api.ConflictRecord;
import io.github.drompincen.collabsync.protocol.api.Operation;
import io.github.drompincen.collabsync.protocol.api.Participant;
import io.github.drompincen.collabsync.protocol.api.PresenceInfo;
import io.github.drompincen.collabsync.protocol.event.Event;

import java.util.List;
import java.util.Objects;

/**
 * Wire envelope. The {@code type} discriminator is written and read by Jackson; an unknown tag fails
 * decoding in {@link WireCodec}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WsMessage.JoinSession.class, name = "JOIN_SESSION"),
        @JsonSubTypes.Type(value = WsMessage.LeaveSession.class, name = "LEAVE_SESSION"),
        @JsonSubTypes.Type(value = WsMessage.EventMessage.class, name = "EVENT"),
        @JsonSubTypes.Type(value = WsMessage.OperationMessage.class, name = "OPERATION"),
        @JsonSubTypes.Type(value = WsMessage.PresenceUpdate.class, name = "PRESENCE_UPDATE"),
        @JsonSubTypes.Type(value = WsMessage.Heartbeat.class, name = "HEARTBEAT"),
        @JsonSubTypes.Type(value = WsMessage.SyncRequest.class, name = "SYNC_REQUEST"),
        @JsonSubTypes.Type(value = WsMessage.SyncResponse.class, name = "SYNC_RESPONSE"),
        @JsonSubTypes.Type(value = WsMessage.ConflictMessage.class, name = "CONFLICT"),
        @JsonSubTypes.Type(value = WsMessage.ErrorMessage.class, name = "ERROR")
})
public sealed interface WsMessage {

    WsMessageType messageType();

    record JoinSession(String sessionId, Participant user) implements WsMessage {
        public JoinSession {
            Objects.requireNonNull(sessionId, "sessionId");
            Objects.requireNonNull(user, "user");
        }

        @Override
        public WsMessageType messageType() { return WsMessageType.JOIN_SESSION; }
    }

    record LeaveSession(String sessionId, String userId) implements WsMessage {
        public LeaveSession {
            Objects.requireNonNull(sessionId, "sessionId");
        }

        @Override
        public WsMessageType messageType() { return WsMessageType.LEAVE_SESSION; }
    }

    record EventMessage(Event event) implements WsMessage {
        public EventMessage {
            Objects.requireNonNull(event, "event");
        }

        @Override
        public WsMessageType messageType() { return WsMessageType.EVENT; }
    }

    record OperationMessage(Operation operation) implements WsMessage {
        public OperationMessage {
            Objects.requireNonNull(operation, "operation");
        }

        @Override
        public WsMessageType messageType() { return WsMessageType.OPERATION; }
    }

    record PresenceUpdate(PresenceInfo presence) implements WsMessage {
        public PresenceUpdate {
            Objects.requireNonNull(presence, "presence");
        }

        @Override
        public WsMessageType messageType() { return WsMessageType.PRESENCE_UPDATE; }
    }

    record Heartbeat(long timestamp) implements WsMessage {
        @Override
        public WsMessageType messageType() { return WsMessageType.HEARTBEAT; }
    }

    record SyncRequest(String sessionId, long fromVersion) implements WsMessage {
        @Override
        public WsMessageType messageType() { return WsMessageType.SYNC_REQUEST; }
    }

    record SyncResponse(String sessionId, List<Event> events, long version) implements WsMessage {
        public SyncResponse {
            events = events == null ? List.of() : List.copyOf(events);
        }

        @Override
        public WsMessageType messageType() { return WsMessageType.SYNC_RESPONSE; }
    }

    record ConflictMessage(ConflictRecord conflict) implements WsMessage {
        public ConflictMessage {
            Objects.requireNonNull(conflict, "conflict");
        }

        @Override
        public WsMessageType messageType() { return WsMessageType.CONFLICT; }
    }

    record ErrorMessage(String error, Integer code) implements WsMessage {
        @Override
        public WsMessageType messageType() { return WsMessageType.ERROR; }
    }
}
