package io.github.drompincen.collabsync.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.collabsync.protocol.error.ProtocolException;
import io.github.drompincen.collabsync.protocol.event.Event;
import io.github.drompincen.collabsync.protocol.event.EventPayload;
import io.github.drompincen.collabsync.protocol.ws.WireCodec;
import io.github.drompincen.collabsync.protocol.ws.WsMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Reference relay. Orders events per session by stamping versions, fans frames out to the session's
 * members and answers sync requests from a bounded log.
 */
@Component
public class RelayWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RelayWebSocketHandler.class);

    static final int BAD_REQUEST = 400;
    static final int FORBIDDEN = 403;

    private final WireCodec codec;
    private final Clock clock;
    private final Map<String, SessionRoom> rooms = new ConcurrentHashMap<>();
    // socket id -> session id
    private final Map<String, String> memberships = new ConcurrentHashMap<>();

    public RelayWebSocketHandler(ObjectMapper objectMapper, Clock clock) {
        this.codec = new WireCodec(objectMapper);
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) {
        log.debug("Socket {} connected", socket.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        log.debug("Socket {} closed ({})", socket.getId(), status);
        leave(socket);
    }

    @Override
    protected void handleTextMessage(WebSocketSession socket, TextMessage message) {
        WsMessage decoded;
        try {
            decoded = codec.decode(message.getPayload());
        } catch (ProtocolException e) {
            log.warn("Rejected frame from {}: {}", socket.getId(), e.getMessage());
            send(socket, new WsMessage.ErrorMessage(e.getMessage(), BAD_REQUEST));
            return;
        }

        if (decoded instanceof WsMessage.JoinSession join) {
            join(socket, join);
        } else if (decoded instanceof WsMessage.LeaveSession) {
            leave(socket);
        } else if (decoded instanceof WsMessage.EventMessage em) {
            relayEvent(socket, em.event());
        } else if (decoded instanceof WsMessage.OperationMessage) {
            withRoom(socket, room -> broadcast(room.sockets(), decoded));
        } else if (decoded instanceof WsMessage.PresenceUpdate || decoded instanceof WsMessage.ConflictMessage) {
            withRoom(socket, room -> broadcast(othersThan(socket, room), decoded));
        } else if (decoded instanceof WsMessage.Heartbeat) {
            send(socket, new WsMessage.Heartbeat(clock.millis()));
        } else if (decoded instanceof WsMessage.SyncRequest request) {
            answerSync(socket, request);
        } else {
            send(socket, new WsMessage.ErrorMessage("Unexpected " + decoded.messageType() + " from client",
                    BAD_REQUEST));
        }
    }

    public List<RelaySessionSummary> sessions() {
        return rooms.values().stream()
                .map(this::summaryOf)
                .sorted(Comparator.comparing(RelaySessionSummary::createdAt))
                .toList();
    }

    public Optional<RelaySessionSummary> session(String sessionId) {
        return Optional.ofNullable(rooms.get(sessionId)).map(this::summaryOf);
    }

    private void join(WebSocketSession socket, WsMessage.JoinSession join) {
        String previous = memberships.get(socket.getId());
        if (previous != null && !previous.equals(join.sessionId())) {
            leave(socket);
        }
        SessionRoom room = rooms.computeIfAbsent(join.sessionId(), id -> new SessionRoom(id, clock.instant()));
        synchronized (room) {
            // The joiner catches up before its own join is stamped, so older entries are never stale to it.
            if (!room.contains(socket) && room.version() > 0) {
                send(socket, new WsMessage.SyncResponse(join.sessionId(), room.eventsAfter(0), room.version()));
            }
            room.add(socket, join.user().id());
            memberships.put(socket.getId(), join.sessionId());
            Event joined = room.append(newEvent(join.sessionId(), join.user().id(),
                    new EventPayload.UserJoined(join.user())));
            log.info("{} joined session {} (version {})", join.user().id(), join.sessionId(), joined.version());
            broadcast(room.sockets(), new WsMessage.EventMessage(joined));
        }
    }

    private void leave(WebSocketSession socket) {
        String sessionId = memberships.remove(socket.getId());
        if (sessionId == null) {
            return;
        }
        SessionRoom room = rooms.get(sessionId);
        if (room == null) {
            return;
        }
        synchronized (room) {
            SessionRoom.Member member = room.remove(socket);
            if (member == null) {
                return;
            }
            Event left = room.append(newEvent(sessionId, member.userId(), new EventPayload.UserLeft(member.userId())));
            log.info("{} left session {} (version {})", member.userId(), sessionId, left.version());
            broadcast(room.sockets(), new WsMessage.EventMessage(left));
        }
    }

    private void relayEvent(WebSocketSession socket, Event event) {
        SessionRoom room = event.sessionId() != null ? rooms.get(event.sessionId()) : null;
        if (room == null) {
            send(socket, new WsMessage.ErrorMessage("Unknown session: " + event.sessionId(), BAD_REQUEST));
            return;
        }
        synchronized (room) {
            if (!room.contains(socket)) {
                send(socket, new WsMessage.ErrorMessage("Not a member of session " + event.sessionId(), FORBIDDEN));
                return;
            }
            Event stamped = room.append(event);
            log.debug("Relaying {} event {} as version {}", stamped.type(), stamped.id(), stamped.version());
            broadcast(room.sockets(), new WsMessage.EventMessage(stamped));
        }
    }

    private void answerSync(WebSocketSession socket, WsMessage.SyncRequest request) {
        SessionRoom room = rooms.get(request.sessionId());
        if (room == null) {
            send(socket, new WsMessage.SyncResponse(request.sessionId(), List.of(), 0));
            return;
        }
        synchronized (room) {
            send(socket, new WsMessage.SyncResponse(request.sessionId(),
                    room.eventsAfter(request.fromVersion()), room.version()));
        }
    }

    private void withRoom(WebSocketSession socket, Consumer<SessionRoom> action) {
        String sessionId = memberships.get(socket.getId());
        SessionRoom room = sessionId != null ? rooms.get(sessionId) : null;
        if (room == null) {
            send(socket, new WsMessage.ErrorMessage("Join a session first", FORBIDDEN));
            return;
        }
        synchronized (room) {
            action.accept(room);
        }
    }

    private List<WebSocketSession> othersThan(WebSocketSession socket, SessionRoom room) {
        return room.sockets().stream().filter(s -> !s.getId().equals(socket.getId())).toList();
    }

    private RelaySessionSummary summaryOf(SessionRoom room) {
        synchronized (room) {
            return room.summary();
        }
    }

    private Event newEvent(String sessionId, String authorId, EventPayload payload) {
        return new Event(UUID.randomUUID().toString(), null, sessionId, authorId, clock.instant(), payload, 0, false);
    }

    private void broadcast(List<WebSocketSession> targets, WsMessage message) {
        TextMessage frame = new TextMessage(codec.encode(message));
        for (WebSocketSession target : targets) {
            write(target, frame);
        }
    }

    private void send(WebSocketSession socket, WsMessage message) {
        write(socket, new TextMessage(codec.encode(message)));
    }

    private void write(WebSocketSession socket, TextMessage frame) {
        if (!socket.isOpen()) {
            return;
        }
        try {
            synchronized (socket) {
                socket.sendMessage(frame);
            }
        } catch (IOException e) {
            log.warn("Failed to write to socket {}: {}", socket.getId(), e.getMessage());
        }
    }
}
