package io.github.drompincen.collabsync.gateway.websocket;

import io.github.drompincen.collabsync.protocol.event.Event;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relay-side state of one collaborative session: its members, the version counter and a bounded log of
 * stamped events for sync requests. Callers synchronize on the room.
 */
class SessionRoom {

    static final int LOG_LIMIT = 1000;

    private final String sessionId;
    private final Instant createdAt;
    private final Map<String, Member> members = new LinkedHashMap<>();
    private final Deque<Event> log = new ArrayDeque<>();
    private long version;

    SessionRoom(String sessionId, Instant createdAt) {
        this.sessionId = sessionId;
        this.createdAt = createdAt;
    }

    record Member(WebSocketSession socket, String userId) {}

    void add(WebSocketSession socket, String userId) {
        members.put(socket.getId(), new Member(socket, userId));
    }

    Member remove(WebSocketSession socket) {
        return members.remove(socket.getId());
    }

    boolean contains(WebSocketSession socket) {
        return members.containsKey(socket.getId());
    }

    /** Stamps the event with the next version and logs it. */
    Event append(Event event) {
        Event stamped = event.withVersion(++version);
        log.addLast(stamped);
        while (log.size() > LOG_LIMIT) {
            log.removeFirst();
        }
        return stamped;
    }

    List<Event> eventsAfter(long fromVersion) {
        List<Event> result = new ArrayList<>();
        for (Event event : log) {
            if (event.version() > fromVersion) result.add(event);
        }
        return result;
    }

    List<WebSocketSession> sockets() {
        return members.values().stream().map(Member::socket).toList();
    }

    RelaySessionSummary summary() {
        return new RelaySessionSummary(sessionId, version,
                members.values().stream().map(Member::userId).distinct().toList(), log.size(), createdAt);
    }

    long version() {
        return version;
    }
}
