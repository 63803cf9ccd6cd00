package io.github.drompincen.collabsync.gateway.websocket;

import java.time.Instant;
import java.util.List;

public record RelaySessionSummary(
        String sessionId,
        long version,
        List<String> userIds,
        int loggedEvents,
        Instant createdAt
) {}
