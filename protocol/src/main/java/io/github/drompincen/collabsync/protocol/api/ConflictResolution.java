package io.github.drompincen.collabsync.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record ConflictResolution(
        String resolvedBy,
        Instant resolvedAt,
        ResolutionStrategy strategy,
        JsonNode payload
) {}
