package io.github.drompincen.collabsync.protocol.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record Operation(
        String id,
        OperationKind kind,
        int position,
        String authorId,
        Instant timestamp,
        long baseVersion,
        String content,
        Integer length,
        Map<String, Object> attributes
) {
    public Operation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        if (position < 0) throw new IllegalArgumentException("position must be >= 0: " + position);
        attributes = attributes == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public int contentLength() {
        return content != null ? content.length() : 0;
    }

    public int lengthOrZero() {
        return length != null ? length : 0;
    }

    public Operation withPosition(int newPosition) {
        return new Operation(id, kind, Math.max(0, newPosition), authorId, timestamp, baseVersion,
                content, length, attributes);
    }

    public Operation withContent(String newContent) {
        return new Operation(id, kind, position, authorId, timestamp, baseVersion,
                newContent, length, attributes);
    }

    public Operation withBaseVersion(long newBaseVersion) {
        return new Operation(id, kind, position, authorId, timestamp, newBaseVersion,
                content, length, attributes);
    }
}
