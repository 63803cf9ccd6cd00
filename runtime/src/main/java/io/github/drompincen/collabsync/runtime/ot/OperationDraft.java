package io.github.drompincen.collabsync.runtime.ot;

import io.github.drompincen.collabsync.protocol.api.OperationKind;

import java.util.Map;
import java.util.Objects;

/**
 * A local edit before the pipeline stamps id, author, timestamp and base version.
 */
public record OperationDraft(
        OperationKind kind,
        int position,
        String content,
        Integer length,
        Map<String, Object> attributes
) {

    public OperationDraft {
        Objects.requireNonNull(kind, "kind");
        if (position < 0) throw new IllegalArgumentException("position must be >= 0: " + position);
    }

    public static OperationDraft insert(int position, String content) {
        return new OperationDraft(OperationKind.INSERT, position, content, null, null);
    }

    public static OperationDraft delete(int position, int length) {
        return new OperationDraft(OperationKind.DELETE, position, null, length, null);
    }

    public static OperationDraft format(int position, int length, Map<String, Object> attributes) {
        return new OperationDraft(OperationKind.FORMAT, position, null, length, attributes);
    }
}
