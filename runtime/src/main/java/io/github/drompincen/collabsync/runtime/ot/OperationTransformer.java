package io.github.drompincen.collabsync.runtime.ot;

import io.github.drompincen.collabsync.protocol.api.Operation;
import io.github.drompincen.collabsync.protocol.api.OperationKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pairwise operational transform over a flat character position space.
 *
 * <p>Only insert/insert and delete-before-insert are transformed; every other pairing passes through
 * unchanged. Positions and lengths are UTF-16 {@code char} offsets.
 */
public final class OperationTransformer {

    private OperationTransformer() {
    }

    /**
     * Applies {@code op} to {@code text}. Positions past the end are clamped; RETAIN and FORMAT leave the
     * text as is.
     */
    public static String apply(String text, Operation op) {
        String source = text != null ? text : "";
        int at = Math.min(op.position(), source.length());
        return switch (op.kind()) {
            case INSERT -> op.content() == null
                    ? source
                    : source.substring(0, at) + op.content() + source.substring(at);
            case DELETE -> {
                int end = Math.min(source.length(), at + Math.max(0, op.lengthOrZero()));
                yield source.substring(0, at) + source.substring(end);
            }
            case RETAIN, FORMAT -> source;
        };
    }

    /**
     * Rewrites {@code local} so it applies after {@code remote} has been applied.
     */
    public static Operation transform(Operation remote, Operation local) {
        if (remote.kind() == OperationKind.INSERT && local.kind() == OperationKind.INSERT) {
            if (remote.position() <= local.position()) {
                return local.withPosition(local.position() + remote.contentLength());
            }
            return local;
        }
        if (remote.kind() == OperationKind.DELETE && local.kind() == OperationKind.INSERT) {
            if (remote.position() < local.position()) {
                return local.withPosition(local.position() - remote.lengthOrZero());
            }
            return local;
        }
        return local;
    }

    /**
     * Folds runs of same-author inserts where each one starts where the previous one ended.
     */
    public static List<Operation> compose(List<Operation> ops) {
        List<Operation> composed = new ArrayList<>();
        Operation current = null;
        for (Operation next : ops) {
            if (current == null) {
                current = next;
            } else if (contiguousInserts(current, next)) {
                current = current.withContent(current.content() + next.content());
            } else {
                composed.add(current);
                current = next;
            }
        }
        if (current != null) composed.add(current);
        return composed;
    }

    private static boolean contiguousInserts(Operation first, Operation second) {
        return first.kind() == OperationKind.INSERT
                && second.kind() == OperationKind.INSERT
                && first.content() != null
                && second.content() != null
                && Objects.equals(first.authorId(), second.authorId())
                && first.position() + first.contentLength() == second.position();
    }
}
