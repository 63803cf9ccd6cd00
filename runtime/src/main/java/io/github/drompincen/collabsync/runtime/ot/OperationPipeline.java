package io.github.drompincen.collabsync.runtime.ot;

import io.github.drompincen.collabsync.protocol.api.Operation;
import io.github.drompincen.collabsync.protocol.ws.WsMessage;
import io.github.drompincen.collabsync.runtime.connection.OutboundChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Shared document state with a tentative overlay of local edits.
 *
 * <p>The confirmed text is the result of operations in relay order. Local operations sit in the pending
 * queue until their echo comes back; the visible text is the confirmed text with the pending queue
 * applied on top. Pending operations are always a prefix of sent operations followed by a suffix of
 * unsent ones.
 */
public class OperationPipeline {

    private static final Logger log = LoggerFactory.getLogger(OperationPipeline.class);

    static final int CONFIRMED_LOG_LIMIT = 1000;

    private final OutboundChannel channel;
    private final Clock clock;

    private final List<Operation> confirmed = new ArrayList<>();
    private final List<Operation> pending = new ArrayList<>();
    private String confirmedText = "";
    private long versionOffset;
    private int firstUnsent;

    public OperationPipeline(OutboundChannel channel, Clock clock) {
        this.channel = channel;
        this.clock = clock;
    }

    /**
     * Replaces the document with a snapshot taken at {@code version}. Pending local edits are dropped.
     */
    public void load(String text, long version) {
        confirmed.clear();
        pending.clear();
        firstUnsent = 0;
        confirmedText = text != null ? text : "";
        versionOffset = Math.max(0, version);
    }

    public Operation submit(OperationDraft draft, String authorId) {
        Operation op = new Operation(UUID.randomUUID().toString(), draft.kind(), draft.position(), authorId,
                clock.instant(), documentVersion(), draft.content(), draft.length(), draft.attributes());
        pending.add(op);
        if (firstUnsent == pending.size() - 1 && channel.send(new WsMessage.OperationMessage(op))) {
            firstUnsent++;
        } else {
            log.debug("Queued operation {} ({} unsent)", op.id(), pending.size() - firstUnsent);
        }
        return op;
    }

    /**
     * Sends queued operations, composed and rebased onto the current document version.
     *
     * @return how many operations went out
     */
    public int flushPending() {
        if (firstUnsent >= pending.size()) {
            return 0;
        }
        List<Operation> unsent = OperationTransformer.compose(new ArrayList<>(pending.subList(firstUnsent, pending.size())));
        pending.subList(firstUnsent, pending.size()).clear();
        pending.addAll(unsent);

        int sent = 0;
        while (firstUnsent < pending.size()) {
            Operation op = pending.get(firstUnsent).withBaseVersion(documentVersion());
            pending.set(firstUnsent, op);
            if (!channel.send(new WsMessage.OperationMessage(op))) {
                break;
            }
            firstUnsent++;
            sent++;
        }
        if (sent > 0) log.debug("Flushed {} queued operations", sent);
        return sent;
    }

    public OperationOutcome receive(Operation incoming) {
        int ownIndex = indexOfPending(incoming.id());
        if (ownIndex >= 0) {
            Operation own = pending.remove(ownIndex);
            if (ownIndex < firstUnsent) {
                firstUnsent--;
            } else {
                log.warn("Operation {} acknowledged before it was sent", own.id());
            }
            if (ownIndex != 0) {
                log.warn("Operation {} acknowledged out of order (queue index {})", own.id(), ownIndex);
            }
            confirm(own);
            return OperationOutcome.ACKNOWLEDGED;
        }

        Operation rebased = incoming;
        int from = (int) Math.max(0, Math.min(confirmed.size(), incoming.baseVersion() - versionOffset));
        for (int i = from; i < confirmed.size(); i++) {
            Operation seen = confirmed.get(i);
            if (!Objects.equals(seen.authorId(), incoming.authorId())) {
                rebased = OperationTransformer.transform(seen, rebased);
            }
        }
        transformPendingOperations(rebased);
        confirm(rebased);
        return OperationOutcome.APPLIED;
    }

    /**
     * Rewrites every pending local operation against {@code incoming}, in queue order.
     */
    public void transformPendingOperations(Operation incoming) {
        for (int i = 0; i < pending.size(); i++) {
            pending.set(i, OperationTransformer.transform(incoming, pending.get(i)));
        }
    }

    public String text() {
        String text = confirmedText;
        for (Operation op : pending) {
            text = OperationTransformer.apply(text, op);
        }
        return text;
    }

    public String confirmedText() {
        return confirmedText;
    }

    public long documentVersion() {
        return versionOffset + confirmed.size();
    }

    public List<Operation> pendingOperations() {
        return List.copyOf(pending);
    }

    public int unsentCount() {
        return pending.size() - firstUnsent;
    }

    public void clear() {
        load("", 0);
    }

    private void confirm(Operation op) {
        confirmed.add(op);
        confirmedText = OperationTransformer.apply(confirmedText, op);
        if (confirmed.size() > CONFIRMED_LOG_LIMIT) {
            confirmed.remove(0);
            versionOffset++;
        }
    }

    private int indexOfPending(String id) {
        for (int i = 0; i < pending.size(); i++) {
            if (pending.get(i).id().equals(id)) return i;
        }
        return -1;
    }
}
