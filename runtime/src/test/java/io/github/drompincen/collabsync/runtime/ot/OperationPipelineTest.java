package io.github.drompincen.collabsync.runtime.ot;

import io.github.drompincen.collabsync.protocol.api.Operation;
import io.github.drompincen.collabsync.protocol.api.OperationKind;
import io.github.drompincen.collabsync.protocol.ws.WsMessage;
import io.github.drompincen.collabsync.runtime.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OperationPipelineTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
    }

    @Test
    void localEditIsVisibleBeforeAcknowledgement() {
        Site alice = new Site();

        alice.pipeline.submit(OperationDraft.insert(0, "hi"), "alice");

        assertThat(alice.pipeline.text()).isEqualTo("hi");
        assertThat(alice.pipeline.confirmedText()).isEmpty();
        assertThat(alice.pipeline.pendingOperations()).hasSize(1);
    }

    @Test
    void echoMovesOperationFromPendingToConfirmed() {
        Site alice = new Site();
        Operation op = alice.pipeline.submit(OperationDraft.insert(0, "hi"), "alice");

        OperationOutcome outcome = alice.pipeline.receive(op);

        assertThat(outcome).isEqualTo(OperationOutcome.ACKNOWLEDGED);
        assertThat(alice.pipeline.pendingOperations()).isEmpty();
        assertThat(alice.pipeline.confirmedText()).isEqualTo("hi");
        assertThat(alice.pipeline.documentVersion()).isEqualTo(1);
    }

    @Test
    void submitStampsCurrentDocumentVersion() {
        Site alice = new Site();
        alice.pipeline.load("abc", 7);

        Operation op = alice.pipeline.submit(OperationDraft.delete(0, 1), "alice");

        assertThat(op.baseVersion()).isEqualTo(7);
        assertThat(op.authorId()).isEqualTo("alice");
        assertThat(op.timestamp()).isEqualTo(clock.instant());
    }

    @Test
    void concurrentInsertsAtSamePositionConvergeInRelayOrder() {
        Site alice = new Site();
        Site bob = new Site();
        Operation fromAlice = alice.pipeline.submit(OperationDraft.insert(0, "X"), "alice");
        Operation fromBob = bob.pipeline.submit(OperationDraft.insert(0, "Y"), "bob");

        // relay order: Alice's operation first
        for (Operation relayed : List.of(fromAlice, fromBob)) {
            alice.pipeline.receive(relayed);
            bob.pipeline.receive(relayed);
        }

        assertThat(alice.pipeline.text()).isEqualTo("XY");
        assertThat(bob.pipeline.text()).isEqualTo("XY");
        assertThat(alice.pipeline.pendingOperations()).isEmpty();
        assertThat(bob.pipeline.pendingOperations()).isEmpty();
    }

    @Test
    void remoteOperationTransformsPendingQueue() {
        Site alice = new Site();
        alice.pipeline.load("hello", 0);
        alice.pipeline.submit(OperationDraft.insert(5, "!"), "alice");
        Operation remote = new Operation("r1", OperationKind.INSERT,
                0, "bob", null, 0, ">> ", null, null);

        alice.pipeline.receive(remote);

        assertThat(alice.pipeline.pendingOperations().get(0).position()).isEqualTo(8);
        assertThat(alice.pipeline.text()).isEqualTo(">> hello!");
    }

    @Test
    void transformPendingOperationsIsNoOpOnEmptyQueue() {
        Site alice = new Site();
        Operation remote = new Operation("r1", OperationKind.INSERT,
                0, "bob", null, 0, "x", null, null);

        alice.pipeline.transformPendingOperations(remote);

        assertThat(alice.pipeline.pendingOperations()).isEmpty();
    }

    @Test
    void offlineEditsAreComposedAndFlushedOnce() {
        Site alice = new Site();
        alice.online = false;
        alice.pipeline.submit(OperationDraft.insert(0, "he"), "alice");
        alice.pipeline.submit(OperationDraft.insert(2, "llo"), "alice");
        assertThat(alice.pipeline.unsentCount()).isEqualTo(2);

        alice.online = true;
        int sent = alice.pipeline.flushPending();

        assertThat(sent).isEqualTo(1);
        assertThat(alice.sent).hasSize(1);
        assertThat(alice.sent.get(0).content()).isEqualTo("hello");
        assertThat(alice.pipeline.flushPending()).isZero();
        assertThat(alice.pipeline.text()).isEqualTo("hello");
    }

    @Test
    void laterEditWaitsBehindUnsentOnes() {
        Site alice = new Site();
        alice.online = false;
        alice.pipeline.submit(OperationDraft.insert(0, "a"), "alice");

        alice.online = true;
        alice.pipeline.submit(OperationDraft.insert(5, "b"), "alice");

        assertThat(alice.sent).isEmpty();
        assertThat(alice.pipeline.flushPending()).isEqualTo(2);
        assertThat(alice.sent).extracting(Operation::content).containsExactly("a", "b");
    }

    private final class Site {
        private final List<Operation> sent = new ArrayList<>();
        private final OperationPipeline pipeline;
        private boolean online = true;

        private Site() {
            this.pipeline = new OperationPipeline(message -> {
                if (!online) return false;
                sent.add(((WsMessage.OperationMessage) message).operation());
                return true;
            }, clock);
        }
    }
}
