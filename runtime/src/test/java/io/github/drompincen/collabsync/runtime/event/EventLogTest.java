package io.github.drompincen.collabsync.runtime.event;

import io.github.drompincen.collabsync.protocol.api.Participant;
import io.github.drompincen.collabsync.protocol.api.Role;
import io.github.drompincen.collabsync.protocol.error.StateException;
import io.github.drompincen.collabsync.protocol.event.Event;
import io.github.drompincen.collabsync.protocol.event.EventPayload;
import io.github.drompincen.collabsync.protocol.ws.WsMessage;
import io.github.drompincen.collabsync.runtime.conflict.ConflictDetector;
import io.github.drompincen.collabsync.runtime.notify.NotificationCenter;
import io.github.drompincen.collabsync.runtime.notify.NotificationType;
import io.github.drompincen.collabsync.runtime.scheduler.SerialGuard;
import io.github.drompincen.collabsync.runtime.session.SessionRegistry;
import io.github.drompincen.collabsync.runtime.support.ManualScheduler;
import io.github.drompincen.collabsync.runtime.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventLogTest {

    private static final String SESSION = "s1";

    private MutableClock clock;
    private NotificationCenter notifications;
    private SessionRegistry registry;
    private ConflictDetector conflicts;
    private final List<WsMessage> outbound = new ArrayList<>();
    private final List<Event> applied = new ArrayList<>();
    private boolean online;
    private EventLog eventLog;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        notifications = new NotificationCenter(new ManualScheduler(clock), clock, null);
        registry = new SessionRegistry(clock, "https://collab.test");
        registry.initialize(Participant.of("me", "Me", "me@example.com", Role.EDITOR));
        registry.join(SESSION, registry.requireCurrentUser());
        conflicts = new ConflictDetector(registry, notifications, new SerialGuard(), clock);
        online = true;
        eventLog = new EventLog(message -> {
            if (!online) return false;
            outbound.add(message);
            return true;
        }, conflicts, (event, local) -> applied.add(event), clock);
    }

    @Test
    void sendEventTransmitsAndRecordsHistoryWhenConnected() {
        Event event = eventLog.sendEvent(EventDraft.of(SESSION, "me", new EventPayload.MessageSent("m1", "hi")));

        assertThat(outbound).containsExactly(new WsMessage.EventMessage(event));
        assertThat(eventLog.history()).containsExactly(event);
        assertThat(eventLog.pendingEvents()).isEmpty();
        assertThat(applied).containsExactly(event);
    }

    @Test
    void sendEventUsesBaseVersionUnlessDraftHasOne() {
        eventLog.processEvent(remote("r1", "other", 4));

        Event implicit = eventLog.sendEvent(EventDraft.of(SESSION, "me", new EventPayload.TypingStart()));
        Event explicit = eventLog.sendEvent(new EventDraft(SESSION, "me", new EventPayload.TypingStop(), 9L));

        assertThat(implicit.version()).isEqualTo(4);
        assertThat(explicit.version()).isEqualTo(9);
        assertThat(implicit.id()).isNotEqualTo(explicit.id());
    }

    @Test
    void pendingEventsFlushInOrderExactlyOnce() {
        online = false;
        Event first = eventLog.sendEvent(EventDraft.of(SESSION, "me", new EventPayload.MessageSent("m1", "one")));
        Event second = eventLog.sendEvent(EventDraft.of(SESSION, "me", new EventPayload.MessageSent("m2", "two")));
        Event third = eventLog.sendEvent(EventDraft.of(SESSION, "me", new EventPayload.MessageSent("m3", "three")));
        assertThat(eventLog.pendingEvents()).containsExactly(first, second, third);
        assertThat(outbound).isEmpty();

        online = true;
        int flushed = eventLog.flushPending();
        int again = eventLog.flushPending();

        assertThat(flushed).isEqualTo(3);
        assertThat(again).isZero();
        assertThat(outbound).containsExactly(
                new WsMessage.EventMessage(first),
                new WsMessage.EventMessage(second),
                new WsMessage.EventMessage(third));
        assertThat(eventLog.pendingEvents()).isEmpty();
    }

    @Test
    void flushStopsAtFirstRefusedSendAndKeepsOrder() {
        online = false;
        Event first = eventLog.sendEvent(EventDraft.of(SESSION, "me", new EventPayload.MessageSent("m1", "one")));
        Event second = eventLog.sendEvent(EventDraft.of(SESSION, "me", new EventPayload.MessageSent("m2", "two")));

        int flushed = eventLog.flushPending();

        assertThat(flushed).isZero();
        assertThat(eventLog.pendingEvents()).containsExactly(first, second);
    }

    @Test
    void remoteEventIsAppliedAcknowledgedAndAdvancesBase() {
        Event event = remote("r1", "other", 3);

        EventOutcome outcome = eventLog.processEvent(event);

        assertThat(outcome).isEqualTo(EventOutcome.APPLIED);
        assertThat(applied).containsExactly(event);
        assertThat(eventLog.baseVersion()).isEqualTo(3);
        assertThat(eventLog.isAcknowledged("r1")).isTrue();
        assertThat(eventLog.history()).extracting(Event::acknowledged).containsExactly(true);
    }

    @Test
    void duplicateEventIsIgnored() {
        Event event = remote("r1", "other", 3);
        eventLog.processEvent(event);

        EventOutcome outcome = eventLog.processEvent(event);

        assertThat(outcome).isEqualTo(EventOutcome.DUPLICATE);
        assertThat(applied).hasSize(1);
        assertThat(eventLog.history()).hasSize(1);
    }

    @Test
    void echoOfLocalEventIsReconciledWithoutReapplying() {
        Event local = eventLog.sendEvent(EventDraft.of(SESSION, "me", new EventPayload.MessageSent("m1", "hi")));
        applied.clear();

        EventOutcome outcome = eventLog.processEvent(local.withVersion(7));

        assertThat(outcome).isEqualTo(EventOutcome.RECONCILED);
        assertThat(applied).isEmpty();
        assertThat(eventLog.baseVersion()).isEqualTo(7);
        assertThat(eventLog.tentativeEvents()).isEmpty();
        assertThat(eventLog.isAcknowledged(local.id())).isTrue();
    }

    @Test
    void echoReplacesTentativeCopyInHistory() {
        Event local = eventLog.sendEvent(EventDraft.of(SESSION, "me", new EventPayload.MessageSent("m1", "hi")));
        eventLog.processEvent(remote("r1", "other", 1));
        assertThat(eventLog.history()).extracting(Event::id).containsExactly(local.id(), "r1");

        eventLog.processEvent(local.withVersion(2));

        assertThat(eventLog.history()).extracting(Event::id).containsExactly("r1", local.id());
        Event confirmed = eventLog.history().get(1);
        assertThat(confirmed.version()).isEqualTo(2);
        assertThat(confirmed.acknowledged()).isTrue();
    }

    @Test
    void acknowledgedIdsBelowBaseVersionAreForgotten() {
        for (int i = 1; i <= 50; i++) {
            eventLog.processEvent(remote("r" + i, "other", i));
        }

        assertThat(eventLog.rememberedIdCount()).isEqualTo(1);
        assertThat(eventLog.isAcknowledged("r50")).isTrue();
        assertThat(eventLog.processEvent(remote("r50", "other", 50))).isEqualTo(EventOutcome.DUPLICATE);
        assertThat(eventLog.processEvent(remote("r10", "other", 10))).isEqualTo(EventOutcome.STALE);
        assertThat(applied).hasSize(50);
    }

    @Test
    void parkedIdsAreForgottenOnceBaseMovesPast() {
        eventLog.processEvent(remote("r1", "other", 5));
        Event concurrent = remote("r2", "someone", 5);
        eventLog.processEvent(concurrent);
        assertThat(conflicts.isParked("r2")).isTrue();

        eventLog.processEvent(remote("r3", "other", 6));

        assertThat(conflicts.isParked("r2")).isFalse();
        assertThat(eventLog.processEvent(concurrent)).isEqualTo(EventOutcome.STALE);
        assertThat(conflicts.conflicts()).hasSize(1);
    }

    @Test
    void staleEventIsRejectedAndBaseVersionUntouched() {
        eventLog.processEvent(remote("r1", "other", 5));
        applied.clear();

        EventOutcome outcome = eventLog.processEvent(remote("r2", "other", 3));

        assertThat(outcome).isEqualTo(EventOutcome.STALE);
        assertThat(applied).isEmpty();
        assertThat(eventLog.baseVersion()).isEqualTo(5);
    }

    @Test
    void concurrentEventAtBaseVersionIsParkedNotApplied() {
        eventLog.processEvent(remote("r1", "other", 5));
        applied.clear();

        EventOutcome outcome = eventLog.processEvent(remote("r2", "someone", 5));

        assertThat(outcome).isEqualTo(EventOutcome.CONFLICTED);
        assertThat(applied).isEmpty();
        assertThat(conflicts.unresolved()).hasSize(1);
        assertThat(conflicts.unresolved().get(0).conflictingEvents()).extracting(Event::id).containsExactly("r2");
        assertThat(notifications.active()).extracting(n -> n.type()).containsExactly(NotificationType.CONFLICT);
    }

    @Test
    void parkedEventDeliveredAgainDoesNotRaiseSecondConflict() {
        eventLog.processEvent(remote("r1", "other", 5));
        Event concurrent = remote("r2", "someone", 5);
        eventLog.processEvent(concurrent);

        EventOutcome outcome = eventLog.processEvent(concurrent);

        assertThat(outcome).isEqualTo(EventOutcome.CONFLICTED);
        assertThat(conflicts.conflicts()).hasSize(1);
    }

    @Test
    void syncReplayIsIdempotent() {
        List<Event> events = List.of(remote("r1", "a", 1), remote("r2", "b", 2), remote("r3", "a", 3));

        eventLog.handleSyncResponse(events, 3);
        List<Event> historyAfterFirst = eventLog.history();
        int appliedAfterFirst = applied.size();
        eventLog.handleSyncResponse(events, 3);

        assertThat(eventLog.history()).isEqualTo(historyAfterFirst);
        assertThat(applied).hasSize(appliedAfterFirst).hasSize(3);
        assertThat(eventLog.baseVersion()).isEqualTo(3);
    }

    @Test
    void syncResponseSetsBaseToResponseVersion() {
        eventLog.handleSyncResponse(List.of(remote("r1", "a", 1)), 12);

        assertThat(eventLog.baseVersion()).isEqualTo(12);
    }

    @Test
    void requestSyncCompletesOnResponse() {
        CompletableFuture<Long> sync = eventLog.requestSync(SESSION, 0);
        assertThat(outbound).containsExactly(new WsMessage.SyncRequest(SESSION, 0));
        assertThat(sync).isNotDone();

        eventLog.handleSyncResponse(List.of(), 8);

        assertThat(sync).isCompletedWithValue(8L);
    }

    @Test
    void requestSyncWhileOfflineFails() {
        online = false;

        CompletableFuture<Long> sync = eventLog.requestSync(SESSION, 0);

        assertThat(sync).isCompletedExceptionally();
        assertThatThrownBy(sync::join).hasCauseInstanceOf(StateException.class);
    }

    @Test
    void acknowledgeEventMarksItAndDropsItFromQueues() {
        online = false;
        Event local = eventLog.sendEvent(EventDraft.of(SESSION, "me", new EventPayload.MessageSent("m1", "hi")));

        eventLog.acknowledgeEvent(local.id());

        assertThat(eventLog.isAcknowledged(local.id())).isTrue();
        assertThat(eventLog.pendingEvents()).isEmpty();
        assertThat(eventLog.tentativeEvents()).isEmpty();
    }

    @Test
    void historyKeepsMostRecentThousandEvents() {
        for (int i = 1; i <= EventLog.HISTORY_LIMIT + 5; i++) {
            eventLog.processEvent(remote("r" + i, "other", i));
        }

        List<Event> history = eventLog.history();
        assertThat(history).hasSize(EventLog.HISTORY_LIMIT);
        assertThat(history.get(0).id()).isEqualTo("r6");
        assertThat(history.get(history.size() - 1).version()).isEqualTo(EventLog.HISTORY_LIMIT + 5);
    }

    @Test
    void resetForgetsSessionState() {
        eventLog.processEvent(remote("r1", "other", 5));

        eventLog.reset();

        assertThat(eventLog.baseVersion()).isZero();
        assertThat(eventLog.history()).isEmpty();
        assertThat(eventLog.isAcknowledged("r1")).isFalse();
    }

    private Event remote(String id, String author, long version) {
        return new Event(id, null, SESSION, author, Instant.parse("2024-05-01T09:00:00Z"),
                new EventPayload.MessageSent(id, "text " + id), version, false);
    }
}
