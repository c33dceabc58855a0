package com.questrail.chat.core;

import com.questrail.chat.api.ChatException;
import com.questrail.chat.api.ErrorCode;
import com.questrail.chat.api.ErrorInfo;
import com.questrail.chat.api.RoomStatus;
import com.questrail.chat.api.RoomStatusChange;
import com.questrail.chat.api.StatusSubscription;
import com.questrail.chat.channel.ChannelState;
import com.questrail.chat.channel.FakeChannelHandle;
import com.questrail.chat.channel.FakeChannelHandle.Outcome;
import com.questrail.chat.channel.FakeChannelProvider;
import com.questrail.chat.config.ReleaseRetryPolicy;
import com.questrail.chat.observability.RecordingObservabilitySink;
import com.questrail.chat.observability.RoomDiscontinuityEvent;
import com.questrail.chat.observability.RoomErrorEvent;
import com.questrail.chat.observability.RoomOperationEvent;
import com.questrail.chat.time.DeterministicScheduler;
import com.questrail.chat.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import static com.questrail.chat.api.ChatAssertions.assertFailsWith;
import static com.questrail.chat.api.ChatAssertions.assertSucceeded;
import static com.questrail.chat.api.ChatAssertions.failureOf;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RoomLifecycleManagerTest
 * -----------------------------------------------------------------------------
 * Drives the lifecycle manager against a scripted channel on a direct
 * executor, so every operation and notification runs to completion inside the
 * call that triggers it. Release retries are driven through the deterministic
 * scheduler.
 */
class RoomLifecycleManagerTest {

    private static final String ROOM = "room-1";
    private static final ErrorInfo CONNECTION_LOST = new ErrorInfo("connection lost", 80003, 503);

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final FakeChannelProvider provider = new FakeChannelProvider();

    private final List<RoomStatusChange> statusChanges = new ArrayList<>();
    private final List<ErrorInfo> discontinuities = new ArrayList<>();

    private DefaultRoomLifecycle lifecycle;
    private FakeChannelHandle channel;
    private RoomLifecycleManager manager;

    @BeforeEach
    void setUp() {
        createManager(ReleaseRetryPolicy.fixed(Duration.ofMillis(100)));
    }

    private void createManager(ReleaseRetryPolicy policy) {
        if (manager != null) {
            manager.dispose();
        }
        lifecycle = new DefaultRoomLifecycle(ROOM);
        lifecycle.onChange(statusChanges::add);
        channel = provider.channel(ChannelManager.channelNameFor(ROOM));
        manager = new RoomLifecycleManager(
                ROOM,
                new ChannelManager(ROOM, provider),
                lifecycle,
                Runnable::run,
                scheduler,
                clock,
                policy,
                sink,
                () -> Instant.EPOCH);
        manager.onDiscontinuity(discontinuities::add);
    }

    private void attached() {
        assertSucceeded(manager.attach());
        assertEquals(RoomStatus.ATTACHED, manager.status());
        statusChanges.clear();
    }

    private List<RoomStatus> statuses() {
        return statusChanges.stream().map(RoomStatusChange::current).collect(Collectors.toList());
    }

    // ---------------------------------------------------------------------
    // Attach / detach
    // ---------------------------------------------------------------------

    @Test
    void attachMovesRoomThroughAttachingToAttached() {
        CompletableFuture<Void> result = manager.attach();

        assertSucceeded(result);
        assertEquals(List.of(RoomStatus.ATTACHING, RoomStatus.ATTACHED), statuses());
        assertEquals(1, channel.attachCalls());
        assertEquals(LifecycleOperation.NONE, manager.currentOperation());

        List<RoomStatus> reported = sink.getStatusTransitions().stream()
                .map(e -> e.change().current())
                .collect(Collectors.toList());
        assertEquals(List.of(RoomStatus.ATTACHING, RoomStatus.ATTACHED), reported);
    }

    @Test
    void attachWhenAlreadyAttachedDoesNotTouchChannel() {
        attached();

        assertSucceeded(manager.attach());

        assertEquals(1, channel.attachCalls());
        assertTrue(statusChanges.isEmpty());
    }

    @Test
    void attachFailurePutsRoomInFailedStateWithTransportCause() {
        ErrorInfo transport = new ErrorInfo("boom", 90001, 500);
        channel.onNextAttach(Outcome.failInto(ChannelState.FAILED, transport));

        CompletableFuture<Void> result = manager.attach();

        ChatException failure = assertInstanceOf(ChatException.class, failureOf(result));
        assertEquals("failed to attach room: boom", failure.getMessage());
        assertEquals(90001, failure.code());
        assertEquals(500, failure.statusCode());
        assertEquals(transport, failure.errorInfo().cause());
        assertInstanceOf(ChatException.class, failure.getCause());

        assertEquals(RoomStatus.FAILED, manager.status());
        assertEquals(failure.errorInfo(), lifecycle.error().orElseThrow());
    }

    @Test
    void detachMovesRoomThroughDetachingToDetached() {
        attached();

        assertSucceeded(manager.detach());

        assertEquals(List.of(RoomStatus.DETACHING, RoomStatus.DETACHED), statuses());
        assertEquals(1, channel.detachCalls());
    }

    @Test
    void detachWhenDetachedIsNoop() {
        attached();
        assertSucceeded(manager.detach());

        assertSucceeded(manager.detach());

        assertEquals(1, channel.detachCalls());
    }

    @Test
    void detachInFailedStateIsRejected() {
        channel.onNextAttach(Outcome.failInto(ChannelState.FAILED, CONNECTION_LOST));
        manager.attach();

        ChatException failure = assertFailsWith(manager.detach(), ErrorCode.ROOM_IN_FAILED_STATE);

        assertEquals(400, failure.statusCode());
        assertEquals(0, channel.detachCalls());
    }

    @Test
    void detachFailurePutsRoomInFailedState() {
        attached();
        channel.onNextDetach(Outcome.fail(new ErrorInfo("detach refused", 90002, 500)));

        ChatException failure = assertInstanceOf(ChatException.class, failureOf(manager.detach()));

        assertEquals("failed to detach room: detach refused", failure.getMessage());
        assertEquals(RoomStatus.FAILED, manager.status());
        assertEquals(90002, lifecycle.error().orElseThrow().code());
    }

    @Test
    void detachRequestedDuringAttachWaitsForIt() {
        CompletableFuture<Void> channelAttach = new CompletableFuture<>();
        channel.onNextAttach(Outcome.pending(channelAttach));
        CompletableFuture<Void> attach = manager.attach();

        CompletableFuture<Void> detach = manager.detach();

        assertFalse(detach.isDone());
        assertEquals(0, channel.detachCalls());
        assertEquals(RoomStatus.ATTACHING, manager.status());

        channel.transitionTo(ChannelState.ATTACHED, false, null);
        channelAttach.complete(null);

        assertSucceeded(attach);
        assertSucceeded(detach);
        assertEquals(1, channel.detachCalls());
        assertEquals(ChannelState.DETACHED, channel.state());
        assertEquals(RoomStatus.DETACHED, manager.status());
        assertEquals(List.of(RoomStatus.ATTACHING, RoomStatus.ATTACHED, RoomStatus.DETACHING, RoomStatus.DETACHED),
                statuses());
    }

    @Test
    void queuedDetachKeepsItsDiscontinuityMask() {
        CompletableFuture<Void> channelAttach = new CompletableFuture<>();
        channel.onNextAttach(Outcome.pending(channelAttach));
        manager.attach();
        CompletableFuture<Void> detach = manager.detach();
        channel.transitionTo(ChannelState.ATTACHED, false, null);
        channelAttach.complete(null);
        assertSucceeded(detach);

        assertSucceeded(manager.attach());

        assertTrue(discontinuities.isEmpty());
        assertEquals(1, sink.eventsOfType(RoomOperationEvent.DiscontinuityMasked.class).size());
    }

    @Test
    void operationsQueuedBehindAnAttachRunInCallOrder() {
        CompletableFuture<Void> channelAttach = new CompletableFuture<>();
        channel.onNextAttach(Outcome.pending(channelAttach));
        CompletableFuture<Void> first = manager.attach();
        CompletableFuture<Void> detach = manager.detach();
        CompletableFuture<Void> second = manager.attach();

        channel.transitionTo(ChannelState.ATTACHED, false, null);
        channelAttach.complete(null);

        assertSucceeded(first);
        assertSucceeded(detach);
        assertSucceeded(second);
        assertEquals(2, channel.attachCalls());
        assertEquals(1, channel.detachCalls());
        assertEquals(RoomStatus.ATTACHED, manager.status());
        assertEquals(LifecycleOperation.NONE, manager.currentOperation());
    }

    // ---------------------------------------------------------------------
    // Channel notifications
    // ---------------------------------------------------------------------

    @Test
    void notificationsDuringAttachDoNotChangeStatus() {
        CompletableFuture<Void> channelAttach = new CompletableFuture<>();
        channel.onNextAttach(Outcome.pending(channelAttach));

        CompletableFuture<Void> result = manager.attach();
        assertEquals(LifecycleOperation.ATTACHING, manager.currentOperation());

        channel.transitionTo(ChannelState.SUSPENDED, false, CONNECTION_LOST);
        channel.transitionTo(ChannelState.ATTACHING, false, null);

        assertEquals(RoomStatus.ATTACHING, manager.status());
        List<RoomOperationEvent.NotificationIgnored> ignored =
                sink.eventsOfType(RoomOperationEvent.NotificationIgnored.class);
        assertEquals(2, ignored.size());
        assertEquals("ATTACHING", ignored.get(0).operation());
        assertEquals("SUSPENDED", ignored.get(0).channelState());

        channel.transitionTo(ChannelState.ATTACHED, false, null);
        channelAttach.complete(null);

        assertSucceeded(result);
        assertEquals(RoomStatus.ATTACHED, manager.status());
        assertEquals(List.of(RoomStatus.ATTACHING, RoomStatus.ATTACHED), statuses());
    }

    @Test
    void channelStateChangesDriveStatusWhenIdle() {
        attached();

        channel.transitionTo(ChannelState.SUSPENDED, false, CONNECTION_LOST);

        assertEquals(RoomStatus.SUSPENDED, manager.status());
        assertEquals(CONNECTION_LOST, lifecycle.error().orElseThrow());
        assertEquals(CONNECTION_LOST, statusChanges.get(0).error());

        ErrorInfo fatal = new ErrorInfo("channel failed", 90000, 500);
        channel.transitionTo(ChannelState.FAILED, false, fatal);

        assertEquals(RoomStatus.FAILED, manager.status());
        assertEquals(fatal, lifecycle.error().orElseThrow());
    }

    @Test
    void notificationsAfterDisposeAreIgnored() {
        attached();

        manager.dispose();
        manager.dispose();
        channel.transitionTo(ChannelState.SUSPENDED, false, CONNECTION_LOST);

        assertEquals(0, channel.stateListenerCount());
        assertEquals(RoomStatus.ATTACHED, manager.status());
    }

    // ---------------------------------------------------------------------
    // Discontinuities
    // ---------------------------------------------------------------------

    @Test
    void firstAttachIsNotADiscontinuity() {
        attached();

        assertTrue(discontinuities.isEmpty());
    }

    @Test
    void unresumedReattachAfterSuspensionIsOneDiscontinuity() {
        attached();

        channel.transitionTo(ChannelState.SUSPENDED, false, CONNECTION_LOST);
        assertEquals(RoomStatus.SUSPENDED, manager.status());
        assertEquals(80003, lifecycle.error().orElseThrow().code());

        channel.transitionTo(ChannelState.ATTACHED, false, CONNECTION_LOST);

        assertEquals(RoomStatus.ATTACHED, manager.status());
        assertTrue(lifecycle.error().isEmpty());
        assertEquals(1, discontinuities.size());

        ErrorInfo discontinuity = discontinuities.get(0);
        assertEquals(ErrorCode.ROOM_DISCONTINUITY.code(), discontinuity.code());
        assertEquals(503, discontinuity.statusCode());
        assertEquals(CONNECTION_LOST, discontinuity.cause());
        assertEquals(1, sink.eventsOfType(RoomDiscontinuityEvent.class).size());
    }

    @Test
    void resumedReattachIsNotADiscontinuity() {
        attached();

        channel.transitionTo(ChannelState.SUSPENDED, false, CONNECTION_LOST);
        channel.transitionTo(ChannelState.ATTACHED, true, null);

        assertTrue(discontinuities.isEmpty());
    }

    @Test
    void unresumedUpdateWhileAttachedIsADiscontinuity() {
        attached();

        channel.update(false, CONNECTION_LOST);

        assertEquals(1, discontinuities.size());
        assertEquals(CONNECTION_LOST, discontinuities.get(0).cause());
        assertEquals(RoomStatus.ATTACHED, manager.status());
    }

    @Test
    void discontinuityWithoutReasonHasNoCause() {
        attached();

        channel.update(false, null);

        assertEquals(1, discontinuities.size());
        assertNull(discontinuities.get(0).cause());
        assertEquals(0, discontinuities.get(0).statusCode());
    }

    @Test
    void detachAttachCyclesAreNotDiscontinuities() {
        attached();

        for (int i = 0; i < 3; i++) {
            assertSucceeded(manager.detach());
            assertSucceeded(manager.attach());
        }

        assertTrue(discontinuities.isEmpty());
        assertEquals(3, sink.eventsOfType(RoomOperationEvent.DiscontinuityMasked.class).size());
    }

    @Test
    void attachSuccessClearsDetachMask() {
        attached();
        assertSucceeded(manager.detach());
        assertSucceeded(manager.attach());

        channel.update(false, CONNECTION_LOST);

        assertEquals(1, discontinuities.size());
    }

    @Test
    void failedDetachDropsDiscontinuityMask() {
        attached();
        channel.onNextDetach(Outcome.fail(new ErrorInfo("detach refused", 90002, 500)));
        manager.detach();

        channel.update(false, CONNECTION_LOST);

        assertEquals(1, discontinuities.size());
        assertEquals(RoomStatus.ATTACHED, manager.status());
    }

    @Test
    void discontinuityIsDetectedEvenWhileAnOperationIsInFlight() {
        attached();
        channel.transitionTo(ChannelState.SUSPENDED, false, CONNECTION_LOST);
        CompletableFuture<Void> channelAttach = new CompletableFuture<>();
        channel.onNextAttach(Outcome.pending(channelAttach));
        CompletableFuture<Void> attach = manager.attach();

        channel.transitionTo(ChannelState.ATTACHED, false, CONNECTION_LOST);

        assertEquals(1, discontinuities.size());
        assertEquals(RoomStatus.ATTACHING, manager.status());

        channelAttach.complete(null);
        assertSucceeded(attach);
        assertEquals(RoomStatus.ATTACHED, manager.status());
    }

    @Test
    void failingDiscontinuityListenerDoesNotStopOthers() {
        List<ErrorInfo> second = new ArrayList<>();
        manager.onDiscontinuity(error -> {
            throw new IllegalStateException("listener bug");
        });
        manager.onDiscontinuity(second::add);
        attached();

        channel.update(false, null);

        assertEquals(1, discontinuities.size());
        assertEquals(1, second.size());
        List<RoomErrorEvent> errors = sink.getErrors();
        assertEquals(1, errors.size());
        assertEquals("discontinuity listener failed", errors.get(0).message());
        assertInstanceOf(IllegalStateException.class, errors.get(0).cause());
    }

    @Test
    void removedDiscontinuityListenerIsNotCalled() {
        List<ErrorInfo> removed = new ArrayList<>();
        StatusSubscription subscription = manager.onDiscontinuity(removed::add);
        attached();

        subscription.off();
        subscription.off();
        channel.update(false, null);

        assertTrue(removed.isEmpty());
        assertEquals(1, discontinuities.size());
    }

    // ---------------------------------------------------------------------
    // Release
    // ---------------------------------------------------------------------

    @Test
    void releaseDetachesAndReleasesChannel() {
        attached();

        assertSucceeded(manager.release());

        assertEquals(List.of(RoomStatus.RELEASING, RoomStatus.RELEASED), statuses());
        assertEquals(1, channel.detachCalls());
        assertEquals(1, provider.releaseCount(channel.name()));
    }

    @Test
    void releaseOfInitializedRoomSkipsDetach() {
        assertSucceeded(manager.release());

        assertEquals(RoomStatus.RELEASED, manager.status());
        assertEquals(List.of(RoomStatus.RELEASED), statuses());
        assertEquals(0, channel.detachCalls());
        assertEquals(1, provider.releaseCount(channel.name()));
    }

    @Test
    void releaseOfFailedChannelSkipsDetach() {
        channel.onNextAttach(Outcome.failInto(ChannelState.FAILED, CONNECTION_LOST));
        manager.attach();

        assertSucceeded(manager.release());

        assertEquals(RoomStatus.RELEASED, manager.status());
        assertEquals(0, channel.detachCalls());
    }

    @Test
    void releaseTwiceReleasesChannelOnce() {
        attached();

        CompletableFuture<Void> first = manager.release();
        CompletableFuture<Void> second = manager.release();

        assertSucceeded(first);
        assertSucceeded(second);
        assertEquals(RoomStatus.RELEASED, manager.status());
        assertEquals(1, channel.detachCalls());
        assertEquals(1, provider.releaseCount(channel.name()));
    }

    @Test
    void concurrentReleasesShareOneRelease() {
        attached();
        CompletableFuture<Void> channelDetach = new CompletableFuture<>();
        channel.onNextDetach(Outcome.pending(channelDetach));

        CompletableFuture<Void> first = manager.release();
        CompletableFuture<Void> second = manager.release();
        assertFalse(first.isDone());
        assertFalse(second.isDone());
        assertEquals(LifecycleOperation.RELEASING, manager.currentOperation());

        channelDetach.complete(null);

        assertSucceeded(first);
        assertSucceeded(second);
        assertEquals(1, channel.detachCalls());
        assertEquals(1, provider.releaseCount(channel.name()));
    }

    @Test
    void releaseRetriesDetachUntilItSucceeds() {
        attached();
        ErrorInfo refused = new ErrorInfo("detach refused", 90002, 500);
        channel.onNextDetach(Outcome.fail(refused)).onNextDetach(Outcome.fail(refused));

        CompletableFuture<Void> release = manager.release();

        assertFalse(release.isDone());
        assertEquals(RoomStatus.RELEASING, manager.status());
        assertEquals(1, channel.detachCalls());

        clock.advanceMillis(99);
        scheduler.runDueTasks();
        assertEquals(1, channel.detachCalls());

        clock.advanceMillis(1);
        scheduler.runDueTasks();
        assertEquals(2, channel.detachCalls());
        assertFalse(release.isDone());

        clock.advanceMillis(100);
        scheduler.runDueTasks();

        assertSucceeded(release);
        assertEquals(3, channel.detachCalls());
        assertEquals(RoomStatus.RELEASED, manager.status());
        assertEquals(1, provider.releaseCount(channel.name()));

        assertEquals(2, sink.getErrors().size());
        List<RoomOperationEvent.ReleaseRetryScheduled> retries =
                sink.eventsOfType(RoomOperationEvent.ReleaseRetryScheduled.class);
        assertEquals(List.of(1, 2), retries.stream()
                .map(RoomOperationEvent.ReleaseRetryScheduled::failedAttempt)
                .collect(Collectors.toList()));
    }

    @Test
    void releaseRetryDelaysFollowBackoffPolicy() {
        createManager(new ReleaseRetryPolicy(Duration.ofMillis(100), Duration.ofMillis(400), 2.0));
        attached();
        ErrorInfo refused = new ErrorInfo("detach refused", 90002, 500);
        for (int i = 0; i < 4; i++) {
            channel.onNextDetach(Outcome.fail(refused));
        }

        CompletableFuture<Void> release = manager.release();
        for (long delay : new long[] {100, 200, 400, 400}) {
            clock.advanceMillis(delay);
            scheduler.runDueTasks();
        }

        assertSucceeded(release);
        assertEquals(5, channel.detachCalls());
        List<Long> delays = sink.eventsOfType(RoomOperationEvent.ReleaseRetryScheduled.class).stream()
                .map(RoomOperationEvent.ReleaseRetryScheduled::delayMillis)
                .collect(Collectors.toList());
        assertEquals(List.of(100L, 200L, 400L, 400L), delays);
    }

    @Test
    void releaseStopsRetryingOnceChannelFails() {
        attached();
        channel.onNextDetach(Outcome.failInto(ChannelState.FAILED, CONNECTION_LOST));

        CompletableFuture<Void> release = manager.release();
        assertFalse(release.isDone());

        clock.advanceMillis(100);
        scheduler.runDueTasks();

        assertSucceeded(release);
        assertEquals(1, channel.detachCalls());
        assertEquals(RoomStatus.RELEASED, manager.status());
    }

    @Test
    void attachAndDetachAfterReleaseAreRejected() {
        assertSucceeded(manager.release());

        ChatException attach = assertFailsWith(manager.attach(), ErrorCode.ROOM_IS_RELEASED);
        assertFailsWith(manager.detach(), ErrorCode.ROOM_IS_RELEASED);

        assertEquals(400, attach.statusCode());
        assertEquals(0, channel.attachCalls());
        assertEquals(0, channel.detachCalls());
    }

    @Test
    void attachWhileReleasingIsRejected() {
        attached();
        CompletableFuture<Void> channelDetach = new CompletableFuture<>();
        channel.onNextDetach(Outcome.pending(channelDetach));
        CompletableFuture<Void> release = manager.release();

        assertFailsWith(manager.attach(), ErrorCode.ROOM_IS_RELEASING);
        assertFailsWith(manager.detach(), ErrorCode.ROOM_IS_RELEASING);

        channelDetach.complete(null);
        assertSucceeded(release);
        assertEquals(1, channel.attachCalls());
    }

    @Test
    void releaseRequestedDuringAttachRunsAfterIt() {
        CompletableFuture<Void> channelAttach = new CompletableFuture<>();
        channel.onNextAttach(Outcome.pending(channelAttach));
        CompletableFuture<Void> attach = manager.attach();

        CompletableFuture<Void> release = manager.release();

        assertFalse(release.isDone());
        assertEquals(LifecycleOperation.ATTACHING, manager.currentOperation());
        assertEquals(RoomStatus.ATTACHING, manager.status());
        assertFailsWith(manager.detach(), ErrorCode.ROOM_IS_RELEASING);

        channel.transitionTo(ChannelState.ATTACHED, false, null);
        channelAttach.complete(null);

        assertSucceeded(attach);
        assertSucceeded(release);
        assertEquals(List.of(RoomStatus.ATTACHING, RoomStatus.ATTACHED, RoomStatus.RELEASING, RoomStatus.RELEASED),
                statuses());
        assertEquals(1, channel.detachCalls());
        assertEquals(1, provider.releaseCount(channel.name()));
    }

    @Test
    void attachQueuedBeforeReleaseIsOvertakenByIt() {
        attached();
        CompletableFuture<Void> channelDetach = new CompletableFuture<>();
        channel.onNextDetach(Outcome.pending(channelDetach));
        CompletableFuture<Void> detach = manager.detach();
        CompletableFuture<Void> attach = manager.attach();
        CompletableFuture<Void> release = manager.release();

        channelDetach.complete(null);

        assertSucceeded(detach);
        assertSucceeded(release);
        ChatException failure = assertFailsWith(attach, ErrorCode.ROOM_RELEASED_BEFORE_OPERATION_COMPLETED);
        assertEquals(400, failure.statusCode());
        assertEquals(RoomStatus.RELEASED, manager.status());
        assertEquals(1, channel.attachCalls());
    }

    @Test
    void providerReleaseFailureLeavesRoomReleasable() {
        provider.failNextRelease(new IllegalStateException("registry busy"));

        CompletableFuture<Void> first = manager.release();

        ChatException failure = assertInstanceOf(ChatException.class, failureOf(first));
        assertEquals("registry busy", failure.getMessage());
        assertNotEquals(RoomStatus.RELEASED, manager.status());
        assertEquals("failed to release channel", sink.getErrors().get(0).message());

        assertSucceeded(manager.release());
        assertEquals(RoomStatus.RELEASED, manager.status());
        assertEquals(1, provider.releaseCount(channel.name()));
    }

    @Test
    void noDiscontinuityWhileReleasing() {
        attached();
        ErrorInfo refused = new ErrorInfo("detach refused", 90002, 500);
        channel.onNextDetach(Outcome.fail(refused));
        CompletableFuture<Void> release = manager.release();
        assertEquals(RoomStatus.RELEASING, manager.status());

        channel.update(false, CONNECTION_LOST);

        assertTrue(discontinuities.isEmpty());
        assertTrue(sink.eventsOfType(RoomDiscontinuityEvent.class).isEmpty());
        assertEquals(RoomStatus.RELEASING, manager.status());

        clock.advanceMillis(100);
        scheduler.runDueTasks();
        assertSucceeded(release);
    }

    @Test
    void notificationsAfterReleaseDoNotChangeStatus() {
        attached();
        assertSucceeded(manager.release());

        channel.transitionTo(ChannelState.ATTACHED, false, null);

        assertEquals(RoomStatus.RELEASED, manager.status());
        assertEquals(RoomStatus.RELEASED, statusChanges.get(statusChanges.size() - 1).current());
        assertTrue(discontinuities.isEmpty());
    }
}
