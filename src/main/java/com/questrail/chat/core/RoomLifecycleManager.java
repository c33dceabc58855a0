package com.questrail.chat.core;

import com.questrail.chat.api.ChatException;
import com.questrail.chat.api.DiscontinuityListener;
import com.questrail.chat.api.EmitsDiscontinuities;
import com.questrail.chat.api.ErrorCode;
import com.questrail.chat.api.ErrorInfo;
import com.questrail.chat.api.RoomStatus;
import com.questrail.chat.api.RoomStatusChange;
import com.questrail.chat.api.StatusSubscription;
import com.questrail.chat.channel.ChannelHandle;
import com.questrail.chat.channel.ChannelState;
import com.questrail.chat.channel.ChannelStateChange;
import com.questrail.chat.channel.ChannelStateListener;
import com.questrail.chat.config.ReleaseRetryPolicy;
import com.questrail.chat.internal.time.MonotonicClock;
import com.questrail.chat.internal.time.MonotonicScheduler;
import com.questrail.chat.internal.time.WallClock;
import com.questrail.chat.observability.RoomDiscontinuityEvent;
import com.questrail.chat.observability.RoomErrorEvent;
import com.questrail.chat.observability.RoomObservabilitySink;
import com.questrail.chat.observability.RoomOperationEvent;
import com.questrail.chat.observability.RoomStatusTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * RoomLifecycleManager
 * =============================================================================
 * Drives one room's channel through attach, detach and release, keeps the
 * room's status in step with the channel, and derives discontinuity events.
 *
 * <h2>Execution model</h2>
 * Every state transition runs on a single-threaded {@link Executor} (the room
 * event loop). Public operations and channel callbacks hop onto it before
 * touching state, so no field below is guarded by a lock. Each operation
 * suspends exactly once, while waiting for the channel.
 *
 * <h2>Operations in flight</h2>
 * Attach, detach and release run one at a time. A call made while another
 * operation runs is queued; a queued release goes ahead of any queued attach
 * or detach, which otherwise run in call order.
 * <ul>
 *   <li>While an operation runs ({@link LifecycleOperation} other than
 *       {@code NONE}), unsolicited channel notifications do not change the
 *       room status. The operation's own completion decides it.</li>
 *   <li>Concurrent {@link #release()} calls join the release already
 *       requested.</li>
 *   <li>Attach and detach fail fast once a release is requested. One queued
 *       before the release fails with
 *       {@link ErrorCode#ROOM_RELEASED_BEFORE_OPERATION_COMPLETED}.</li>
 * </ul>
 *
 * <h2>Discontinuities</h2>
 * An {@code attached} notification (transition, or in-place update from
 * {@code attached}) with {@code resumed == false} is a discontinuity when the
 * room has attached before. An explicit {@link #detach()} masks exactly one
 * subsequent {@code attached} notification. The mask is dropped again if the
 * detach fails. No discontinuity is raised once a release is requested.
 *
 * <h2>Release</h2>
 * Release retries the channel detach without limit, spaced by the
 * {@link ReleaseRetryPolicy}, until it succeeds or the channel fails. Detach
 * failures during release are reported to the observability sink and never to
 * the caller.
 */
public final class RoomLifecycleManager implements EmitsDiscontinuities
{
    private static final Logger log = LoggerFactory.getLogger(RoomLifecycleManager.class);

    private static final int MISUSE_STATUS = 400;

    private final String roomName;
    private final ChannelManager channelManager;
    private final DefaultRoomLifecycle lifecycle;
    private final Executor executor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final ReleaseRetryPolicy retryPolicy;
    private final RoomObservabilitySink sink;
    private final WallClock wallClock;

    private final ChannelHandle channel;
    private final ChannelStateListener channelListener;
    private final ListenerRegistry<DiscontinuityListener> discontinuityListeners = new ListenerRegistry<>();
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    // Event-loop confined state
    private final PriorityQueue<QueuedOperation> queue = new PriorityQueue<>();
    private long nextSequence;
    private LifecycleOperation running = LifecycleOperation.NONE;
    private CompletableFuture<Void> pendingRelease;
    private boolean hasAttachedOnce;
    private boolean discontinuityGuard;

    public RoomLifecycleManager(String roomName,
                                ChannelManager channelManager,
                                DefaultRoomLifecycle lifecycle,
                                Executor executor,
                                MonotonicScheduler scheduler,
                                MonotonicClock clock,
                                ReleaseRetryPolicy retryPolicy,
                                RoomObservabilitySink sink,
                                WallClock wallClock)
    {
        this.roomName = Objects.requireNonNull(roomName, "roomName");
        this.channelManager = Objects.requireNonNull(channelManager, "channelManager");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.channel = channelManager.get();
        this.channelListener = change -> executor.execute(() -> onChannelStateChange(change));
        this.channel.on(channelListener);
    }

    // ---------------------------------------------------------------------
    // Public operations
    // ---------------------------------------------------------------------

    /**
     * Attaches the room's channel.
     *
     * @return completes when the room is attached; fails with a
     *         {@link ChatException} on misuse or transport failure
     */
    public CompletableFuture<Void> attach() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        executor.execute(() -> submit(LifecycleOperation.ATTACHING, this::runAttach, result));
        return result;
    }

    /**
     * Detaches the room's channel.
     */
    public CompletableFuture<Void> detach() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        executor.execute(() -> submit(LifecycleOperation.DETACHING, this::runDetach, result));
        return result;
    }

    /**
     * Releases the room. Idempotent; concurrent calls share one release.
     */
    public CompletableFuture<Void> release() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        executor.execute(() -> submitRelease(result));
        return result;
    }

    @Override
    public StatusSubscription onDiscontinuity(DiscontinuityListener listener) {
        ListenerRegistry.Registration registration = discontinuityListeners.add(listener);
        return registration::remove;
    }

    /**
     * Stops listening to the channel and drops every discontinuity listener.
     * Idempotent.
     */
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        channel.off(channelListener);
        discontinuityListeners.clear();
        log.debug("Room {}: lifecycle manager disposed", roomName);
    }

    /**
     * @return the operation currently running. Only meaningful on the event loop.
     */
    public LifecycleOperation currentOperation() {
        return running;
    }

    public RoomStatus status() {
        return lifecycle.status();
    }

    // ---------------------------------------------------------------------
    // Operation queue
    // ---------------------------------------------------------------------

    private void submit(LifecycleOperation operation,
                        Supplier<CompletableFuture<Void>> body,
                        CompletableFuture<Void> result)
    {
        ChatException misuse = checkNotReleasing(operation);
        if (misuse != null) {
            result.completeExceptionally(misuse);
            return;
        }
        queue.add(new QueuedOperation(operation, nextSequence++, body, result));
        runNext();
    }

    private void submitRelease(CompletableFuture<Void> result) {
        if (pendingRelease != null) {
            log.debug("Room {}: release already requested, joining it", roomName);
            propagate(pendingRelease, result);
            return;
        }
        CompletableFuture<Void> release = new CompletableFuture<>();
        pendingRelease = release;
        propagate(release, result);
        queue.add(new QueuedOperation(LifecycleOperation.RELEASING, nextSequence++, this::runRelease, release));
        runNext();
    }

    /**
     * Starts the highest priority queued operation unless one is running.
     */
    private void runNext() {
        if (running.inFlight()) {
            return;
        }
        QueuedOperation next = queue.poll();
        if (next == null) {
            return;
        }
        running = next.operation();

        CompletableFuture<Void> stage;
        try {
            stage = next.body().get();
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        stage.whenCompleteAsync((v, failure) -> {
            running = LifecycleOperation.NONE;
            if (next.operation() == LifecycleOperation.RELEASING) {
                pendingRelease = null;
            }
            if (failure == null) {
                next.result().complete(null);
            } else {
                next.result().completeExceptionally(unwrap(failure));
            }
            runNext();
        }, executor);
    }

    /**
     * Rejects attach and detach once a release has been requested.
     */
    private ChatException checkNotReleasing(LifecycleOperation operation) {
        String verb = operation == LifecycleOperation.ATTACHING ? "attach" : "detach";
        if (lifecycle.status() == RoomStatus.RELEASED) {
            return ChatException.of(ErrorCode.ROOM_IS_RELEASED, MISUSE_STATUS,
                    "cannot " + verb + " room, room is released");
        }
        if (pendingRelease != null || lifecycle.status() == RoomStatus.RELEASING) {
            return ChatException.of(ErrorCode.ROOM_IS_RELEASING, MISUSE_STATUS,
                    "cannot " + verb + " room, room is currently releasing");
        }
        return null;
    }

    /**
     * An attach or detach queued before a release that ran ahead of it.
     */
    private CompletableFuture<Void> overtakenByRelease(String verb) {
        log.debug("Room {}: queued {} overtaken by release", roomName, verb);
        return CompletableFuture.failedFuture(ChatException.of(
                ErrorCode.ROOM_RELEASED_BEFORE_OPERATION_COMPLETED, MISUSE_STATUS,
                "room was released before " + verb + " completed"));
    }

    // ---------------------------------------------------------------------
    // Attach / detach
    // ---------------------------------------------------------------------

    private CompletableFuture<Void> runAttach() {
        if (lifecycle.status() == RoomStatus.RELEASED) {
            return overtakenByRelease("attach");
        }
        if (lifecycle.status() == RoomStatus.ATTACHED) {
            log.debug("Room {}: already attached, attach is a no-op", roomName);
            return CompletableFuture.completedFuture(null);
        }

        setStatus(RoomStatus.ATTACHING, null);

        CompletableFuture<Void> done = new CompletableFuture<>();
        invoke(channel::attach).whenCompleteAsync((ignored, failure) -> {
            if (failure == null) {
                hasAttachedOnce = true;
                discontinuityGuard = false;
                setStatus(RoomStatus.ATTACHED, null);
                done.complete(null);
            } else {
                ErrorInfo error = wrapTransportFailure("failed to attach room: ", failure);
                setStatus(RoomStatus.FAILED, error);
                done.completeExceptionally(new ChatException(error, unwrap(failure)));
            }
        }, executor);
        return done;
    }

    private CompletableFuture<Void> runDetach() {
        if (lifecycle.status() == RoomStatus.RELEASED) {
            return overtakenByRelease("detach");
        }
        if (lifecycle.status() == RoomStatus.FAILED) {
            return CompletableFuture.failedFuture(ChatException.of(ErrorCode.ROOM_IN_FAILED_STATE,
                    MISUSE_STATUS, "cannot detach room, room is in failed state"));
        }
        if (lifecycle.status() == RoomStatus.DETACHED) {
            log.debug("Room {}: already detached, detach is a no-op", roomName);
            return CompletableFuture.completedFuture(null);
        }

        discontinuityGuard = true;
        setStatus(RoomStatus.DETACHING, null);

        CompletableFuture<Void> done = new CompletableFuture<>();
        invoke(channel::detach).whenCompleteAsync((ignored, failure) -> {
            if (failure == null) {
                setStatus(RoomStatus.DETACHED, null);
                done.complete(null);
            } else {
                discontinuityGuard = false;
                ErrorInfo error = wrapTransportFailure("failed to detach room: ", failure);
                setStatus(RoomStatus.FAILED, error);
                done.completeExceptionally(new ChatException(error, unwrap(failure)));
            }
        }, executor);
        return done;
    }

    // ---------------------------------------------------------------------
    // Release
    // ---------------------------------------------------------------------

    private CompletableFuture<Void> runRelease() {
        CompletableFuture<Void> release = new CompletableFuture<>();
        if (lifecycle.status() == RoomStatus.RELEASED) {
            log.debug("Room {}: already released, release is a no-op", roomName);
            release.complete(null);
            return release;
        }

        RoomStatus status = lifecycle.status();
        ChannelState channelState = channel.state();
        if (status == RoomStatus.INITIALIZED || status == RoomStatus.DETACHED
                || channelState == ChannelState.INITIALIZED
                || channelState == ChannelState.DETACHED
                || channelState == ChannelState.FAILED) {
            log.debug("Room {}: releasing without detach (status {}, channel {})", roomName, status, channelState);
            releaseChannel(release);
            return release;
        }

        setStatus(RoomStatus.RELEASING, null);
        detachForRelease(1, release);
        return release;
    }

    private void detachForRelease(int attempt, CompletableFuture<Void> release) {
        if (channel.state() == ChannelState.FAILED) {
            log.debug("Room {}: channel failed, skipping release detach", roomName);
            releaseChannel(release);
            return;
        }

        invoke(channel::detach).whenCompleteAsync((ignored, failure) -> {
            if (failure == null) {
                releaseChannel(release);
                return;
            }

            Duration delay = retryPolicy.delayAfterAttempt(attempt);
            ErrorInfo error = ErrorInfo.from(unwrap(failure));
            sink.onError(new RoomErrorEvent(wallClock.now(), roomName,
                    "failed to detach channel during release", error, unwrap(failure)));
            sink.onOperationEvent(new RoomOperationEvent.ReleaseRetryScheduled(
                    wallClock.now(), roomName, attempt, delay.toMillis()));

            scheduler.scheduleAfter(delay, clock,
                    () -> executor.execute(() -> detachForRelease(attempt + 1, release)));
        }, executor);
    }

    private void releaseChannel(CompletableFuture<Void> release) {
        try {
            channelManager.release();
        } catch (RuntimeException e) {
            ErrorInfo error = ErrorInfo.from(e);
            sink.onError(new RoomErrorEvent(wallClock.now(), roomName,
                    "failed to release channel", error, e));
            release.completeExceptionally(e instanceof ChatException ? e : new ChatException(error, e));
            return;
        }

        setStatus(RoomStatus.RELEASED, null);
        release.complete(null);
    }

    // ---------------------------------------------------------------------
    // Channel notifications
    // ---------------------------------------------------------------------

    private void onChannelStateChange(ChannelStateChange change) {
        if (disposed.get()) {
            return;
        }
        log.debug("Room {}: channel {} -> {} (resumed={}, update={})",
                roomName, change.previous(), change.current(), change.resumed(), change.update());

        if (lifecycle.status() == RoomStatus.RELEASED) {
            return;
        }

        if (pendingRelease == null) {
            checkDiscontinuity(change);
        }
        if (change.current() == ChannelState.ATTACHED) {
            hasAttachedOnce = true;
        }

        LifecycleOperation operation = currentOperation();
        if (operation.inFlight()) {
            sink.onOperationEvent(new RoomOperationEvent.NotificationIgnored(
                    wallClock.now(), roomName, operation.name(), change.current().name()));
            return;
        }

        setStatus(toRoomStatus(change.current()), change.reason());
    }

    private void checkDiscontinuity(ChannelStateChange change) {
        if (change.current() != ChannelState.ATTACHED) {
            return;
        }
        if (change.update() && change.previous() != ChannelState.ATTACHED) {
            return;
        }
        if (discontinuityGuard) {
            discontinuityGuard = false;
            if (!change.resumed() && hasAttachedOnce) {
                sink.onOperationEvent(new RoomOperationEvent.DiscontinuityMasked(wallClock.now(), roomName));
            }
            return;
        }
        if (change.resumed() || !hasAttachedOnce) {
            return;
        }

        ErrorInfo reason = change.reason();
        ErrorInfo error = new ErrorInfo("discontinuity detected", ErrorCode.ROOM_DISCONTINUITY.code(),
                reason != null ? reason.statusCode() : 0, reason);

        sink.onDiscontinuity(new RoomDiscontinuityEvent(wallClock.now(), roomName, error));
        discontinuityListeners.emit(error, DiscontinuityListener::onDiscontinuity,
                e -> sink.onError(new RoomErrorEvent(wallClock.now(), roomName,
                        "discontinuity listener failed", null, e)));
    }

    private static RoomStatus toRoomStatus(ChannelState state) {
        switch (state) {
            case INITIALIZED:
                return RoomStatus.INITIALIZED;
            case ATTACHING:
                return RoomStatus.ATTACHING;
            case ATTACHED:
                return RoomStatus.ATTACHED;
            case DETACHING:
                return RoomStatus.DETACHING;
            case DETACHED:
                return RoomStatus.DETACHED;
            case SUSPENDED:
                return RoomStatus.SUSPENDED;
            case FAILED:
            default:
                return RoomStatus.FAILED;
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void setStatus(RoomStatus status, ErrorInfo error) {
        RoomStatusChange change = lifecycle.setStatus(status, error);
        sink.onStatusTransition(new RoomStatusTransitionEvent(wallClock.now(), roomName, change));
    }

    /**
     * Calls into the channel, turning a synchronous throw into a failed stage.
     */
    private static CompletionStage<Void> invoke(Supplier<CompletionStage<Void>> call) {
        try {
            return Objects.requireNonNull(call.get(), "channel returned no completion stage");
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static ErrorInfo wrapTransportFailure(String prefix, Throwable failure) {
        ErrorInfo transport = ErrorInfo.from(unwrap(failure));
        return new ErrorInfo(prefix + transport.message(), transport.code(), transport.statusCode(), transport);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable t = failure;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * One queued operation. A release runs before any queued attach or detach;
     * otherwise operations run in call order.
     */
    private static final class QueuedOperation implements Comparable<QueuedOperation> {
        private final LifecycleOperation operation;
        private final long sequence;
        private final Supplier<CompletableFuture<Void>> body;
        private final CompletableFuture<Void> result;

        QueuedOperation(LifecycleOperation operation,
                        long sequence,
                        Supplier<CompletableFuture<Void>> body,
                        CompletableFuture<Void> result)
        {
            this.operation = operation;
            this.sequence = sequence;
            this.body = body;
            this.result = result;
        }

        LifecycleOperation operation() {
            return operation;
        }

        Supplier<CompletableFuture<Void>> body() {
            return body;
        }

        CompletableFuture<Void> result() {
            return result;
        }

        private int priority() {
            return operation == LifecycleOperation.RELEASING ? 0 : 1;
        }

        @Override
        public int compareTo(QueuedOperation other) {
            int byPriority = Integer.compare(priority(), other.priority());
            return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
        }
    }

    private static void propagate(CompletableFuture<Void> source, CompletableFuture<Void> target) {
        source.whenComplete((v, failure) -> {
            if (failure == null) {
                target.complete(null);
            } else {
                target.completeExceptionally(unwrap(failure));
            }
        });
    }
}
