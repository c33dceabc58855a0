package com.questrail.chat.core;

import com.questrail.chat.api.DiscontinuityListener;
import com.questrail.chat.api.ErrorCode;
import com.questrail.chat.api.ErrorInfo;
import com.questrail.chat.api.Room;
import com.questrail.chat.api.RoomStatus;
import com.questrail.chat.api.RoomStatusListener;
import com.questrail.chat.api.StatusSubscription;
import com.questrail.chat.channel.ChannelHandle;
import com.questrail.chat.channel.ChannelProvider;
import com.questrail.chat.config.RoomOptions;
import com.questrail.chat.internal.time.MonotonicClock;
import com.questrail.chat.internal.time.MonotonicScheduler;
import com.questrail.chat.internal.time.WallClock;
import com.questrail.chat.message.DefaultMessages;
import com.questrail.chat.message.MessageHistory;
import com.questrail.chat.message.Messages;
import com.questrail.chat.observability.RoomErrorEvent;
import com.questrail.chat.observability.RoomObservabilitySink;
import com.questrail.chat.typing.DefaultTyping;
import com.questrail.chat.typing.Typing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * DefaultRoom
 * =============================================================================
 * Composition root of one room.
 *
 * <h2>Construction order</h2>
 * <ol>
 *   <li>status container and channel manager</li>
 *   <li>channel options merged, then the channel requested (options freeze)</li>
 *   <li>features, each handed the channel</li>
 *   <li>lifecycle manager, last, so it observes a fully wired channel</li>
 * </ol>
 *
 * <h2>Release</h2>
 * {@link #release()} runs the lifecycle manager's release and then disposes
 * the features, the manager's listeners and the status listeners.
 */
public final class DefaultRoom implements Room
{
    private static final Logger log = LoggerFactory.getLogger(DefaultRoom.class);

    // Rejected before reaching the channel; no feature is involved.
    private static final Set<ErrorCode> MISUSE = EnumSet.of(
            ErrorCode.ROOM_IS_RELEASED,
            ErrorCode.ROOM_IS_RELEASING,
            ErrorCode.ROOM_IN_FAILED_STATE,
            ErrorCode.ROOM_RELEASED_BEFORE_OPERATION_COMPLETED);

    private final String name;
    private final RoomOptions options;
    private final RoomObservabilitySink sink;
    private final WallClock wallClock;

    private final DefaultRoomLifecycle lifecycle;
    private final DefaultMessages messages;
    private final DefaultTyping typing;
    private final List<ContributesToRoomLifecycle> features;
    private final RoomLifecycleManager lifecycleManager;
    private final StatusSubscription historyResync;

    public DefaultRoom(String name,
                       RoomOptions options,
                       ChannelProvider channelProvider,
                       Executor executor,
                       MonotonicScheduler scheduler,
                       MonotonicClock clock,
                       RoomObservabilitySink sink,
                       WallClock wallClock,
                       MessageHistory history)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.options = Objects.requireNonNull(options, "options");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.lifecycle = new DefaultRoomLifecycle(name);

        ChannelManager channelManager = new ChannelManager(name, channelProvider);
        options.channelParams().forEach((key, value) ->
                channelManager.mergeOptions(o -> o.withParam(key, value)));
        ChannelHandle channel = channelManager.get();

        this.messages = new DefaultMessages(name, channel, executor);
        this.typing = new DefaultTyping(name, channel, options.typing(), executor, scheduler, clock);
        this.features = List.of(messages, typing);

        this.lifecycleManager = new RoomLifecycleManager(name, channelManager, lifecycle, executor,
                scheduler, clock, options.releaseRetryPolicy(), sink, wallClock);

        this.historyResync = history != null
                ? messages.window().resyncOn(lifecycleManager, history)
                : () -> {};
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RoomOptions options() {
        return options;
    }

    @Override
    public RoomStatus status() {
        return lifecycle.status();
    }

    @Override
    public Optional<ErrorInfo> error() {
        return lifecycle.error();
    }

    @Override
    public StatusSubscription onStatusChange(RoomStatusListener listener) {
        return lifecycle.onChange(listener);
    }

    @Override
    public StatusSubscription onDiscontinuity(DiscontinuityListener listener) {
        return lifecycleManager.onDiscontinuity(listener);
    }

    @Override
    public CompletableFuture<Void> attach() {
        return lifecycleManager.attach()
                .whenComplete((v, failure) -> reportFeatureFailures(failure, "attach",
                        ContributesToRoomLifecycle::attachmentErrorCode));
    }

    @Override
    public CompletableFuture<Void> detach() {
        return lifecycleManager.detach()
                .whenComplete((v, failure) -> reportFeatureFailures(failure, "detach",
                        ContributesToRoomLifecycle::detachmentErrorCode));
    }

    @Override
    public Messages messages() {
        return messages;
    }

    @Override
    public Typing typing() {
        return typing;
    }

    /**
     * Releases the room and everything it holds. Idempotent.
     */
    public CompletableFuture<Void> release() {
        return lifecycleManager.release().thenRun(this::disposeAll);
    }

    private void disposeAll() {
        historyResync.off();
        for (ContributesToRoomLifecycle feature : features) {
            try {
                feature.dispose();
            } catch (RuntimeException e) {
                sink.onError(new RoomErrorEvent(wallClock.now(), name,
                        "failed to dispose " + feature.featureName(), ErrorInfo.from(e), e));
            }
        }
        lifecycleManager.dispose();
        lifecycle.dispose();
        log.debug("Room {}: released and disposed", name);
    }

    private void reportFeatureFailures(Throwable failure, String operation,
                                       Function<ContributesToRoomLifecycle, ErrorCode> code)
    {
        if (failure == null) {
            return;
        }
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        ErrorInfo error = ErrorInfo.from(cause);
        if (MISUSE.stream().anyMatch(error::is)) {
            return;
        }
        for (ContributesToRoomLifecycle feature : features) {
            ErrorInfo featureError = new ErrorInfo(
                    feature.featureName() + " " + operation + " failed: " + error.message(),
                    code.apply(feature).code(), error.statusCode(), error);
            sink.onError(new RoomErrorEvent(wallClock.now(), name, featureError.message(), featureError, cause));
        }
    }
}
