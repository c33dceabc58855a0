package com.questrail.chat.typing;

import com.questrail.chat.api.ChatException;
import com.questrail.chat.api.ErrorCode;
import com.questrail.chat.api.ErrorInfo;
import com.questrail.chat.api.Subscription;
import com.questrail.chat.channel.ChannelHandle;
import com.questrail.chat.channel.InboundMessage;
import com.questrail.chat.channel.InboundMessageListener;
import com.questrail.chat.channel.OutboundMessage;
import com.questrail.chat.config.TypingOptions;
import com.questrail.chat.core.ContributesToRoomLifecycle;
import com.questrail.chat.core.ListenerRegistry;
import com.questrail.chat.internal.time.Cancellable;
import com.questrail.chat.internal.time.MonotonicClock;
import com.questrail.chat.internal.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * DefaultTyping
 * =============================================================================
 * Typing feature of a room.
 *
 * <h2>Outbound</h2>
 * {@link #keystroke()} and {@link #stop()} are serialised through a
 * {@link LatestWinsMutex}: a call queued behind a running one is cancelled by
 * any later call, so only the most recent intent is published.
 * <ul>
 *   <li>keystroke publishes {@code typing.started} unless the heartbeat timer
 *       is running, then starts it</li>
 *   <li>stop publishes {@code typing.stopped} only while the heartbeat timer is
 *       running, then clears it</li>
 * </ul>
 *
 * <h2>Inbound</h2>
 * Each remote {@code typing.started} (re)arms an inactivity timer of
 * {@link TypingOptions#remoteTypingTimeout()} for that client. Expiry or a
 * {@code typing.stopped} removes the client. Listeners hear about additions and
 * removals, not about heartbeats.
 *
 * <h2>Threading</h2>
 * Timer and set state is confined to the room event loop.
 */
public final class DefaultTyping implements Typing, ContributesToRoomLifecycle
{
    private static final Logger log = LoggerFactory.getLogger(DefaultTyping.class);

    private final String roomName;
    private final ChannelHandle channel;
    private final TypingOptions options;
    private final Executor executor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;

    private final LatestWinsMutex mutex = new LatestWinsMutex();
    private final ListenerRegistry<TypingListener> listeners = new ListenerRegistry<>();
    private final InboundMessageListener inboundListener;
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    // Event-loop confined
    private Timer heartbeat;
    private final Map<String, Timer> typingClients = new LinkedHashMap<>();

    private volatile Set<String> current = Set.of();

    public DefaultTyping(String roomName,
                         ChannelHandle channel,
                         TypingOptions options,
                         Executor executor,
                         MonotonicScheduler scheduler,
                         MonotonicClock clock)
    {
        this.roomName = Objects.requireNonNull(roomName, "roomName");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.options = Objects.requireNonNull(options, "options");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.inboundListener = inbound -> this.executor.execute(() -> onInbound(inbound));
        for (TypingEventType type : TypingEventType.values()) {
            channel.subscribe(type.wireName(), inboundListener);
        }
    }

    // ---------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> keystroke() {
        return serialised("keystroke", () -> {
            if (heartbeat != null) {
                log.trace("Room {}: already typing, keystroke is a no-op", roomName);
                return CompletableFuture.completedFuture(null);
            }
            return publish(TypingEventType.STARTED).thenRunAsync(this::startHeartbeat, executor);
        });
    }

    @Override
    public CompletableFuture<Void> stop() {
        return serialised("stop", () -> {
            if (heartbeat == null) {
                log.trace("Room {}: not typing, stop is a no-op", roomName);
                return CompletableFuture.completedFuture(null);
            }
            return publish(TypingEventType.STOPPED).thenRunAsync(this::clearHeartbeat, executor);
        });
    }

    /**
     * Runs {@code body} on the event loop while holding the mutex.
     */
    private CompletableFuture<Void> serialised(String operation,
                                               Supplier<CompletionStage<Void>> body)
    {
        CompletableFuture<Void> result = new CompletableFuture<>();
        if (disposed.get()) {
            result.completeExceptionally(ChatException.of(ErrorCode.ROOM_IS_RELEASED, 400,
                    "cannot " + operation + ", room is released"));
            return result;
        }

        mutex.acquire().whenCompleteAsync((acquired, failure) -> {
            if (failure != null) {
                result.completeExceptionally(new ChatException(
                        ErrorInfo.of(ErrorCode.OPERATION_SERIALIZATION_FAILED, 500,
                                "unable to " + operation + "; failed to enforce sequential execution"),
                        failure));
                return;
            }
            if (!acquired) {
                log.debug("Room {}: {} cancelled by a later typing call", roomName, operation);
                result.complete(null);
                return;
            }

            CompletionStage<Void> stage;
            try {
                stage = body.get();
            } catch (RuntimeException e) {
                stage = CompletableFuture.failedFuture(e);
            }
            stage.whenCompleteAsync((v, err) -> {
                mutex.release();
                if (err != null) {
                    result.completeExceptionally(unwrap(err));
                } else {
                    result.complete(null);
                }
            }, executor);
        }, executor);
        return result;
    }

    private CompletionStage<Void> publish(TypingEventType type) {
        return channel.publish(OutboundMessage.ephemeral(type.wireName()));
    }

    private void startHeartbeat() {
        Timer timer = new Timer();
        heartbeat = timer;
        timer.handle = scheduler.scheduleAfter(options.heartbeatThrottle(), clock,
                () -> executor.execute(() -> {
                    if (heartbeat == timer) {
                        log.trace("Room {}: heartbeat throttle expired", roomName);
                        heartbeat = null;
                    }
                }));
    }

    private void clearHeartbeat() {
        if (heartbeat != null) {
            heartbeat.cancel();
            heartbeat = null;
        }
    }

    // ---------------------------------------------------------------------
    // Inbound
    // ---------------------------------------------------------------------

    private void onInbound(InboundMessage inbound) {
        if (disposed.get()) {
            return;
        }
        if (inbound.clientId() == null) {
            log.warn("Room {}: ignoring typing event without clientId", roomName);
            return;
        }
        TypingEventType.fromWire(inbound.name()).ifPresent(type -> {
            if (type == TypingEventType.STARTED) {
                onRemoteStarted(inbound.clientId());
            } else {
                onRemoteStopped(inbound.clientId());
            }
        });
    }

    private void onRemoteStarted(String clientId) {
        Timer timer = new Timer();
        Timer previous = typingClients.put(clientId, timer);
        timer.handle = scheduler.scheduleAfter(options.remoteTypingTimeout(), clock,
                () -> executor.execute(() -> onRemoteTimeout(clientId, timer)));

        if (previous != null) {
            previous.cancel();
            return;
        }
        log.debug("Room {}: {} started typing", roomName, clientId);
        changed(clientId, TypingEventType.STARTED);
    }

    private void onRemoteStopped(String clientId) {
        Timer timer = typingClients.remove(clientId);
        if (timer == null) {
            return;
        }
        timer.cancel();
        log.debug("Room {}: {} stopped typing", roomName, clientId);
        changed(clientId, TypingEventType.STOPPED);
    }

    private void onRemoteTimeout(String clientId, Timer timer) {
        if (typingClients.get(clientId) != timer) {
            return;
        }
        typingClients.remove(clientId);
        log.debug("Room {}: {} typing timed out", roomName, clientId);
        changed(clientId, TypingEventType.STOPPED);
    }

    private void changed(String clientId, TypingEventType type) {
        current = Set.copyOf(typingClients.keySet());
        TypingSetEvent event = new TypingSetEvent(current, new TypingSetEvent.Change(clientId, type));
        listeners.emit(event, TypingListener::onTypingChanged,
                e -> log.error("Room {}: typing listener failed", roomName, e));
    }

    // ---------------------------------------------------------------------
    // Queries, subscriptions, lifecycle
    // ---------------------------------------------------------------------

    @Override
    public Set<String> current() {
        return current;
    }

    @Override
    public Subscription subscribe(TypingListener listener) {
        ListenerRegistry.Registration registration = listeners.add(listener);
        return registration::remove;
    }

    @Override
    public String featureName() {
        return "typing";
    }

    @Override
    public ErrorCode attachmentErrorCode() {
        return ErrorCode.TYPING_ATTACHMENT_FAILED;
    }

    @Override
    public ErrorCode detachmentErrorCode() {
        return ErrorCode.TYPING_DETACHMENT_FAILED;
    }

    /**
     * Rejects further keystrokes, then clears timers and listeners once any
     * running typing call has finished.
     */
    @Override
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        mutex.acquire().whenCompleteAsync((acquired, failure) -> {
            clearHeartbeat();
            typingClients.values().forEach(Timer::cancel);
            typingClients.clear();
            current = Set.of();
            channel.unsubscribe(inboundListener);
            listeners.clear();
            if (Boolean.TRUE.equals(acquired)) {
                mutex.release();
            }
            log.debug("Room {}: typing disposed", roomName);
        }, executor);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable t = failure;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Identity of one armed timer; stale expiries compare unequal.
     */
    private static final class Timer {
        private Cancellable handle;

        void cancel() {
            if (handle != null) {
                handle.cancel();
            }
        }
    }
}
