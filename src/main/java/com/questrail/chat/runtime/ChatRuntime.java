package com.questrail.chat.runtime;

import com.questrail.chat.api.Rooms;
import com.questrail.chat.channel.ChannelProvider;
import com.questrail.chat.core.DefaultRoom;
import com.questrail.chat.internal.time.MonotonicClock;
import com.questrail.chat.internal.time.MonotonicScheduler;
import com.questrail.chat.internal.time.ScheduledExecutorScheduler;
import com.questrail.chat.internal.time.SystemMonotonicClock;
import com.questrail.chat.internal.time.SystemWallClock;
import com.questrail.chat.internal.time.WallClock;
import com.questrail.chat.message.MessageHistory;
import com.questrail.chat.observability.NullObservabilitySink;
import com.questrail.chat.observability.RoomObservabilitySink;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * ChatRuntime
 * =============================================================================
 * Composition root and lifecycle owner for chat rooms.
 *
 * <h2>Event loop</h2>
 * The runtime owns one Netty {@link DefaultEventExecutor}. Every room state
 * transition, channel callback and timer of every room runs on it, which is
 * what lets the lifecycle manager do without locks. The same executor backs
 * the {@link MonotonicScheduler} used for release backoff and typing timers.
 *
 * <h2>Shutdown</h2>
 * {@link #close()} releases every room, waiting up to the configured close
 * timeout, then shuts the event loop down. It must not be called from the
 * event loop itself.
 */
public final class ChatRuntime implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(ChatRuntime.class);

    private final DefaultEventExecutor eventLoop;
    private final DefaultRooms rooms;
    private final Duration closeTimeout;

    private ChatRuntime(DefaultEventExecutor eventLoop, DefaultRooms rooms, Duration closeTimeout) {
        this.eventLoop = eventLoop;
        this.rooms = rooms;
        this.closeTimeout = closeTimeout;
    }

    public Rooms rooms() {
        return rooms;
    }

    /**
     * @return {@code true} if the caller is running on the room event loop
     */
    public boolean inEventLoop() {
        return eventLoop.inEventLoop();
    }

    @Override
    public void close() {
        if (eventLoop.inEventLoop()) {
            throw new IllegalStateException("close() must not be called from the room event loop");
        }
        try {
            rooms.releaseAll().get(closeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while releasing rooms");
        } catch (ExecutionException e) {
            log.error("Failed to release rooms on close", e.getCause());
        } catch (TimeoutException e) {
            log.warn("Rooms not released within {}; shutting down anyway", closeTimeout);
        }
        eventLoop.shutdownGracefully(0, closeTimeout.toMillis(), TimeUnit.MILLISECONDS).syncUninterruptibly();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ChannelProvider channelProvider;
        private RoomObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private Function<String, MessageHistory> historyProvider = name -> null;
        private Duration closeTimeout = Duration.ofSeconds(5);
        private String threadName = "chat-rooms";

        public Builder withChannelProvider(ChannelProvider provider) {
            this.channelProvider = provider;
            return this;
        }

        public Builder withObservabilitySink(RoomObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Supplies the history source used to re-fill a room's message window
         * after a discontinuity. Returning {@code null} disables the resync.
         */
        public Builder withMessageHistory(Function<String, MessageHistory> historyProvider) {
            this.historyProvider = historyProvider;
            return this;
        }

        public Builder withCloseTimeout(Duration timeout) {
            this.closeTimeout = timeout;
            return this;
        }

        public Builder withThreadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        public ChatRuntime build() {
            Objects.requireNonNull(channelProvider, "channelProvider");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(historyProvider, "historyProvider");
            Objects.requireNonNull(closeTimeout, "closeTimeout");

            DefaultEventExecutor eventLoop = new DefaultEventExecutor(new DefaultThreadFactory(threadName, true));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(eventLoop, clock);

            ChannelProvider provider = channelProvider;
            RoomObservabilitySink sink = observabilitySink;
            MonotonicClock monotonicClock = clock;
            WallClock wall = wallClock;
            Function<String, MessageHistory> histories = historyProvider;

            DefaultRooms rooms = new DefaultRooms((name, options) -> new DefaultRoom(
                    name,
                    options,
                    provider,
                    eventLoop,
                    scheduler,
                    monotonicClock,
                    sink,
                    wall,
                    histories.apply(name)));

            return new ChatRuntime(eventLoop, rooms, closeTimeout);
        }
    }
}
