package com.questrail.chat.runtime;

import com.questrail.chat.api.ChatException;
import com.questrail.chat.api.ErrorCode;
import com.questrail.chat.api.Room;
import com.questrail.chat.api.Rooms;
import com.questrail.chat.config.RoomOptions;
import com.questrail.chat.core.DefaultRoom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BiFunction;

/**
 * Room registry of a {@link ChatRuntime}.
 * <p>
 * A release in progress for a name blocks creation of a new room under that
 * name until it finishes, so the new room never shares the old room's channel.
 * A room whose release failed is registered again.
 */
final class DefaultRooms implements Rooms
{
    private static final Logger log = LoggerFactory.getLogger(DefaultRooms.class);

    private final BiFunction<String, RoomOptions, DefaultRoom> factory;

    private final Map<String, DefaultRoom> rooms = new HashMap<>();
    private final Map<String, CompletableFuture<Void>> releasing = new HashMap<>();

    DefaultRooms(BiFunction<String, RoomOptions, DefaultRoom> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public synchronized CompletableFuture<Room> get(String name, RoomOptions options) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(options, "options");

        DefaultRoom existing = rooms.get(name);
        if (existing != null) {
            if (!existing.options().equals(options)) {
                return CompletableFuture.failedFuture(ChatException.of(ErrorCode.BAD_REQUEST, 400,
                        "room already exists with different options"));
            }
            return CompletableFuture.completedFuture(existing);
        }

        CompletableFuture<Void> pendingRelease = releasing.get(name);
        if (pendingRelease != null) {
            log.debug("Room {}: waiting for release before re-creating", name);
            return pendingRelease
                    .handle((v, failure) -> null)
                    .thenCompose(ignored -> get(name, options));
        }

        DefaultRoom room = factory.apply(name, options);
        rooms.put(name, room);
        return CompletableFuture.completedFuture(room);
    }

    /**
     * Releases the room and forgets it. If the release fails the room is
     * registered again, so a later {@code release(name)} retries it and
     * {@code get(name)} keeps returning it.
     */
    @Override
    public synchronized CompletableFuture<Void> release(String name) {
        CompletableFuture<Void> pendingRelease = releasing.get(name);
        if (pendingRelease != null) {
            return pendingRelease;
        }
        DefaultRoom room = rooms.remove(name);
        if (room == null) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> tracked = new CompletableFuture<>();
        releasing.put(name, tracked);
        room.release().whenComplete((v, failure) -> {
            synchronized (this) {
                releasing.remove(name, tracked);
                if (failure != null) {
                    rooms.putIfAbsent(name, room);
                }
            }
            if (failure == null) {
                tracked.complete(null);
            } else {
                Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                        ? failure.getCause()
                        : failure;
                log.error("Room {}: release failed; room kept for retry", name, cause);
                tracked.completeExceptionally(cause);
            }
        });
        return tracked;
    }

    /**
     * Releases every room.
     */
    synchronized CompletableFuture<Void> releaseAll() {
        List<CompletableFuture<Void>> all = new ArrayList<>();
        for (String name : new ArrayList<>(rooms.keySet())) {
            all.add(release(name));
        }
        all.addAll(releasing.values());
        return CompletableFuture.allOf(all.toArray(new CompletableFuture<?>[0]));
    }

    synchronized int size() {
        return rooms.size();
    }
}
