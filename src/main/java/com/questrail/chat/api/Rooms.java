package com.questrail.chat.api;

import com.questrail.chat.config.RoomOptions;

import java.util.concurrent.CompletableFuture;

/**
 * Registry of the rooms a client has open.
 * <p>
 * There is at most one live room per name. Asking again for a name with the
 * same options returns the same room; asking with different options fails
 * with {@link ErrorCode#BAD_REQUEST}.
 */
public interface Rooms
{
    /**
     * Returns the room with the given name, creating it if needed. If a room of
     * that name is being released, the new room is created once the release
     * has finished.
     */
    CompletableFuture<Room> get(String name, RoomOptions options);

    default CompletableFuture<Room> get(String name) {
        return get(name, RoomOptions.defaults());
    }

    /**
     * Releases the named room and forgets it. A no-op for unknown names.
     */
    CompletableFuture<Void> release(String name);
}
