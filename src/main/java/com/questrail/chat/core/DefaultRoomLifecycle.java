package com.questrail.chat.core;

import com.questrail.chat.api.ErrorCode;
import com.questrail.chat.api.ErrorInfo;
import com.questrail.chat.api.RoomLifecycle;
import com.questrail.chat.api.RoomStatus;
import com.questrail.chat.api.RoomStatusChange;
import com.questrail.chat.api.RoomStatusListener;
import com.questrail.chat.api.StatusSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * DefaultRoomLifecycle
 * -----------------------------------------------------------------------------
 * The room status container: the only writable source of truth for "what state
 * is this room in".
 *
 * <h2>What this class does</h2>
 * <ul>
 *   <li>Holds the current {@link RoomStatus} and its error as one immutable pair</li>
 *   <li>Notifies listeners of every {@link #setStatus(RoomStatus, ErrorInfo)}</li>
 *   <li>Upholds the error invariant (see below)</li>
 * </ul>
 *
 * <h2>What this class does NOT do</h2>
 * It does not decide transitions. Only the {@link RoomLifecycleManager} calls
 * {@link #setStatus(RoomStatus, ErrorInfo)}; everything else sees the
 * read-only {@link RoomLifecycle} view.
 *
 * <h2>Error invariant</h2>
 * <blockquote>
 *     {@link #error()} is present if and only if the status is
 *     {@link RoomStatus#SUSPENDED} or {@link RoomStatus#FAILED}.
 * </blockquote>
 * An error supplied with any other status is passed on in the emitted
 * {@link RoomStatusChange} but not retained. Entering an error status without
 * an error retains a synthesised one.
 *
 * <h2>Threading model</h2>
 * Writes happen on the room's event loop. Reads may come from any thread and
 * always observe a consistent status/error pair.
 */
public final class DefaultRoomLifecycle implements RoomLifecycle
{
    private static final Logger log = LoggerFactory.getLogger(DefaultRoomLifecycle.class);

    private final String roomName;
    private final ListenerRegistry<RoomStatusListener> listeners = new ListenerRegistry<>();

    private volatile Snapshot current = new Snapshot(RoomStatus.INITIALIZED, null);

    public DefaultRoomLifecycle(String roomName) {
        this.roomName = Objects.requireNonNull(roomName, "roomName");
    }

    @Override
    public RoomStatus status() {
        return current.status();
    }

    @Override
    public Optional<ErrorInfo> error() {
        return Optional.ofNullable(current.error());
    }

    @Override
    public StatusSubscription onChange(RoomStatusListener listener) {
        ListenerRegistry.Registration registration = listeners.add(listener);
        return registration::remove;
    }

    /**
     * Sets the status and notifies listeners.
     *
     * @param status the new status
     * @param error  the reason, may be {@code null}
     * @return the change that was emitted
     */
    public RoomStatusChange setStatus(RoomStatus status, ErrorInfo error) {
        Objects.requireNonNull(status, "status");

        Snapshot previous = current;
        ErrorInfo retained = retainedError(status, error);
        current = new Snapshot(status, retained);

        RoomStatusChange change = new RoomStatusChange(status, previous.status(), error != null ? error : retained);
        log.debug("Room {}: status {} -> {}", roomName, previous.status(), status);

        listeners.emit(change, RoomStatusListener::onStatusChange,
                e -> log.error("Room {}: status listener failed", roomName, e));
        return change;
    }

    public RoomStatusChange setStatus(RoomStatus status) {
        return setStatus(status, null);
    }

    /**
     * Removes all status listeners.
     */
    public void dispose() {
        listeners.clear();
    }

    public boolean hasListeners() {
        return !listeners.isEmpty();
    }

    private static ErrorInfo retainedError(RoomStatus status, ErrorInfo error) {
        if (!status.carriesError()) {
            return null;
        }
        if (error != null) {
            return error;
        }
        return status == RoomStatus.FAILED
                ? ErrorInfo.of(ErrorCode.ROOM_IN_FAILED_STATE, 500, "room entered failed state without a reported reason")
                : ErrorInfo.of(ErrorCode.DISCONNECTED, 503, "room suspended without a reported reason");
    }

    private record Snapshot(RoomStatus status, ErrorInfo error) {}
}
