package com.questrail.chat.typing;

import java.util.concurrent.CompletableFuture;

/**
 * LatestWinsMutex
 * -----------------------------------------------------------------------------
 * A mutex with a single waiting slot.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>{@link #acquire()} completes with {@code true} once the caller holds
 *       the mutex.</li>
 *   <li>At most one caller waits. A new {@code acquire()} cancels the waiter
 *       it replaces, whose future completes with {@code false}; that caller
 *       never holds the mutex.</li>
 *   <li>{@link #release()} hands the mutex directly to the waiter, if any.</li>
 * </ul>
 *
 * <p>Futures are completed outside the internal lock, so continuations may
 * call back into the mutex.</p>
 */
public final class LatestWinsMutex
{
    private boolean held;
    private CompletableFuture<Boolean> waiter;

    public CompletableFuture<Boolean> acquire() {
        CompletableFuture<Boolean> cancelled;
        CompletableFuture<Boolean> result;

        synchronized (this) {
            cancelled = waiter;
            waiter = null;
            if (!held) {
                held = true;
                result = CompletableFuture.completedFuture(true);
            } else {
                result = new CompletableFuture<>();
                waiter = result;
            }
        }

        if (cancelled != null) {
            cancelled.complete(false);
        }
        return result;
    }

    /**
     * Releases the mutex, handing it to the waiting caller if there is one.
     *
     * @throws IllegalStateException if the mutex is not held
     */
    public void release() {
        CompletableFuture<Boolean> next;
        synchronized (this) {
            if (!held) {
                throw new IllegalStateException("mutex is not held");
            }
            next = waiter;
            waiter = null;
            if (next == null) {
                held = false;
            }
        }

        if (next != null) {
            next.complete(true);
        }
    }

    public synchronized boolean isLocked() {
        return held;
    }

    public synchronized boolean hasWaiter() {
        return waiter != null;
    }
}
