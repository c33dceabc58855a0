package com.questrail.chat.core;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * ListenerRegistry
 * -----------------------------------------------------------------------------
 * Many-reader, one-producer listener list.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Registration returns a {@link Registration} whose {@code remove()} is
 *       idempotent. Registering the same listener twice yields two independent
 *       registrations.</li>
 *   <li>{@link #emit(Object, BiConsumer, Consumer)} delivers to a snapshot of the
 *       listeners registered when emission started.</li>
 *   <li>A listener that throws does not prevent delivery to the others; the
 *       failure is handed to the supplied error handler.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Backed by a {@link CopyOnWriteArrayList}; safe to register and remove from
 * any thread while the producer emits.
 */
public final class ListenerRegistry<L>
{
    private final List<Entry<L>> entries = new CopyOnWriteArrayList<>();

    public Registration add(L listener) {
        Entry<L> entry = new Entry<>(Objects.requireNonNull(listener, "listener"));
        entries.add(entry);
        return () -> {
            if (entry.removed.compareAndSet(false, true)) {
                entries.remove(entry);
            }
        };
    }

    /**
     * Delivers an event to every listener.
     *
     * @param delivery      invokes one listener with the event
     * @param onFailure     receives listener failures
     */
    public <E> void emit(E event, BiConsumer<L, E> delivery, Consumer<RuntimeException> onFailure) {
        for (Entry<L> entry : entries) {
            if (entry.removed.get()) {
                continue;
            }
            try {
                delivery.accept(entry.listener, event);
            } catch (RuntimeException e) {
                onFailure.accept(e);
            }
        }
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Removes every listener.
     */
    public void clear() {
        for (Entry<L> entry : entries) {
            entry.removed.set(true);
        }
        entries.clear();
    }

    /**
     * Handle for one registration.
     */
    @FunctionalInterface
    public interface Registration {
        void remove();
    }

    private static final class Entry<L> {
        private final L listener;
        private final AtomicBoolean removed = new AtomicBoolean(false);

        private Entry(L listener) {
            this.listener = listener;
        }
    }
}
