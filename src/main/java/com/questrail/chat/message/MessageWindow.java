package com.questrail.chat.message;

import com.questrail.chat.api.EmitsDiscontinuities;
import com.questrail.chat.api.StatusSubscription;
import com.questrail.chat.api.Subscription;
import com.questrail.chat.core.ListenerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * MessageWindow
 * =============================================================================
 * Live, sorted, de-duplicated window over a room's messages.
 *
 * <h2>Snapshots</h2>
 * The window publishes an immutable {@link MessageSnapshot} to its listeners
 * after every effective change, and only then. A new subscriber immediately
 * receives the current snapshot.
 *
 * <h2>Inputs</h2>
 * <ul>
 *   <li>{@link #onMessageEvent(MessageEvent)}: creations are inserted in serial
 *       order, duplicates dropped. Updates and deletes are applied to the
 *       message held at that serial. One that arrives before its message is
 *       held back (newest version only, at most
 *       {@value #MAX_PENDING_MUTATIONS} messages) and applied when the message
 *       is created or backfilled.</li>
 *   <li>{@link #onReactionSummary(MessageReactionSummaryEvent)}: applied to the
 *       message held at the referenced serial.</li>
 *   <li>{@link #backfill(HistoryPage)}: merges history pages, keeping the
 *       newest version of each message.</li>
 * </ul>
 *
 * <h2>Resync</h2>
 * {@link #resyncOn(EmitsDiscontinuities, MessageHistory)} merges the latest
 * history into the window after each discontinuity rather than clearing it, so
 * messages received live while the history request is outstanding are kept.
 *
 * <h2>Threading</h2>
 * All mutators are synchronized; listeners are called while the window lock is
 * held and must not block.
 */
public final class MessageWindow
{
    private static final Logger log = LoggerFactory.getLogger(MessageWindow.class);

    public static final int DEFAULT_RESYNC_LIMIT = 100;
    public static final int MAX_PENDING_MUTATIONS = 100;

    private static final Comparator<Message> SERIAL_THEN_NEWEST_VERSION =
            Comparator.<Message, Serial>comparing(m -> Serial.parse(m.serial()))
                    .thenComparing(Message::version, Comparator.reverseOrder());

    private final ListenerRegistry<Consumer<MessageSnapshot>> listeners = new ListenerRegistry<>();
    private final List<Message> messages = new ArrayList<>();
    private final Map<String, MessageEvent> pendingMutations = new LinkedHashMap<>();
    private MessageSnapshot snapshot = MessageSnapshot.empty();

    public synchronized Subscription subscribe(Consumer<MessageSnapshot> listener) {
        Objects.requireNonNull(listener, "listener");
        listener.accept(snapshot);
        ListenerRegistry.Registration registration = listeners.add(listener);
        return registration::remove;
    }

    public synchronized MessageSnapshot snapshot() {
        return snapshot;
    }

    public synchronized void onMessageEvent(MessageEvent event) {
        Objects.requireNonNull(event, "event");
        if (event.type() == MessageEventType.CREATED) {
            insert(event.message());
            return;
        }
        int idx = indexOf(event.message().serial());
        if (idx < 0) {
            holdBack(event);
            return;
        }
        replaceIfChanged(idx, messages.get(idx).with(event));
    }

    public synchronized void onReactionSummary(MessageReactionSummaryEvent event) {
        Objects.requireNonNull(event, "event");
        int idx = indexOf(event.refSerial());
        if (idx < 0) {
            return;
        }
        replaceIfChanged(idx, messages.get(idx).with(event));
    }

    /**
     * Merges a page of history and every page after it.
     *
     * @return completes once the last page has been merged
     */
    public CompletableFuture<Void> backfill(HistoryPage page) {
        Objects.requireNonNull(page, "page");
        merge(page.items());
        if (!page.hasNext()) {
            return CompletableFuture.completedFuture(null);
        }
        return page.next().toCompletableFuture().thenCompose(this::backfill);
    }

    /**
     * Removes every message.
     */
    public synchronized void clear() {
        pendingMutations.clear();
        if (messages.isEmpty()) {
            return;
        }
        messages.clear();
        publish();
    }

    /**
     * Re-fetches history whenever {@code source} reports a discontinuity.
     *
     * @return subscription that stops the resync
     */
    public StatusSubscription resyncOn(EmitsDiscontinuities source, MessageHistory history) {
        return resyncOn(source, history, DEFAULT_RESYNC_LIMIT);
    }

    public StatusSubscription resyncOn(EmitsDiscontinuities source, MessageHistory history, int limit) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(history, "history");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return source.onDiscontinuity(error -> {
            log.debug("Discontinuity ({}), re-fetching last {} messages", error, limit);
            history.latest(limit)
                    .thenCompose(this::backfill)
                    .whenComplete((v, failure) -> {
                        if (failure != null) {
                            log.warn("Failed to re-fetch history after discontinuity", failure);
                        }
                    });
        });
    }

    // ---------------------------------------------------------------------

    private synchronized void merge(List<Message> items) {
        if (items.isEmpty()) {
            return;
        }
        List<Message> merged = new ArrayList<>(messages.size() + items.size());
        merged.addAll(messages);
        for (Message item : items) {
            merged.add(withPendingMutation(item));
        }
        merged.sort(SERIAL_THEN_NEWEST_VERSION);

        List<Message> deduplicated = new ArrayList<>(merged.size());
        for (Message m : merged) {
            if (deduplicated.isEmpty() || !deduplicated.get(deduplicated.size() - 1).isSameAs(m)) {
                deduplicated.add(m);
            }
        }

        if (deduplicated.equals(messages)) {
            return;
        }
        messages.clear();
        messages.addAll(deduplicated);
        publish();
    }

    private void insert(Message created) {
        if (indexOf(created.serial()) >= 0) {
            return;
        }
        Message message = withPendingMutation(created);
        int position = messages.size();
        while (position > 0 && message.before(messages.get(position - 1))) {
            position--;
        }
        messages.add(position, message);
        publish();
    }

    private void holdBack(MessageEvent event) {
        String serial = event.message().serial();
        MessageEvent held = pendingMutations.get(serial);
        if (held != null && held.message().version().compareTo(event.message().version()) >= 0) {
            return;
        }
        log.trace("Holding back {} for message {} not yet in the window", event.type(), serial);
        pendingMutations.remove(serial);
        pendingMutations.put(serial, event);
        if (pendingMutations.size() > MAX_PENDING_MUTATIONS) {
            Iterator<String> oldest = pendingMutations.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
    }

    private Message withPendingMutation(Message message) {
        MessageEvent held = pendingMutations.remove(message.serial());
        return held == null ? message : message.with(held);
    }

    private void replaceIfChanged(int idx, Message updated) {
        if (updated == messages.get(idx)) {
            return;
        }
        messages.set(idx, updated);
        publish();
    }

    private int indexOf(String serial) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).serial().equals(serial)) {
                return i;
            }
        }
        return -1;
    }

    private void publish() {
        snapshot = new MessageSnapshot(messages);
        listeners.emit(snapshot, Consumer::accept,
                e -> log.error("Message window listener failed", e));
    }
}
