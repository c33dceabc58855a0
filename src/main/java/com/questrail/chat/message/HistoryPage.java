package com.questrail.chat.message;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * One page of message history.
 */
public interface HistoryPage
{
    List<Message> items();

    boolean hasNext();

    /**
     * Fetches the following page. Only valid when {@link #hasNext()} is {@code true}.
     */
    CompletionStage<HistoryPage> next();

    static HistoryPage of(List<Message> items) {
        List<Message> copy = List.copyOf(items);
        return new HistoryPage() {
            @Override
            public List<Message> items() {
                return copy;
            }

            @Override
            public boolean hasNext() {
                return false;
            }

            @Override
            public CompletionStage<HistoryPage> next() {
                throw new IllegalStateException("no next page");
            }
        };
    }
}
