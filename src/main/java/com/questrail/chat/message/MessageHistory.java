package com.questrail.chat.message;

import java.util.concurrent.CompletionStage;

/**
 * Port for fetching past messages of a room, newest first.
 * <p>
 * The library ships no implementation; applications supply one backed by the
 * service's history API.
 */
@FunctionalInterface
public interface MessageHistory
{
    /**
     * @param limit maximum number of messages in the first page
     */
    CompletionStage<HistoryPage> latest(int limit);
}
