package com.questrail.chat.message;

import java.util.Map;

/**
 * Reaction aggregates of a message, grouped by counting rule.
 *
 * @param unique   one reaction per client per message
 * @param distinct one of each reaction per client
 * @param multiple any number of each reaction per client
 */
public record MessageReactions(
        Map<String, ReactionTally> unique,
        Map<String, ReactionTally> distinct,
        Map<String, ReactionTally> multiple
) {
    private static final MessageReactions EMPTY = new MessageReactions(Map.of(), Map.of(), Map.of());

    public MessageReactions {
        unique = unique == null ? Map.of() : Map.copyOf(unique);
        distinct = distinct == null ? Map.of() : Map.copyOf(distinct);
        multiple = multiple == null ? Map.of() : Map.copyOf(multiple);
    }

    public static MessageReactions empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return unique.isEmpty() && distinct.isEmpty() && multiple.isEmpty();
    }
}
