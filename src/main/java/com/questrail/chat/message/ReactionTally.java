package com.questrail.chat.message;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate for one reaction on one message.
 *
 * @param total     number of reactions counted
 * @param clientIds clients who reacted; may be a prefix of the full list
 * @param clipped   whether {@code clientIds} was cut short by the service
 */
public record ReactionTally(int total, List<String> clientIds, boolean clipped)
{
    public ReactionTally {
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0");
        }
        clientIds = List.copyOf(Objects.requireNonNull(clientIds, "clientIds"));
    }
}
