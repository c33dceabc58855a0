package com.questrail.chat.message;

import java.time.Instant;
import java.util.Objects;

/**
 * The reaction aggregates of a message changed.
 * <p>
 * Summaries replace earlier summaries wholesale; several reaction changes may
 * be rolled into one summary.
 *
 * @param refSerial serial of the message the summary is for
 * @param timestamp when the summary was produced, if known
 * @param reactions the new aggregates
 */
public record MessageReactionSummaryEvent(String refSerial, Instant timestamp, MessageReactions reactions)
{
    public MessageReactionSummaryEvent {
        Objects.requireNonNull(refSerial, "refSerial");
        Objects.requireNonNull(reactions, "reactions");
    }
}
