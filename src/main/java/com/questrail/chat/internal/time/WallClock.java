package com.questrail.chat.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly for observability timestamps.
 * <p>
 * This clock may jump. It MUST NOT drive retry or timer deadlines.
 */
public interface WallClock
{
    Instant now();
}
