package com.questrail.chat.config;

import java.time.Duration;
import java.util.Objects;

/**
 * ReleaseRetryPolicy
 * -----------------------------------------------------------------------------
 * Spacing between channel detach attempts while a room is releasing.
 *
 * <p>This is deliberately <em>operational only</em>. The lifecycle manager
 * decides <em>whether</em> to retry (always, until the detach succeeds or the
 * channel fails); this policy only decides <em>when</em>. There is no attempt
 * limit: a release that gives up would leak the channel.</p>
 *
 * <h2>Backoff</h2>
 * <p>Attempt {@code n} (1-based) waits
 * {@code min(maxDelay, initialDelay * multiplier^(n-1))}.</p>
 */
public record ReleaseRetryPolicy(
        Duration initialDelay,
        Duration maxDelay,
        double multiplier
) {
    public ReleaseRetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");

        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be non-negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier)) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * Defaults: 250ms, doubling, capped at 5s.
     */
    public static ReleaseRetryPolicy defaults() {
        return new ReleaseRetryPolicy(Duration.ofMillis(250), Duration.ofSeconds(5), 2.0);
    }

    /**
     * A fixed interval with no backoff.
     */
    public static ReleaseRetryPolicy fixed(Duration interval) {
        return new ReleaseRetryPolicy(interval, interval, 1.0);
    }

    /**
     * Returns the delay to wait after the given failed attempt.
     *
     * @param attempt 1-based number of the attempt that just failed
     */
    public Duration delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double nanos = initialDelay.toNanos() * Math.pow(multiplier, attempt - 1);
        if (nanos >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos((long) nanos);
    }
}
