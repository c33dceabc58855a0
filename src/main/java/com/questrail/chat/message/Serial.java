package com.questrail.chat.message;

import com.questrail.chat.api.ChatException;

import java.util.Objects;

/**
 * Serial
 * -----------------------------------------------------------------------------
 * A parsed, globally comparable identifier of the form
 * {@code seriesId@timestamp-counter[:index]}.
 *
 * <h2>Ordering</h2>
 * Serials are ordered by timestamp, then counter, then series id
 * (lexicographically), then index. The index only takes part when both
 * serials carry one.
 *
 * <p>Because of the index rule, {@link #compareTo(Serial)} may return zero for
 * two serials that are not {@link #equals(Object) equal}.</p>
 *
 * <h2>Malformed input</h2>
 * {@link #parse(String)} and every comparison that takes a string fail with a
 * {@link ChatException} carrying
 * {@link com.questrail.chat.api.ErrorCode#INVALID_ARGUMENT}.
 */
public final class Serial implements Comparable<Serial>
{
    private final String seriesId;
    private final long timestamp;
    private final long counter;
    private final Integer index;

    private Serial(String seriesId, long timestamp, long counter, Integer index) {
        this.seriesId = seriesId;
        this.timestamp = timestamp;
        this.counter = counter;
        this.index = index;
    }

    public static Serial parse(String serial) {
        if (serial == null) {
            throw ChatException.invalidArgument("invalid serial: null");
        }

        int at = serial.indexOf('@');
        if (at <= 0 || at == serial.length() - 1) {
            throw invalid(serial);
        }
        String seriesId = serial.substring(0, at);
        String rest = serial.substring(at + 1);

        int dash = rest.indexOf('-');
        if (dash <= 0 || dash == rest.length() - 1) {
            throw invalid(serial);
        }
        String timestampPart = rest.substring(0, dash);
        String counterAndIndex = rest.substring(dash + 1);

        String counterPart = counterAndIndex;
        String indexPart = null;
        int colon = counterAndIndex.indexOf(':');
        if (colon >= 0) {
            counterPart = counterAndIndex.substring(0, colon);
            indexPart = counterAndIndex.substring(colon + 1);
            if (indexPart.isEmpty()) {
                throw invalid(serial);
            }
        }
        if (counterPart.isEmpty()) {
            throw invalid(serial);
        }

        try {
            long timestamp = Long.parseLong(timestampPart);
            long counter = Long.parseLong(counterPart);
            Integer index = indexPart != null ? Integer.valueOf(indexPart) : null;
            return new Serial(seriesId, timestamp, counter, index);
        } catch (NumberFormatException e) {
            throw invalid(serial);
        }
    }

    private static ChatException invalid(String serial) {
        return ChatException.invalidArgument("invalid serial: " + serial);
    }

    public String seriesId() {
        return seriesId;
    }

    /**
     * @return milliseconds since the epoch at which the serial was issued
     */
    public long timestamp() {
        return timestamp;
    }

    public long counter() {
        return counter;
    }

    public Integer index() {
        return index;
    }

    @Override
    public int compareTo(Serial other) {
        Objects.requireNonNull(other, "other");

        int c = Long.compare(timestamp, other.timestamp);
        if (c != 0) {
            return c;
        }
        c = Long.compare(counter, other.counter);
        if (c != 0) {
            return c;
        }
        c = seriesId.compareTo(other.seriesId);
        if (c != 0) {
            return c;
        }
        if (index != null && other.index != null) {
            return Integer.compare(index, other.index);
        }
        return 0;
    }

    public boolean before(Serial other) {
        return compareTo(other) < 0;
    }

    public boolean before(String other) {
        return before(parse(other));
    }

    public boolean after(Serial other) {
        return compareTo(other) > 0;
    }

    public boolean after(String other) {
        return after(parse(other));
    }

    /**
     * @return {@code true} if the two serials hold the same position in the global order
     */
    public boolean equal(Serial other) {
        return compareTo(other) == 0;
    }

    public boolean equal(String other) {
        return equal(parse(other));
    }

    /**
     * Compares two serial strings.
     *
     * @throws ChatException if either is malformed
     */
    public static int compare(String a, String b) {
        return parse(a).compareTo(parse(b));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Serial)) {
            return false;
        }
        Serial other = (Serial) o;
        return timestamp == other.timestamp
                && counter == other.counter
                && seriesId.equals(other.seriesId)
                && Objects.equals(index, other.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesId, timestamp, counter, index);
    }

    @Override
    public String toString() {
        return seriesId + "@" + timestamp + "-" + counter + (index != null ? ":" + index : "");
    }
}
