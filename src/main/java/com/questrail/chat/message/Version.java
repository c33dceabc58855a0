package com.questrail.chat.message;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The version of a message: a serial plus details of the operation that
 * produced it.
 * <p>
 * For a freshly created message the version serial equals the message serial
 * and the operation details are absent. A higher version of the same message
 * always wins.
 *
 * @param serial      the version serial
 * @param clientId    who updated or deleted the message, if anyone
 * @param description why, if given
 * @param metadata    operation metadata, never {@code null}
 * @param timestamp   when the version was produced, if known
 */
public record Version(
        String serial,
        String clientId,
        String description,
        Map<String, String> metadata,
        Instant timestamp
) implements Comparable<Version>
{
    public Version {
        Objects.requireNonNull(serial, "serial");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * The version of a message as created.
     */
    public static Version initial(String serial, Instant timestamp) {
        return new Version(serial, null, null, Map.of(), timestamp);
    }

    public Serial parsedSerial() {
        return Serial.parse(serial);
    }

    public Optional<String> actor() {
        return Optional.ofNullable(clientId);
    }

    /**
     * Orders versions by serial.
     *
     * @throws com.questrail.chat.api.ChatException if either serial is malformed
     */
    @Override
    public int compareTo(Version other) {
        return Serial.compare(serial, other.serial);
    }
}
