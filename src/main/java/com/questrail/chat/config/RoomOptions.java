package com.questrail.chat.config;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration for one room.
 *
 * <p>Two rooms requested under the same name must use equal options; records
 * give value equality for that check.</p>
 */
public record RoomOptions(
        TypingOptions typing,
        ReleaseRetryPolicy releaseRetryPolicy,
        Map<String, String> channelParams
) {
    public RoomOptions {
        Objects.requireNonNull(typing, "typing");
        Objects.requireNonNull(releaseRetryPolicy, "releaseRetryPolicy");
        channelParams = Map.copyOf(Objects.requireNonNull(channelParams, "channelParams"));
    }

    public static RoomOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TypingOptions typing = TypingOptions.defaults();
        private ReleaseRetryPolicy releaseRetryPolicy = ReleaseRetryPolicy.defaults();
        private final Map<String, String> channelParams = new HashMap<>();

        public Builder withTyping(TypingOptions typing) {
            this.typing = typing;
            return this;
        }

        public Builder withReleaseRetryPolicy(ReleaseRetryPolicy policy) {
            this.releaseRetryPolicy = policy;
            return this;
        }

        public Builder withChannelParam(String key, String value) {
            this.channelParams.put(key, value);
            return this;
        }

        public RoomOptions build() {
            return new RoomOptions(typing, releaseRetryPolicy, channelParams);
        }
    }
}
