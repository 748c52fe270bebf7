package com.cmdchat.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HeartbeatEvent(
        @JsonProperty("type") String type,
        @JsonProperty("user_count") int userCount,
        @JsonProperty("timestamp") String timestamp
) {

    public static final String TYPE = "heartbeat";

    public static HeartbeatEvent of(int userCount, String timestamp) {
        return new HeartbeatEvent(TYPE, userCount, timestamp);
    }
}
