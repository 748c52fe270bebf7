package com.cmdchat.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConnectedEvent(
        @JsonProperty("type") String type,
        @JsonProperty("room_id") String roomId,
        @JsonProperty("user_count") int userCount,
        @JsonProperty("timestamp") String timestamp
) {

    public static final String TYPE = "connected";

    public static ConnectedEvent of(String roomId, int userCount, String timestamp) {
        return new ConnectedEvent(TYPE, roomId, userCount, timestamp);
    }
}
