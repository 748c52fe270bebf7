package com.cmdchat.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** First frame on the update channel: room metadata plus the most recent messages for backfill. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoomUpdateEvent(
        @JsonProperty("type") String type,
        @JsonProperty("room") RoomSnapshot room,
        @JsonProperty("recent_messages") List<MessagePayload> recentMessages,
        @JsonProperty("timestamp") String timestamp
) {

    public static final String TYPE = "room_update";

    public RoomUpdateEvent {
        recentMessages = recentMessages == null ? List.of() : List.copyOf(recentMessages);
    }

    public static RoomUpdateEvent of(RoomSnapshot room, List<MessagePayload> recentMessages, String timestamp) {
        return new RoomUpdateEvent(TYPE, room, recentMessages, timestamp);
    }
}
