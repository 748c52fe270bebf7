package com.cmdchat.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a client sends on the talk channel. {@code text} is an encrypted token; the
 * server stores and relays it without reading it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatFrame(
        @JsonProperty("text") String text,
        @JsonProperty("username") String username,
        @JsonProperty("room_id") String roomId,
        @JsonProperty("timestamp") String timestamp
) {}
