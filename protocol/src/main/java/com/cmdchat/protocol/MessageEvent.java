package com.cmdchat.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageEvent(
        @JsonProperty("type") String type,
        @JsonProperty("message") MessagePayload message
) {

    public static final String TYPE = "message";

    public static MessageEvent of(MessagePayload message) {
        return new MessageEvent(TYPE, message);
    }
}
