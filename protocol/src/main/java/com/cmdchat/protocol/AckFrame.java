package com.cmdchat.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Per-sender acknowledgment for an accepted message. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AckFrame(
        @JsonProperty("status") String status,
        @JsonProperty("message_id") String messageId
) {

    public static AckFrame ok(String messageId) {
        return new AckFrame("ok", messageId);
    }
}
