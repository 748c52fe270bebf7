package com.cmdchat.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Serialized form of a stored chat message, as carried by message events and room snapshots. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessagePayload(
        @JsonProperty("id") String id,
        @JsonProperty("room_id") String roomId,
        @JsonProperty("user_id") String userId,
        @JsonProperty("username") String username,
        @JsonProperty("content") String content,
        @JsonProperty("message_type") MessageType messageType,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("is_encrypted") boolean encrypted,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("reply_to") String replyTo,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("file_url") String fileUrl
) {}
