package com.cmdchat.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoomSnapshot(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("member_count") int memberCount
) {}
