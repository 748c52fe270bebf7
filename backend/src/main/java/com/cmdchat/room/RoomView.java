package com.cmdchat.room;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Public projection of a room; never carries the room password. */
public record RoomView(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") RoomType type,
        @JsonProperty("created_by") String createdBy,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("description") String description,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("member_count") int memberCount,
        @JsonProperty("max_members") int maxMembers,
        @JsonProperty("active_users") int activeUsers
) {

    public static RoomView of(Room room, int liveMembers) {
        return new RoomView(room.id(), room.name(), room.type(), room.createdBy(), room.createdAt().toString(),
                room.description(), room.active(), liveMembers, room.maxMembers(), liveMembers);
    }
}
