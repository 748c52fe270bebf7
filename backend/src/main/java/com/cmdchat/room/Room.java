package com.cmdchat.room;

import com.cmdchat.protocol.FieldRules;

import java.time.Instant;
import java.util.UUID;

/**
 * A named broadcast group. Immutable; the live member count is not part of the room
 * itself but is read from the registry's socket set.
 *
 * @param password only meaningful for private rooms, never serialized
 */
public record Room(
        String id,
        String name,
        RoomType type,
        String createdBy,
        Instant createdAt,
        String description,
        boolean active,
        int maxMembers,
        String password
) {

    public static final int DEFAULT_MAX_MEMBERS = 50;

    public Room {
        name = FieldRules.roomName(name);
        type = type == null ? RoomType.PUBLIC : type;
        description = description == null ? "" : description;
        maxMembers = maxMembers > 0 ? maxMembers : DEFAULT_MAX_MEMBERS;
    }

    public static Room create(String name, RoomType type, String createdBy, String description,
                              String password, int maxMembers, Instant now) {
        return new Room(UUID.randomUUID().toString(), name, type, createdBy, now, description,
                true, maxMembers, password);
    }
}
