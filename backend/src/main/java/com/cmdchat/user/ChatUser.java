package com.cmdchat.user;

import com.cmdchat.protocol.FieldRules;

import java.time.Instant;

/**
 * A participant, identified by source address plus chosen name. Created on first
 * contact and never removed while the process lives.
 */
public record ChatUser(
        String id,
        String username,
        UserStatus status,
        Instant joinedAt,
        Instant lastSeen,
        String address,
        boolean admin
) {

    public ChatUser {
        username = FieldRules.username(username);
        status = status == null ? UserStatus.ONLINE : status;
    }

    public static String idFor(String address, String username) {
        return address + ":" + username;
    }

    public static ChatUser join(String address, String username, Instant now) {
        String name = FieldRules.username(username);
        return new ChatUser(idFor(address, name), name, UserStatus.ONLINE, now, now, address, false);
    }

    public ChatUser seenAt(Instant now) {
        return new ChatUser(id, username, UserStatus.ONLINE, joinedAt, now, address, admin);
    }
}
