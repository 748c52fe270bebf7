package com.cmdchat.registry;

import java.time.Instant;

/** One participant's current subscription. Replaced, never merged, when the user reconnects. */
public record ConnectionInfo(
        String userId,
        String roomId,
        Instant connectedAt,
        Instant lastPing,
        boolean active
) {

    public static ConnectionInfo open(String userId, String roomId, Instant now) {
        return new ConnectionInfo(userId, roomId, now, now, true);
    }

    public ConnectionInfo pingedAt(Instant now) {
        return new ConnectionInfo(userId, roomId, connectedAt, now, active);
    }
}
