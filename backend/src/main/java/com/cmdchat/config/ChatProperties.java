package com.cmdchat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Server settings, bound from the {@code chat.*} namespace.
 *
 * @param adminPassword      shared password; blank or absent disables every password check
 * @param defaultRoom        room used when a socket connects without {@code room_id}
 * @param heartbeatInterval  period of heartbeat frames on the update channel
 * @param outboundBufferSize frames queued per socket before the socket counts as failed
 * @param roomCapacity       advertised member capacity of newly created rooms
 */
@ConfigurationProperties(prefix = "chat")
public record ChatProperties(
        String adminPassword,
        @DefaultValue("general") String defaultRoom,
        @DefaultValue RateLimit rateLimit,
        @DefaultValue History history,
        @DefaultValue("30s") Duration heartbeatInterval,
        @DefaultValue("256") int outboundBufferSize,
        @DefaultValue("50") int roomCapacity
) {

    public record RateLimit(
            @DefaultValue("10") int limit,
            @DefaultValue("60s") Duration window
    ) {}

    /**
     * @param maxMessages  messages retained per room before the oldest are evicted
     * @param snapshotSize messages included in the room snapshot sent to update subscribers
     */
    public record History(
            @DefaultValue("10000") int maxMessages,
            @DefaultValue("50") int snapshotSize
    ) {}
}
