package com.cmdchat.health;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("active_rooms") int activeRooms,
        @JsonProperty("total_users") int totalUsers,
        @JsonProperty("active_connections") int activeConnections
) {}
