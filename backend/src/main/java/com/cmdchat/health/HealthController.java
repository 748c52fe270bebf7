package com.cmdchat.health;

import com.cmdchat.registry.RoomRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;

/** Liveness plus aggregate counters. No authentication. */
@RestController
public class HealthController {

    private final RoomRegistry registry;
    private final Clock clock;

    public HealthController(RoomRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Mono<HealthResponse> health() {
        return Mono.fromSupplier(() -> new HealthResponse(
                "healthy",
                clock.instant().toString(),
                registry.activeRooms().size(),
                registry.userCount(),
                registry.connectionCount()));
    }
}
