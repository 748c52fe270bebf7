package com.cmdchat.room;

import com.cmdchat.auth.AdminPasswordVerifier;
import com.cmdchat.registry.RoomRegistry;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
public class RoomService {

    private final RoomRegistry registry;
    private final AdminPasswordVerifier passwordVerifier;

    public RoomService(RoomRegistry registry, AdminPasswordVerifier passwordVerifier) {
        this.registry = registry;
        this.passwordVerifier = passwordVerifier;
    }

    /** Active rooms with their live member counts. */
    public Flux<RoomView> listRooms() {
        return Flux.defer(() -> Flux.fromIterable(registry.activeRooms()))
                .map(room -> RoomView.of(room, registry.memberCount(room.id())));
    }

    /**
     * Password first, so a caller without the password learns nothing about which
     * names are taken.
     */
    public Mono<RoomView> createRoom(String password, String name, String type, String description,
                                     String roomPassword, String creator) {
        return Mono.fromCallable(() -> {
            passwordVerifier.verify(password);
            Room room = registry.createRoom(name, RoomType.fromWireName(type), creator, description, roomPassword);
            return RoomView.of(room, registry.memberCount(room.id()));
        });
    }
}
