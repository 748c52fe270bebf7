package com.cmdchat.room;

import com.cmdchat.web.RequestArguments;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/rooms")
public class RoomController {

    private final RoomService roomService;
    private final ObjectMapper objectMapper;

    public RoomController(RoomService roomService, ObjectMapper objectMapper) {
        this.roomService = roomService;
        this.objectMapper = objectMapper;
    }

    @GetMapping
    public Mono<RoomListResponse> listRooms() {
        return roomService.listRooms()
                .collectList()
                .map(rooms -> new RoomListResponse(rooms, rooms.size()));
    }

    /**
     * Creates a room from {@code name}, {@code type} and {@code description}. Requires
     * the admin {@code password}; the creator is taken from {@code username}.
     */
    @PostMapping
    public Mono<CreateRoomResponse> createRoom(ServerWebExchange exchange) {
        return RequestArguments.from(exchange, objectMapper)
                .flatMap(args -> roomService.createRoom(
                        args.get("password"),
                        args.get("name"),
                        args.get("type"),
                        args.get("description"),
                        args.get("room_password"),
                        args.getOrDefault("username", "unknown")))
                .map(room -> new CreateRoomResponse(true, room));
    }
}
