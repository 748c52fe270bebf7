package com.cmdchat.channel;

import com.cmdchat.auth.AdminPasswordVerifier;
import com.cmdchat.protocol.CloseCodes;
import com.cmdchat.registry.RoomRegistry;
import com.cmdchat.room.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Entry checks shared by both channels: the admin password, then the target room.
 * A rejected session is closed with a distinguishable application close code.
 */
@Component
class ChannelGate {

    private static final Logger log = LoggerFactory.getLogger(ChannelGate.class);

    static final CloseStatus UNAUTHORIZED = new CloseStatus(CloseCodes.UNAUTHORIZED, "unauthorized");
    static final CloseStatus UNKNOWN_ROOM = new CloseStatus(CloseCodes.UNKNOWN_ROOM, "unknown room");

    private final AdminPasswordVerifier passwordVerifier;
    private final RoomRegistry registry;

    ChannelGate(AdminPasswordVerifier passwordVerifier, RoomRegistry registry) {
        this.passwordVerifier = passwordVerifier;
        this.registry = registry;
    }

    /**
     * @return the room to join, or empty after the session has been scheduled for closing
     */
    Optional<Room> admit(WebSocketSession session, ConnectionParameters params, ChannelLifecycle lifecycle) {
        if (!passwordVerifier.matches(params.password())) {
            log.warn("Rejected {} from {}: bad password", session.getHandshakeInfo().getUri().getPath(),
                    params.address());
            return Optional.empty();
        }
        lifecycle.moveTo(ChannelState.AUTHENTICATED);
        Optional<Room> room = registry.findRoom(params.roomRef());
        if (room.isEmpty()) {
            log.warn("Rejected {} from {}: unknown room '{}'", session.getHandshakeInfo().getUri().getPath(),
                    params.address(), params.roomRef());
        }
        return room;
    }

    Mono<Void> reject(WebSocketSession session, ChannelLifecycle lifecycle) {
        CloseStatus status = lifecycle.current() == ChannelState.CONNECTING ? UNAUTHORIZED : UNKNOWN_ROOM;
        lifecycle.close();
        return session.close(status);
    }

    static Mono<Void> close(WebSocketSession session, ChannelLifecycle lifecycle, int code, String reason) {
        lifecycle.close();
        return session.close(new CloseStatus(code, reason));
    }
}
