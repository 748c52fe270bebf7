package com.cmdchat.channel;

import com.cmdchat.config.ChatProperties;
import com.cmdchat.message.ChatMessage;
import com.cmdchat.protocol.FrameCodec;
import com.cmdchat.protocol.HeartbeatEvent;
import com.cmdchat.protocol.RoomSnapshot;
import com.cmdchat.protocol.RoomUpdateEvent;
import com.cmdchat.registry.RoomRegistry;
import com.cmdchat.room.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Optional;

/**
 * {@code /update}: room snapshot on subscribe, then every broadcast for the room plus a
 * periodic heartbeat. A failed heartbeat ends the subscription.
 */
@Component
public class UpdateChannelHandler implements WebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(UpdateChannelHandler.class);

    private final ChannelGate gate;
    private final RoomRegistry registry;
    private final FrameCodec codec;
    private final ChatProperties properties;
    private final Clock clock;

    public UpdateChannelHandler(ChannelGate gate, RoomRegistry registry, FrameCodec codec,
                                ChatProperties properties, Clock clock) {
        this.gate = gate;
        this.registry = registry;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        ChannelLifecycle lifecycle = new ChannelLifecycle("update", session.getId());
        ConnectionParameters params = ConnectionParameters.from(session.getHandshakeInfo(), properties.defaultRoom());

        Optional<Room> admitted = gate.admit(session, params, lifecycle);
        if (admitted.isEmpty()) {
            return gate.reject(session, lifecycle);
        }
        Room room = admitted.get();

        SessionSocket socket = new SessionSocket(session.getId(), properties.outboundBufferSize());
        registry.registerConnection(null, room.id(), socket);
        lifecycle.moveTo(ChannelState.SUBSCRIBED);
        log.info("{} subscribed to room '{}'", params.address(), room.name());

        socket.send(codec.encode(snapshot(room)));

        Mono<Void> heartbeats = Flux.interval(properties.heartbeatInterval())
                .doOnNext(tick -> socket.send(codec.encode(
                        HeartbeatEvent.of(registry.memberCount(room.id()), clock.instant().toString()))))
                .then();
        Mono<Void> clientGone = session.receive().then();

        Mono<Void> subscription = Mono.firstWithSignal(clientGone, heartbeats)
                .onErrorResume(e -> {
                    log.warn("Heartbeat to update session {} failed: {}", session.getId(), e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    if (lifecycle.close()) {
                        socket.close();
                        registry.unregisterConnection(null, room.id(), socket);
                        log.info("{} unsubscribed from room '{}' ({})", params.address(), room.name(), signal);
                    }
                });

        // The frame stream ends when the socket is closed, including eviction by the registry.
        Mono<Void> outbound = session.send(socket.frames().map(session::textMessage))
                .then(Mono.defer(session::close));

        return Mono.when(subscription, outbound);
    }

    private RoomUpdateEvent snapshot(Room room) {
        return RoomUpdateEvent.of(
                new RoomSnapshot(room.id(), room.name(), registry.memberCount(room.id())),
                registry.recentMessages(room.id(), properties.history().snapshotSize()).stream()
                        .map(ChatMessage::toPayload)
                        .toList(),
                clock.instant().toString());
    }
}
