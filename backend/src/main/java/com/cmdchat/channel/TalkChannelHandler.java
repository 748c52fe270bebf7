package com.cmdchat.channel;

import com.cmdchat.config.ChatProperties;
import com.cmdchat.error.ProtocolException;
import com.cmdchat.error.RateLimitException;
import com.cmdchat.error.ValidationException;
import com.cmdchat.message.ChatMessage;
import com.cmdchat.protocol.AckFrame;
import com.cmdchat.protocol.ChatFrame;
import com.cmdchat.protocol.CloseCodes;
import com.cmdchat.protocol.ConnectedEvent;
import com.cmdchat.protocol.ErrorFrame;
import com.cmdchat.protocol.FrameCodec;
import com.cmdchat.protocol.MessageEvent;
import com.cmdchat.registry.RoomRegistry;
import com.cmdchat.room.Room;
import com.cmdchat.user.ChatUser;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Optional;

/**
 * {@code /talk}: the channel a client submits its messages on.
 *
 * <p>Each inbound frame is stored, broadcast to the room and acknowledged to the sender.
 * Malformed, rate-limited and invalid frames are answered with an error frame and the
 * channel keeps streaming; only {@code {"action":"close"}} or a transport failure ends it.
 */
@Component
public class TalkChannelHandler implements WebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TalkChannelHandler.class);

    private final ChannelGate gate;
    private final RoomRegistry registry;
    private final FrameCodec codec;
    private final ChatProperties properties;
    private final Clock clock;

    public TalkChannelHandler(ChannelGate gate, RoomRegistry registry, FrameCodec codec,
                              ChatProperties properties, Clock clock) {
        this.gate = gate;
        this.registry = registry;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        ChannelLifecycle lifecycle = new ChannelLifecycle("talk", session.getId());
        ConnectionParameters params = ConnectionParameters.from(session.getHandshakeInfo(), properties.defaultRoom());

        Optional<Room> room = gate.admit(session, params, lifecycle);
        if (room.isEmpty()) {
            return gate.reject(session, lifecycle);
        }
        ChatUser user;
        try {
            user = registry.resolveUser(params.address(), params.username());
        } catch (ValidationException e) {
            log.warn("Rejected talk from {}: {}", params.address(), e.getMessage());
            return ChannelGate.close(session, lifecycle, CloseCodes.INVALID_PARAMETERS, e.getMessage());
        }

        String roomId = room.get().id();
        SessionSocket socket = new SessionSocket(session.getId(), properties.outboundBufferSize());
        registry.registerConnection(user.id(), roomId, socket);
        lifecycle.moveTo(ChannelState.STREAMING);
        log.info("{} joined room '{}' on talk", user.id(), room.get().name());

        socket.send(codec.encode(ConnectedEvent.of(roomId, registry.memberCount(roomId), now())));

        Mono<Void> inbound = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .<String>handle((text, sink) -> {
                    if (onFrame(text, user, roomId, socket) == FrameOutcome.CLOSE) {
                        sink.complete();
                    }
                })
                .then()
                .doFinally(signal -> {
                    if (lifecycle.close()) {
                        socket.close();
                        registry.unregisterConnection(user.id(), roomId, socket);
                        log.info("{} left room '{}' on talk ({})", user.id(), room.get().name(), signal);
                    }
                });

        // The frame stream ends when the socket is closed, including eviction by the registry.
        Mono<Void> outbound = session.send(socket.frames().map(session::textMessage))
                .then(Mono.defer(session::close));

        return Mono.when(inbound, outbound);
    }

    FrameOutcome onFrame(String text, ChatUser user, String roomId, SessionSocket socket) {
        JsonNode frame;
        try {
            frame = codec.parse(text);
        } catch (ProtocolException e) {
            reply(socket, new ErrorFrame(ErrorFrame.INVALID_JSON));
            return FrameOutcome.CONTINUE;
        }
        if (FrameCodec.isClose(frame)) {
            return FrameOutcome.CLOSE;
        }

        try {
            registry.recordActivity(user.id());
            registry.checkRateLimit(user.id());

            ChatFrame chat = codec.convert(frame, ChatFrame.class);
            ChatMessage message = ChatMessage.text(roomId, user.id(), user.username(), chat.text(), clock.instant());
            registry.appendMessage(roomId, message);
            registry.broadcast(roomId, codec.encode(MessageEvent.of(message.toPayload())));

            reply(socket, AckFrame.ok(message.id()));
        } catch (RateLimitException | ValidationException | ProtocolException e) {
            log.debug("Rejected frame from {}: {}", user.id(), e.getMessage());
            reply(socket, new ErrorFrame(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Error processing message from {}", user.id(), e);
            reply(socket, new ErrorFrame(ErrorFrame.PROCESSING_FAILED));
        }
        return FrameOutcome.CONTINUE;
    }

    private void reply(SessionSocket socket, Object frame) {
        try {
            socket.send(codec.encode(frame));
        } catch (RuntimeException e) {
            log.warn("Could not reply on talk socket {}: {}", socket.id(), e.getMessage());
        }
    }

    private String now() {
        return clock.instant().toString();
    }

    enum FrameOutcome {
        CONTINUE,
        CLOSE
    }
}
