package com.cmdchat.channel;

import com.cmdchat.crypto.KeyExchangeCipher;
import com.cmdchat.crypto.TokenCipher;
import com.cmdchat.protocol.ChannelPath;
import com.cmdchat.protocol.ChatFrame;
import com.cmdchat.protocol.CloseCodes;
import com.cmdchat.protocol.CloseFrame;
import com.cmdchat.protocol.ErrorFrame;
import com.cmdchat.protocol.FrameCodec;
import com.cmdchat.protocol.MessagePayload;
import com.cmdchat.registry.RoomRegistry;
import com.cmdchat.room.Room;
import com.cmdchat.room.RoomType;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;
import java.security.KeyPair;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the talk and update channels over real WebSockets.
 *
 * Starts the server on a random port, performs the key exchange over HTTP and drives
 * both channels with Reactor Netty clients. The test profile sets the admin password
 * to {@code s3cret} and the heartbeat interval to 200ms.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class ChatChannelsIntegrationTest {

    private static final String PASSWORD = "s3cret";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @LocalServerPort
    private int port;

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private RoomRegistry registry;

    private final FrameCodec codec = new FrameCodec();
    private final WebSocketClient client = new ReactorNettyWebSocketClient();
    private final List<Disposable> connections = new ArrayList<>();

    @AfterEach
    void disconnect() {
        connections.forEach(Disposable::dispose);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    /** One client end of a channel: frames received, frames to send, close status once closed. */
    private static final class Peer {
        final List<JsonNode> frames = new CopyOnWriteArrayList<>();
        final Sinks.Many<String> outgoing = Sinks.many().unicast().onBackpressureBuffer();
        final AtomicReference<CloseStatus> closeStatus = new AtomicReference<>();

        void send(String frame) {
            outgoing.tryEmitNext(frame);
        }
    }

    private Peer open(ChannelPath channel, String username, String room, String password) {
        URI uri = UriComponentsBuilder.fromUriString("ws://localhost:" + port + channel.path())
                .queryParam("password", password)
                .queryParam("username", username)
                .queryParam("room_id", room)
                .build()
                .toUri();
        Peer peer = new Peer();
        Disposable connection = client.execute(uri, session -> Mono.when(
                        session.send(peer.outgoing.asFlux().map(session::textMessage)),
                        session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .map(codec::parse)
                                .doOnNext(peer.frames::add)
                                .then(),
                        session.closeStatus().doOnNext(peer.closeStatus::set).then()))
                .onErrorResume(e -> Mono.empty())
                .subscribe();
        connections.add(connection);
        return peer;
    }

    private byte[] fetchKey() {
        KeyPair keyPair = KeyExchangeCipher.generateKeyPair();
        byte[] wrapped = webTestClient.post()
                .uri("/get_key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "pubkey", KeyExchangeCipher.encodePublicKey(keyPair.getPublic()),
                        "username", "alice",
                        "password", PASSWORD))
                .exchange()
                .expectStatus().isOk()
                .expectBody(byte[].class)
                .returnResult()
                .getResponseBody();
        return KeyExchangeCipher.unwrap(wrapped, keyPair.getPrivate());
    }

    private static Predicate<JsonNode> type(String type) {
        return frame -> type.equals(FrameCodec.typeOf(frame));
    }

    private static JsonNode await(Peer peer, Predicate<JsonNode> match) throws InterruptedException {
        AtomicReference<JsonNode> found = new AtomicReference<>();
        awaitTrue(() -> {
            peer.frames.stream().filter(match).findFirst().ifPresent(found::set);
            return found.get() != null;
        });
        return found.get();
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + TIMEOUT);
            }
            Thread.sleep(20);
        }
    }

    private String chatFrame(String token, String username, String room) {
        return codec.encode(new ChatFrame(token, username, room, Instant.now().toString()));
    }

    private Room freshRoom() {
        String name = "e2e-" + UUID.randomUUID().toString().substring(0, 8);
        return registry.createRoom(name, RoomType.PUBLIC, "tester", "integration test room");
    }

    // ── Fan-out ───────────────────────────────────────────────────────────────

    @Test
    void talkMessage_reachesUpdateSubscribersOfThatRoomOnly() throws Exception {
        Peer bob = open(ChannelPath.UPDATE, "bob", "general", PASSWORD);
        Peer carol = open(ChannelPath.UPDATE, "carol", "random", PASSWORD);
        await(bob, type("room_update"));
        await(carol, type("room_update"));

        Peer alice = open(ChannelPath.TALK, "alice", "general", PASSWORD);
        await(alice, type("connected"));

        TokenCipher cipher = new TokenCipher(fetchKey(), Duration.ofHours(24));
        alice.send(chatFrame(cipher.encrypt("hello"), "alice", "general"));

        JsonNode ack = await(alice, frame -> "ok".equals(frame.path("status").asText()));
        String messageId = ack.get("message_id").asText();
        JsonNode event = await(bob, type("message")
                .and(frame -> messageId.equals(frame.path("message").path("id").asText())));

        MessagePayload message = codec.convert(event.get("message"), MessagePayload.class);
        assertEquals("alice", message.username());
        assertTrue(message.encrypted());
        assertEquals("hello", cipher.decrypt(message.content()), "Subscriber must decrypt the original text");

        Thread.sleep(300);
        assertTrue(carol.frames.stream().noneMatch(type("message")
                        .and(frame -> messageId.equals(frame.path("message").path("id").asText()))),
                "A subscriber of another room must not see the message");
    }

    @Test
    void updateSubscriber_getsSnapshotThenHeartbeats() throws Exception {
        Room room = freshRoom();

        Peer watcher = open(ChannelPath.UPDATE, "watcher", room.name(), PASSWORD);

        JsonNode snapshot = await(watcher, type("room_update"));
        assertEquals(room.id(), snapshot.path("room").path("id").asText());
        assertEquals(1, snapshot.path("recent_messages").size(), "New room holds only its announcement");
        assertFalse(snapshot.path("recent_messages").get(0).path("is_encrypted").asBoolean(true));

        JsonNode heartbeat = await(watcher, type("heartbeat"));
        assertEquals(1, heartbeat.path("user_count").asInt());
    }

    // ── Talk channel errors ───────────────────────────────────────────────────

    @Test
    void malformedJson_yieldsOneErrorFrameAndChannelKeepsWorking() throws Exception {
        Room room = freshRoom();
        Peer dave = open(ChannelPath.TALK, "dave", room.id(), PASSWORD);
        await(dave, type("connected"));

        dave.send("{not json");
        dave.send(chatFrame("opaque-token", "dave", room.id()));

        await(dave, frame -> "ok".equals(frame.path("status").asText()));
        long errors = dave.frames.stream().filter(frame -> frame.has("error")).count();
        assertEquals(1, errors);
        assertEquals(ErrorFrame.INVALID_JSON,
                dave.frames.stream().filter(frame -> frame.has("error")).findFirst().orElseThrow()
                        .get("error").asText());
        assertEquals("opaque-token", registry.recentMessages(room.id(), 10).get(1).content());
    }

    @Test
    void closeAction_unregistersTheSocket() throws Exception {
        Room room = freshRoom();
        Peer frank = open(ChannelPath.TALK, "frank", room.name(), PASSWORD);
        await(frank, type("connected"));
        assertEquals(1, registry.memberCount(room.id()));

        frank.send(codec.encode(CloseFrame.close()));

        awaitTrue(() -> registry.memberCount(room.id()) == 0);
    }

    // ── Rejected connections ──────────────────────────────────────────────────

    @Test
    void wrongPassword_closesWithUnauthorized() throws Exception {
        Peer eve = open(ChannelPath.TALK, "eve", "general", "wrong");

        awaitTrue(() -> eve.closeStatus.get() != null);
        assertEquals(CloseCodes.UNAUTHORIZED, eve.closeStatus.get().getCode());
        assertTrue(eve.frames.isEmpty(), "No frame may be sent before the close");
    }

    @Test
    void unknownRoom_closesWithUnknownRoom() throws Exception {
        Peer lost = open(ChannelPath.UPDATE, "lost", "no-such-room", PASSWORD);

        awaitTrue(() -> lost.closeStatus.get() != null);
        assertEquals(CloseCodes.UNKNOWN_ROOM, lost.closeStatus.get().getCode());
    }

    @Test
    void invalidUsernameOnTalk_closesWithInvalidParameters() throws Exception {
        Peer x = open(ChannelPath.TALK, "x", "general", PASSWORD);

        awaitTrue(() -> x.closeStatus.get() != null);
        assertEquals(CloseCodes.INVALID_PARAMETERS, x.closeStatus.get().getCode());
    }
}
