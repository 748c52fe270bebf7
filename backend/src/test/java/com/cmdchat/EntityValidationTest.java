package com.cmdchat;

import com.cmdchat.error.ValidationException;
import com.cmdchat.message.ChatMessage;
import com.cmdchat.protocol.MessageType;
import com.cmdchat.room.Room;
import com.cmdchat.room.RoomType;
import com.cmdchat.user.ChatUser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Construction rules for users, rooms and messages. No Spring context.
 */
class EntityValidationTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    // ── Users ─────────────────────────────────────────────────────────────────

    @ParameterizedTest
    @ValueSource(strings = {"ab", "alice", "Bob_99", "x-y-z", "ABCDEFGHIJKLMNOPQRST", "  padded  "})
    void validUsernamesAreAccepted(String username) {
        ChatUser user = ChatUser.join("10.0.0.7", username, NOW);

        assertEquals(username.trim(), user.username());
        assertEquals("10.0.0.7:" + username.trim(), user.id());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"a", " a ", "ABCDEFGHIJKLMNOPQRSTU", "has space", "dot.name", "émile", "semi;colon"})
    void invalidUsernamesAreRejected(String username) {
        assertThrows(ValidationException.class, () -> ChatUser.join("10.0.0.7", username, NOW));
    }

    @Test
    void seenAtKeepsIdentityAndJoinTime() {
        ChatUser user = ChatUser.join("10.0.0.7", "alice", NOW);

        ChatUser later = user.seenAt(NOW.plusSeconds(90));

        assertEquals(user.id(), later.id());
        assertEquals(NOW, later.joinedAt());
        assertEquals(NOW.plusSeconds(90), later.lastSeen());
    }

    // ── Rooms ─────────────────────────────────────────────────────────────────

    @ParameterizedTest
    @ValueSource(strings = {"x", "general", "a room with spaces", "123456789012345678901234567890"})
    void validRoomNamesAreAccepted(String name) {
        Room room = Room.create(name, RoomType.PUBLIC, "alice", "desc", null, 50, NOW);

        assertEquals(name, room.name());
        assertTrue(room.active());
        assertEquals(50, room.maxMembers());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "1234567890123456789012345678901"})
    void invalidRoomNamesAreRejected(String name) {
        assertThrows(ValidationException.class,
                () -> Room.create(name, RoomType.PUBLIC, "alice", "desc", null, 50, NOW));
    }

    @Test
    void roomDefaultsApply() {
        Room room = Room.create("  lobby ", null, "alice", null, null, 0, NOW);

        assertEquals("lobby", room.name());
        assertEquals(RoomType.PUBLIC, room.type());
        assertEquals("", room.description());
        assertEquals(Room.DEFAULT_MAX_MEMBERS, room.maxMembers());
    }

    @Test
    void unknownRoomTypeIsAValidationError() {
        assertEquals(RoomType.PRIVATE, RoomType.fromWireName("Private"));
        assertEquals(RoomType.PUBLIC, RoomType.fromWireName(null));
        assertThrows(ValidationException.class, () -> RoomType.fromWireName("secret"));
    }

    // ── Messages ──────────────────────────────────────────────────────────────

    @Test
    void messageContentIsTrimmed() {
        ChatMessage message = ChatMessage.text("room", "10.0.0.7:alice", "alice", "  hi  ", NOW);

        assertEquals("hi", message.content());
        assertEquals(MessageType.TEXT, message.type());
        assertTrue(message.encrypted());
        assertNotNull(message.id());
    }

    @Test
    void messageContentBoundsAreEnforced() {
        assertThrows(ValidationException.class, () -> ChatMessage.text("room", "u", "alice", "   ", NOW));
        assertThrows(ValidationException.class, () -> ChatMessage.text("room", "u", "alice", null, NOW));
        assertThrows(ValidationException.class, () -> ChatMessage.text("room", "u", "alice", "x".repeat(1001), NOW));
        assertDoesNotThrow(() -> ChatMessage.text("room", "u", "alice", "x".repeat(1000), NOW));
    }

    @Test
    void payloadCarriesWireFields() {
        ChatMessage message = ChatMessage.system("room", "Room lobby created by alice", NOW);

        var payload = message.toPayload();

        assertEquals(message.id(), payload.id());
        assertEquals("System", payload.username());
        assertEquals(MessageType.SYSTEM, payload.messageType());
        assertEquals("2026-03-01T12:00:00Z", payload.timestamp());
        assertFalse(payload.encrypted());
    }
}
