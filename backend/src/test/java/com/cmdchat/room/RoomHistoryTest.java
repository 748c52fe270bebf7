package com.cmdchat.room;

import com.cmdchat.message.ChatMessage;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class RoomHistoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private static ChatMessage message(int n) {
        return ChatMessage.text("room-1", "10.0.0.1:alice", "alice", "msg-" + n, NOW.plusSeconds(n));
    }

    private static List<String> contents(List<ChatMessage> messages) {
        return messages.stream().map(ChatMessage::content).toList();
    }

    @Test
    void overflowEvictsOldestAndKeepsOrder() {
        RoomHistory history = new RoomHistory("room-1", 5);

        IntStream.rangeClosed(1, 8).forEach(n -> history.append(message(n)));

        assertEquals(5, history.size(), "History must never exceed its cap");
        assertEquals(List.of("msg-4", "msg-5", "msg-6", "msg-7", "msg-8"), contents(history.recent(0)));
        assertEquals(8, history.totalAppended());
        assertEquals(NOW.plusSeconds(8), history.lastUpdated());
    }

    @Test
    void exactlyAtCapEvictsNothing() {
        RoomHistory history = new RoomHistory("room-1", 3);

        IntStream.rangeClosed(1, 3).forEach(n -> history.append(message(n)));

        assertEquals(List.of("msg-1", "msg-2", "msg-3"), contents(history.recent(-1)));
    }

    @Test
    void recentIsClampedToAvailableLength() {
        RoomHistory history = new RoomHistory("room-1", 100);
        IntStream.rangeClosed(1, 4).forEach(n -> history.append(message(n)));

        assertEquals(List.of("msg-3", "msg-4"), contents(history.recent(2)));
        assertEquals(4, history.recent(50).size());
        assertEquals(4, history.recent(0).size());
    }

    @Test
    void emptyHistory() {
        RoomHistory history = new RoomHistory("room-1", RoomHistory.DEFAULT_MAX_MESSAGES);

        assertTrue(history.recent(10).isEmpty());
        assertNull(history.lastUpdated());
        assertEquals(10_000, history.maxMessages());
    }

    @Test
    void rejectsNonPositiveCap() {
        assertThrows(IllegalArgumentException.class, () -> new RoomHistory("room-1", 0));
    }
}
