package com.cmdchat.client;

import com.cmdchat.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ClientStateTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ClientState state = new ClientState("alice", "general", NOW);

    @Test
    void invalidUsername_isRejectedUpFront() {
        assertThrows(ValidationException.class, () -> new ClientState("a", "general", NOW));
        assertThrows(ValidationException.class, () -> new ClientState("bad name!", "general", NOW));
    }

    @Test
    void defaultRooms_areKnownCaseInsensitively() {
        assertEquals("tech", state.knownRoom(" TECH ").orElseThrow());
        assertTrue(state.knownRoom("lobby").isEmpty());
    }

    @Test
    void startRoomOutsideDefaults_isKnown() {
        ClientState custom = new ClientState("alice", "Engineering", NOW);
        assertTrue(custom.knownRoom("engineering").isPresent());
    }

    @Test
    void roomAndNameChanges_bumpGeneration() {
        long start = state.generation();

        assertEquals("general", state.switchRoom("random"));
        assertEquals("alice", state.rename("bob"));

        assertEquals(start + 2, state.generation());
        assertEquals("random", state.currentRoom());
        assertEquals("bob", state.username());
    }

    @Test
    void failedRename_leavesStateAlone() {
        long start = state.generation();

        assertThrows(ValidationException.class, () -> state.rename("x"));

        assertEquals("alice", state.username());
        assertEquals(start, state.generation());
    }

    @Test
    void markSeen_reportsDuplicates() {
        assertTrue(state.markSeen("m1"));
        assertFalse(state.markSeen("m1"));
        assertTrue(state.markSeen(null), "Messages without id are never deduplicated");
        assertTrue(state.markSeen(null));
    }

    @Test
    void seenIds_forgetOldestBeyondCap() {
        for (int i = 0; i <= ClientState.MAX_SEEN_IDS; i++) {
            state.markSeen("m" + i);
        }

        assertTrue(state.markSeen("m0"), "Oldest id was evicted");
        assertFalse(state.markSeen("m" + ClientState.MAX_SEEN_IDS));
    }

    @Test
    void history_isBounded() {
        for (int i = 0; i < ClientState.MAX_HISTORY + 5; i++) {
            state.addToHistory(new ReceivedMessage("m" + i, "bob", "line " + i, NOW, false));
        }

        assertEquals(ClientState.MAX_HISTORY, state.recentHistory(Integer.MAX_VALUE).size());
        assertEquals("line 5", state.recentHistory(Integer.MAX_VALUE).get(0).content());
        assertEquals(3, state.recentHistory(3).size());
    }

    @Test
    void heartbeat_updatesCurrentRoomCount() {
        state.heartbeat(NOW, 6);

        assertEquals(NOW, state.lastHeartbeat());
        assertEquals(6, state.memberCount("general"));
        assertEquals(0, state.memberCount("random"));
    }
}
