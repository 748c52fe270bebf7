package com.cmdchat.client;

import com.cmdchat.protocol.FieldRules;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State shared by the send loop, the receive loop and the command dispatcher. Every
 * method holds this object's monitor, so readers always see a consistent snapshot.
 *
 * <p>The channel generation increases whenever the room or username changes; a loop
 * that notices a newer generation than the one it connected with must reconnect.
 */
public class ClientState {

    public static final List<String> DEFAULT_ROOMS = List.of("general", "random", "tech");
    static final int MAX_HISTORY = 500;
    static final int MAX_SEEN_IDS = 10_000;

    public enum ConnectionStatus {
        DISCONNECTED, CONNECTING, CONNECTED, RECONNECTING, FAILED
    }

    private final Instant startedAt;
    private final Map<String, Integer> memberCounts = new LinkedHashMap<>();
    private final List<ReceivedMessage> history = new ArrayList<>();
    private final Set<String> seenIds = Collections.newSetFromMap(new LinkedHashMap<String, Boolean>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > MAX_SEEN_IDS;
        }
    });

    private String username;
    private String currentRoom;
    private long generation;
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private Instant lastHeartbeat;
    private int sentCount;
    private int reconnects;

    public ClientState(String username, String room, Instant startedAt) {
        this.username = FieldRules.username(username);
        this.currentRoom = room;
        this.startedAt = startedAt;
        DEFAULT_ROOMS.forEach(name -> memberCounts.put(name, 0));
        memberCounts.putIfAbsent(room, 0);
    }

    // ── Identity ──────────────────────────────────────────────────────────────

    public synchronized String username() {
        return username;
    }

    public synchronized String currentRoom() {
        return currentRoom;
    }

    public synchronized long generation() {
        return generation;
    }

    /** @return the previous room */
    public synchronized String switchRoom(String room) {
        String previous = currentRoom;
        currentRoom = room;
        generation++;
        return previous;
    }

    /** @return the previous username */
    public synchronized String rename(String newName) {
        String validated = FieldRules.username(newName);
        String previous = username;
        username = validated;
        generation++;
        return previous;
    }

    // ── Rooms ─────────────────────────────────────────────────────────────────

    /** Room names match case-insensitively; the stored spelling is returned. */
    public synchronized Optional<String> knownRoom(String name) {
        return memberCounts.keySet().stream()
                .filter(known -> known.equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    public synchronized void updateMemberCount(String room, int count) {
        if (room == null || room.isBlank()) {
            return;
        }
        memberCounts.put(room, count);
    }

    public synchronized int memberCount(String room) {
        return memberCounts.getOrDefault(room, 0);
    }

    public synchronized Map<String, Integer> memberCounts() {
        return new LinkedHashMap<>(memberCounts);
    }

    // ── Messages ──────────────────────────────────────────────────────────────

    /** Marks a message id as seen. @return false if it was seen before */
    public synchronized boolean markSeen(String messageId) {
        if (messageId == null || messageId.isEmpty()) {
            return true;
        }
        return seenIds.add(messageId);
    }

    public synchronized void addToHistory(ReceivedMessage message) {
        history.add(message);
        if (history.size() > MAX_HISTORY) {
            history.remove(0);
        }
    }

    public synchronized List<ReceivedMessage> recentHistory(int limit) {
        int from = Math.max(0, history.size() - limit);
        return new ArrayList<>(history.subList(from, history.size()));
    }

    public synchronized void recordSent() {
        sentCount++;
    }

    public synchronized int sentCount() {
        return sentCount;
    }

    // ── Connection ────────────────────────────────────────────────────────────

    public synchronized void status(ConnectionStatus status) {
        this.status = status;
    }

    public synchronized ConnectionStatus status() {
        return status;
    }

    public synchronized void recordReconnect() {
        reconnects++;
    }

    public synchronized int reconnects() {
        return reconnects;
    }

    public synchronized void heartbeat(Instant at, int currentRoomMembers) {
        lastHeartbeat = at;
        memberCounts.put(currentRoom, currentRoomMembers);
    }

    public synchronized Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public Instant startedAt() {
        return startedAt;
    }
}
