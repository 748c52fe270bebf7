package com.cmdchat.room;

import com.cmdchat.message.ChatMessage;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded append-only message log for one room. Once more than {@code maxMessages}
 * have been appended the oldest are evicted first; whole messages only.
 */
public class RoomHistory {

    public static final int DEFAULT_MAX_MESSAGES = 10_000;

    private final String roomId;
    private final int maxMessages;
    private final Deque<ChatMessage> messages = new ArrayDeque<>();
    private long totalAppended;
    private Instant lastUpdated;

    public RoomHistory(String roomId, int maxMessages) {
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive: " + maxMessages);
        }
        this.roomId = roomId;
        this.maxMessages = maxMessages;
    }

    public synchronized void append(ChatMessage message) {
        messages.addLast(message);
        totalAppended++;
        lastUpdated = message.timestamp();
        while (messages.size() > maxMessages) {
            messages.removeFirst();
        }
    }

    /**
     * The newest {@code limit} messages in original order, or every retained message
     * when {@code limit <= 0}.
     */
    public synchronized List<ChatMessage> recent(int limit) {
        List<ChatMessage> all = new ArrayList<>(messages);
        if (limit <= 0 || limit >= all.size()) {
            return all;
        }
        return new ArrayList<>(all.subList(all.size() - limit, all.size()));
    }

    public synchronized int size() {
        return messages.size();
    }

    public synchronized long totalAppended() {
        return totalAppended;
    }

    public synchronized Instant lastUpdated() {
        return lastUpdated;
    }

    public String roomId() {
        return roomId;
    }

    public int maxMessages() {
        return maxMessages;
    }
}
