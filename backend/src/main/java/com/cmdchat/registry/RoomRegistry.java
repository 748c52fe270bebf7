package com.cmdchat.registry;

import com.cmdchat.config.ChatProperties;
import com.cmdchat.crypto.TokenCipher;
import com.cmdchat.error.RateLimitException;
import com.cmdchat.error.ValidationException;
import com.cmdchat.message.ChatMessage;
import com.cmdchat.ratelimit.SlidingWindowRateLimiter;
import com.cmdchat.room.Room;
import com.cmdchat.room.RoomHistory;
import com.cmdchat.room.RoomType;
import com.cmdchat.user.ChatUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Central in-memory state of the server: rooms, their bounded message histories, the sockets subscribed to each room, known users, connection records,
 * per-user rate limits and the process-wide symmetric key.
 *
 * <p>Per-room state is guarded by the room entry's own monitor. No lock is held while a
 * frame is handed to a socket, so a slow subscriber never blocks the publisher or the
 * other subscribers of the room.
 */
@Component
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    static final String SYSTEM_CREATOR = "system";

    private final ChatProperties properties;
    private final Clock clock;
    private final SlidingWindowRateLimiter rateLimiter;
    private final byte[] symmetricKey = TokenCipher.generateKey();

    private final ConcurrentMap<String, RoomEntry> rooms = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> roomIdsByName = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ChatUser> users = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ConnectionInfo> connections = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ChatSocket> userSockets = new ConcurrentHashMap<>();

    public RoomRegistry(ChatProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.rateLimiter = new SlidingWindowRateLimiter(
                properties.rateLimit().limit(), properties.rateLimit().window(), clock);
        createDefaultRooms();
    }

    private void createDefaultRooms() {
        addRoom(newRoom("general", RoomType.PUBLIC, SYSTEM_CREATOR, "General chat room", null));
        addRoom(newRoom("random", RoomType.PUBLIC, SYSTEM_CREATOR, "Random discussions", null));
        addRoom(newRoom("tech", RoomType.PUBLIC, SYSTEM_CREATOR, "Technology discussions", null));
    }

    // ── Rooms ────────────────────────────────────────────────────────────────

    public Room createRoom(String name, RoomType type, String creator, String description) {
        return createRoom(name, type, creator, description, null);
    }

    /**
     * Creates a room with an empty history and socket set.
     *
     * @throws ValidationException if the name is empty, longer than 30 characters,
     *                             or already taken (case-insensitive)
     */
    public Room createRoom(String name, RoomType type, String creator, String description, String password) {
        Room room = addRoom(newRoom(name, type, creator, description, password));
        appendMessage(room.id(), ChatMessage.system(room.id(),
                "Room " + room.name() + " created by " + room.createdBy(), clock.instant()));
        log.info("Room '{}' ({}) created by {}", room.name(), room.id(), room.createdBy());
        return room;
    }

    private Room newRoom(String name, RoomType type, String creator, String description, String password) {
        return Room.create(name, type, creator, description, password, properties.roomCapacity(), clock.instant());
    }

    private Room addRoom(Room room) {
        RoomEntry entry = new RoomEntry(room, new RoomHistory(room.id(), properties.history().maxMessages()));
        rooms.put(room.id(), entry);
        if (roomIdsByName.putIfAbsent(nameKey(room.name()), room.id()) != null) {
            rooms.remove(room.id());
            throw new ValidationException("room already exists: " + room.name());
        }
        return room;
    }

    /** Looks a room up by id first, then by name. */
    public Optional<Room> findRoom(String idOrName) {
        return findEntry(idOrName).map(entry -> entry.room);
    }

    public List<Room> activeRooms() {
        return rooms.values().stream()
                .map(entry -> entry.room)
                .filter(Room::active)
                .sorted(Comparator.comparing(Room::createdAt).thenComparing(Room::name))
                .toList();
    }

    // ── Connections ──────────────────────────────────────────────────────────

    /**
     * Adds the socket to the room's active set. With a user id, the user's connection
     * record and socket mapping are overwritten as well; update subscribers pass
     * {@code null} and are only added to the set.
     *
     * @throws ValidationException if the room is unknown
     */
    public void registerConnection(String userId, String roomId, ChatSocket socket) {
        RoomEntry entry = rooms.get(roomId);
        if (entry == null) {
            throw new ValidationException("unknown room: " + roomId);
        }
        entry.addSocket(socket);
        if (userId != null) {
            userSockets.put(userId, socket);
            connections.put(userId, ConnectionInfo.open(userId, roomId, clock.instant()));
        }
        log.debug("Registered socket {} (user {}) in room {}", socket.id(), userId, roomId);
    }

    /**
     * Reverse of {@link #registerConnection}. Safe to call repeatedly and with
     * {@code null} or unknown arguments. The connection record is only cleared when the
     * user's current socket is this one, so a newer connection is never torn down by the
     * cleanup of an older one.
     */
    public void unregisterConnection(String userId, String roomId, ChatSocket socket) {
        if (socket == null) {
            return;
        }
        RoomEntry entry = roomId == null ? null : rooms.get(roomId);
        if (entry != null) {
            entry.removeSocket(socket);
        }
        if (userId != null && userSockets.remove(userId, socket)) {
            connections.remove(userId);
        }
        log.debug("Unregistered socket {} (user {}) from room {}", socket.id(), userId, roomId);
    }

    public Optional<ConnectionInfo> connection(String userId) {
        return Optional.ofNullable(connections.get(userId));
    }

    public void recordActivity(String userId) {
        connections.computeIfPresent(userId, (id, info) -> info.pingedAt(clock.instant()));
        users.computeIfPresent(userId, (id, user) -> user.seenAt(clock.instant()));
    }

    public int memberCount(String roomId) {
        RoomEntry entry = rooms.get(roomId);
        return entry == null ? 0 : entry.socketCount();
    }

    public int connectionCount() {
        return rooms.values().stream().mapToInt(RoomEntry::socketCount).sum();
    }

    // ── Messages ─────────────────────────────────────────────────────────────

    /** Appends to the room's history. Unknown rooms are ignored, never created. */
    public void appendMessage(String roomId, ChatMessage message) {
        RoomEntry entry = rooms.get(roomId);
        if (entry == null) {
            log.debug("Dropping message {} for unknown room {}", message.id(), roomId);
            return;
        }
        entry.append(message);
    }

    /**
     * The newest {@code limit} messages of the room's history, oldest first; every
     * retained message when {@code limit <= 0}.
     */
    public List<ChatMessage> recentMessages(String roomId, int limit) {
        RoomEntry entry = rooms.get(roomId);
        return entry == null ? List.of() : entry.recent(limit);
    }

    /**
     * Hands {@code payload} to every socket currently registered for the room. Each
     * failing socket is logged and removed; the others still receive the frame.
     *
     * @return the number of sockets that accepted the frame
     */
    public int broadcast(String roomId, String payload) {
        RoomEntry entry = rooms.get(roomId);
        if (entry == null) {
            return 0;
        }
        int delivered = 0;
        for (ChatSocket socket : entry.sockets()) {
            try {
                socket.send(payload);
                delivered++;
            } catch (RuntimeException e) {
                log.error("Failed to send to socket {} in room {}: {}", socket.id(), roomId, e.getMessage());
                entry.removeSocket(socket);
                socket.close();
            }
        }
        return delivered;
    }

    // ── Users ────────────────────────────────────────────────────────────────

    /**
     * Returns the user for this address and name, creating it on first contact and
     * refreshing last-seen otherwise.
     *
     * @throws ValidationException if the username breaks the username rule
     */
    public ChatUser resolveUser(String address, String username) {
        ChatUser candidate = ChatUser.join(address, username, clock.instant());
        return users.compute(candidate.id(),
                (id, existing) -> existing == null ? candidate : existing.seenAt(clock.instant()));
    }

    public int userCount() {
        return users.size();
    }

    public void checkRateLimit(String userId) {
        if (!rateLimiter.tryAcquire(userId)) {
            throw new RateLimitException();
        }
    }

    /** A copy of the process-wide symmetric key; callers should zero it when done. */
    public byte[] symmetricKey() {
        return symmetricKey.clone();
    }

    private Optional<RoomEntry> findEntry(String idOrName) {
        if (idOrName == null || idOrName.isBlank()) {
            return Optional.empty();
        }
        RoomEntry byId = rooms.get(idOrName);
        if (byId != null) {
            return Optional.of(byId);
        }
        String id = roomIdsByName.get(nameKey(idOrName));
        return id == null ? Optional.empty() : Optional.ofNullable(rooms.get(id));
    }

    private static String nameKey(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static final class RoomEntry {

        private final Room room;
        private final RoomHistory history;
        private final Set<ChatSocket> sockets = new LinkedHashSet<>();

        RoomEntry(Room room, RoomHistory history) {
            this.room = room;
            this.history = history;
        }

        void append(ChatMessage message) {
            history.append(message);
        }

        List<ChatMessage> recent(int limit) {
            return history.recent(limit);
        }

        synchronized void addSocket(ChatSocket socket) {
            sockets.add(socket);
        }

        synchronized void removeSocket(ChatSocket socket) {
            sockets.remove(socket);
        }

        synchronized List<ChatSocket> sockets() {
            return new ArrayList<>(sockets);
        }

        synchronized int socketCount() {
            return sockets.size();
        }
    }
}
