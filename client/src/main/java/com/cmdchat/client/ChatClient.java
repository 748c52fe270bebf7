package com.cmdchat.client;

import com.cmdchat.client.command.CommandDispatcher;
import com.cmdchat.client.command.CommandResult;
import com.cmdchat.client.config.ClientProperties;
import com.cmdchat.client.connection.ChannelConnection;
import com.cmdchat.client.connection.ChannelConnector;
import com.cmdchat.client.connection.ReconnectPolicy;
import com.cmdchat.client.handshake.ClientKeyring;
import com.cmdchat.client.render.ChatRenderer;
import com.cmdchat.error.AuthException;
import com.cmdchat.error.ConnectionFailedException;
import com.cmdchat.error.CryptoException;
import com.cmdchat.error.TransportException;
import com.cmdchat.protocol.ChannelPath;
import com.cmdchat.protocol.ChatFrame;
import com.cmdchat.protocol.CloseCodes;
import com.cmdchat.protocol.CloseFrame;
import com.cmdchat.protocol.ConnectedEvent;
import com.cmdchat.protocol.FieldRules;
import com.cmdchat.protocol.FrameCodec;
import com.cmdchat.protocol.HeartbeatEvent;
import com.cmdchat.protocol.MessageEvent;
import com.cmdchat.protocol.MessagePayload;
import com.cmdchat.protocol.MessageType;
import com.cmdchat.protocol.RoomUpdateEvent;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Dual-channel connection manager.
 *
 * <p>The caller's thread runs the send loop: it reads lines, hands commands to the
 * dispatcher and sends everything else, encrypted, on {@code /talk}. A background thread
 * runs the receive loop on {@code /update}, decrypting and rendering what the room
 * publishes. Both loops connect through the same {@link ReconnectPolicy} and both
 * reconnect when the room or username changes.
 */
public class ChatClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChatClient.class);

    static final Duration RECEIVER_JOIN_TIMEOUT = Duration.ofSeconds(2);

    /** Blocking source of user input. */
    @FunctionalInterface
    public interface LineSource {
        /** @return the next line, or {@code null} at end of input */
        String readLine() throws IOException;
    }

    private final ClientProperties properties;
    private final ClientState state;
    private final ClientKeyring keyring;
    private final ChannelConnector connector;
    private final ReconnectPolicy reconnectPolicy;
    private final CommandDispatcher dispatcher;
    private final ChatRenderer renderer;
    private final FrameCodec codec;
    private final Clock clock;

    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean running = true;
    private volatile Thread receiver;
    private volatile ChannelConnection talk;
    private long talkGeneration = -1;

    public ChatClient(ClientProperties properties, ClientState state, ClientKeyring keyring,
                      ChannelConnector connector, ReconnectPolicy reconnectPolicy, CommandDispatcher dispatcher,
                      ChatRenderer renderer, FrameCodec codec, Clock clock) {
        this.properties = properties;
        this.state = state;
        this.keyring = keyring;
        this.connector = connector;
        this.reconnectPolicy = reconnectPolicy;
        this.dispatcher = dispatcher;
        this.renderer = renderer;
        this.codec = codec;
        this.clock = clock;
    }

    /** Runs until the user quits, input ends or a fatal error occurs, then closes the client. */
    public void run(LineSource input) {
        Thread thread = new Thread(this::receiveLoop, "chat-receive");
        thread.setDaemon(true);
        receiver = thread;
        thread.start();
        try {
            sendLoop(input);
        } finally {
            close();
        }
    }

    public boolean isRunning() {
        return running;
    }

    // ── Send loop ─────────────────────────────────────────────────────────────

    private void sendLoop(LineSource input) {
        try {
            talkChannel();
            renderer.info("Connected to chat server!");
            renderer.info("Type /help for commands, /quit to leave.");
            while (running) {
                String line = input.readLine();
                if (line == null || !running) {
                    break;
                }
                if (line.isBlank()) {
                    continue;
                }
                CommandResult result = dispatcher.dispatch(line);
                if (result.quit()) {
                    break;
                }
                if (result.roomChange()) {
                    dropTalk();
                    continue;
                }
                if (!result.consumed()) {
                    send(line.trim());
                }
            }
        } catch (ConnectionFailedException e) {
            state.status(ClientState.ConnectionStatus.FAILED);
            renderer.error(e.getMessage());
        } catch (AuthException e) {
            renderer.error("Unauthorized: the server rejected the password");
        } catch (IOException e) {
            renderer.error("Input error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void send(String text) throws InterruptedException {
        String token = encryptForWire(text);
        if (token == null) {
            return;
        }
        ChannelConnection channel = talkChannel();
        channel.drain().forEach(this::handleTalkFrame);
        try {
            channel.send(codec.encode(new ChatFrame(token, state.username(), state.currentRoom(),
                    clock.instant().toString())));
            state.recordSent();
            awaitResponse(channel);
        } catch (TransportException e) {
            log.debug("Send failed: {}", e.getMessage());
            renderer.warning("Connection lost, message not sent. Reconnecting on the next message.");
            dropTalk();
            reconnectPolicy.sleeper().sleep(properties.resendPause());
        }
    }

    /** @return the token to send, or null after telling the user why the text cannot be sent */
    private String encryptForWire(String text) {
        if (text.length() > FieldRules.MAX_CONTENT_LENGTH) {
            renderer.warning("Message too long (max " + FieldRules.MAX_CONTENT_LENGTH + " characters)");
            return null;
        }
        String token = keyring.encrypt(text);
        if (token.length() > FieldRules.MAX_CONTENT_LENGTH) {
            renderer.warning("Message too long once encrypted, please shorten it");
            return null;
        }
        return token;
    }

    private ChannelConnection talkChannel() throws InterruptedException {
        ChannelConnection current = talk;
        if (current != null && current.isOpen() && talkGeneration == state.generation()) {
            return current;
        }
        if (current != null) {
            if (isUnauthorized(current)) {
                throw new AuthException();
            }
            dropTalk();
            state.recordReconnect();
        }
        talkGeneration = state.generation();
        ChannelConnection opened = connectWithRetry(ChannelPath.TALK);
        talk = opened;
        return opened;
    }

    private void dropTalk() {
        ChannelConnection current = talk;
        talk = null;
        if (current != null) {
            current.close();
        }
    }

    /** Waits briefly for the ack or error belonging to the frame just sent. */
    private void awaitResponse(ChannelConnection channel) throws InterruptedException {
        long deadline = System.nanoTime() + properties.responseWait().toNanos();
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            Optional<String> frame = channel.poll(Duration.ofNanos(remaining));
            if (frame.isEmpty()) {
                return;
            }
            if (handleTalkFrame(frame.get())) {
                return;
            }
        }
    }

    /** @return true when the frame answered a sent message */
    private boolean handleTalkFrame(String text) {
        try {
            JsonNode frame = codec.parse(text);
            if (frame.hasNonNull("error")) {
                renderer.error(frame.get("error").asText());
                return true;
            }
            if (frame.hasNonNull("status")) {
                log.debug("Message {} acknowledged", frame.path("message_id").asText());
                return true;
            }
            if (ConnectedEvent.TYPE.equals(FrameCodec.typeOf(frame))) {
                log.debug("Talk channel joined room {}", frame.path("room_id").asText());
            }
        } catch (RuntimeException e) {
            log.warn("Skipping talk frame: {}", e.getMessage());
        }
        return false;
    }

    // ── Receive loop ──────────────────────────────────────────────────────────

    private void receiveLoop() {
        boolean firstConnection = true;
        try {
            while (running) {
                long generation = state.generation();
                ChannelConnection update = connectWithRetry(ChannelPath.UPDATE);
                if (!firstConnection) {
                    state.recordReconnect();
                }
                firstConnection = false;
                try {
                    listen(update, generation);
                } finally {
                    update.close();
                }
                if (isUnauthorized(update)) {
                    renderer.error("Unauthorized: the server rejected the password. Press Enter to exit.");
                    running = false;
                    return;
                }
                if (running && generation == state.generation()) {
                    state.status(ClientState.ConnectionStatus.RECONNECTING);
                    renderer.warning("Message connection lost, reconnecting");
                }
            }
        } catch (ConnectionFailedException e) {
            if (running) {
                state.status(ClientState.ConnectionStatus.FAILED);
                renderer.error(e.getMessage() + ". Press Enter to exit.");
                running = false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void listen(ChannelConnection update, long generation) throws InterruptedException {
        while (running && generation == state.generation()) {
            Optional<String> frame = update.poll(properties.pollInterval());
            if (frame.isPresent()) {
                handleUpdateFrame(frame.get());
            } else if (!update.isOpen()) {
                return;
            }
        }
    }

    void handleUpdateFrame(String text) {
        try {
            JsonNode frame = codec.parse(text);
            String type = FrameCodec.typeOf(frame);
            if (MessageEvent.TYPE.equals(type)) {
                onMessage(codec.convert(frame, MessageEvent.class).message());
            } else if (HeartbeatEvent.TYPE.equals(type)) {
                state.heartbeat(clock.instant(), codec.convert(frame, HeartbeatEvent.class).userCount());
            } else if (RoomUpdateEvent.TYPE.equals(type)) {
                RoomUpdateEvent update = codec.convert(frame, RoomUpdateEvent.class);
                if (update.room() != null && update.room().name() != null) {
                    state.updateMemberCount(update.room().name(), update.room().memberCount());
                }
                update.recentMessages().forEach(this::onMessage);
            } else {
                log.debug("Ignoring '{}' frame on update channel", type);
            }
        } catch (RuntimeException e) {
            log.warn("Skipping update frame: {}", e.getMessage());
        }
    }

    private void onMessage(MessagePayload message) {
        if (message == null || !state.markSeen(message.id())) {
            return;
        }
        boolean system = message.messageType() == MessageType.SYSTEM;
        String content;
        if (message.encrypted()) {
            try {
                content = keyring.decrypt(message.content());
            } catch (CryptoException e) {
                renderer.warning("Could not decrypt message from " + message.username() + ": " + e.getMessage());
                return;
            }
        } else {
            content = message.content();
        }
        Instant timestamp = parseTimestamp(message.timestamp());
        String username = message.username() == null ? "Unknown" : message.username();
        state.addToHistory(new ReceivedMessage(message.id(), username, content, timestamp, system));
        renderer.renderMessage(username, content, timestamp, !system && username.equals(state.username()), system);
    }

    private static Instant parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    // ── Shared ────────────────────────────────────────────────────────────────

    private ChannelConnection connectWithRetry(ChannelPath channel) throws InterruptedException {
        state.status(ClientState.ConnectionStatus.CONNECTING);
        ChannelConnection connection = reconnectPolicy.execute(
                () -> connector.connect(channel, state.username(), state.currentRoom()),
                (attempt, maxAttempts, cause, nextDelay) -> {
                    renderer.error("Connection error on " + channel.path() + ": " + cause.getMessage()
                            + " (attempt " + attempt + "/" + maxAttempts + ")");
                    if (nextDelay != null) {
                        renderer.info("Retrying in " + nextDelay.toMillis() / 1000.0 + " seconds...");
                    }
                });
        state.status(ClientState.ConnectionStatus.CONNECTED);
        renderer.status("Connected " + channel.path() + " to " + state.currentRoom());
        return connection;
    }

    private static boolean isUnauthorized(ChannelConnection connection) {
        return connection.closeCode().orElse(0) == CloseCodes.UNAUTHORIZED;
    }

    /**
     * Stops both loops, sends a best-effort close frame on the talk channel, closes both
     * sockets and zeroes the key. Safe to call more than once and from any thread.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        running = false;
        ChannelConnection current = talk;
        talk = null;
        if (current != null) {
            try {
                current.send(codec.encode(CloseFrame.close()));
                awaitServerClose(current);
            } catch (TransportException e) {
                log.debug("Close frame not sent: {}", e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            current.close();
        }
        Thread thread = receiver;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
            try {
                thread.join(RECEIVER_JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        keyring.destroy();
        state.status(ClientState.ConnectionStatus.DISCONNECTED);
        log.debug("Client closed");
    }

    private void awaitServerClose(ChannelConnection channel) throws InterruptedException {
        long deadline = System.nanoTime() + properties.responseWait().toNanos();
        while (channel.isOpen() && System.nanoTime() < deadline) {
            channel.poll(Duration.ofMillis(20));
        }
    }
}
