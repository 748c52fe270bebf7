package com.cmdchat.client;

import com.cmdchat.client.command.CommandDispatcher;
import com.cmdchat.client.config.ClientProperties;
import com.cmdchat.client.connection.ChannelConnector;
import com.cmdchat.client.connection.ReconnectPolicy;
import com.cmdchat.client.handshake.ClientKeyring;
import com.cmdchat.client.handshake.KeyExchangeClient;
import com.cmdchat.client.render.ChatRenderer;
import com.cmdchat.client.render.ConsoleLineSource;
import com.cmdchat.error.AuthException;
import com.cmdchat.error.ChatException;
import com.cmdchat.error.ValidationException;
import com.cmdchat.protocol.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Validates the username, performs the key exchange, then hands the terminal to a
 * {@link ChatClient} until the user leaves.
 */
@Component
public class ChatClientRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ChatClientRunner.class);

    private final ClientProperties properties;
    private final KeyExchangeClient keyExchangeClient;
    private final ChannelConnector connector;
    private final ReconnectPolicy reconnectPolicy;
    private final ChatRenderer renderer;
    private final FrameCodec codec;
    private final Clock clock;

    public ChatClientRunner(ClientProperties properties, KeyExchangeClient keyExchangeClient,
                            ChannelConnector connector, ReconnectPolicy reconnectPolicy,
                            ChatRenderer renderer, FrameCodec codec, Clock clock) {
        this.properties = properties;
        this.keyExchangeClient = keyExchangeClient;
        this.connector = connector;
        this.reconnectPolicy = reconnectPolicy;
        this.renderer = renderer;
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        ClientState state;
        try {
            state = new ClientState(properties.username(), properties.room(), clock.instant());
        } catch (ValidationException e) {
            renderer.error("Invalid username: " + e.getMessage()
                    + ". Start with --chat.client.username=<name>");
            return;
        }

        renderer.info("Starting CMD Chat...");
        renderer.info("Connecting to " + properties.serverLabel());
        ClientKeyring keyring;
        try {
            keyring = keyExchangeClient.exchange(state.username(), properties.password());
        } catch (AuthException e) {
            renderer.error("Wrong password");
            return;
        } catch (ChatException e) {
            log.debug("Key exchange failed", e);
            renderer.error("Key exchange failed: " + e.getMessage());
            return;
        }

        ChatClient client = new ChatClient(properties, state, keyring, connector, reconnectPolicy,
                new CommandDispatcher(state, renderer, properties.serverLabel(), clock),
                renderer, codec, clock);
        Thread shutdownHook = new Thread(client::close, "chat-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        client.run(new ConsoleLineSource(System.in, System.out, state));

        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down");
        }
    }
}
