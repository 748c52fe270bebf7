package com.cmdchat.client.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Client settings, bound from {@code chat.client.*}. Pass them on the command line,
 * e.g. {@code --chat.client.username=alice --chat.client.password=secret}.
 *
 * @param maxRetries     connection attempts per channel before giving up
 * @param baseDelay      first backoff pause; doubled after every failed attempt
 * @param messageMaxAge  oldest message token the client still decrypts; zero disables the check
 * @param pollInterval   how long the receive loop waits for a frame before re-checking its state
 * @param resendPause    pause after the talk channel drops, before the next send reconnects
 * @param responseWait   how long a send waits for the server's ack or error
 */
@ConfigurationProperties(prefix = "chat.client")
public record ClientProperties(
        @DefaultValue("localhost") String host,
        @DefaultValue("1000") int port,
        String username,
        String password,
        @DefaultValue("general") String room,
        @DefaultValue("5") int maxRetries,
        @DefaultValue("1s") Duration baseDelay,
        @DefaultValue("10s") Duration connectTimeout,
        @DefaultValue("24h") Duration messageMaxAge,
        @DefaultValue("1s") Duration pollInterval,
        @DefaultValue("2s") Duration resendPause,
        @DefaultValue("500ms") Duration responseWait
) {

    public String httpBaseUrl() {
        return "http://" + host + ":" + port;
    }

    public String webSocketBaseUrl() {
        return "ws://" + host + ":" + port;
    }

    public String serverLabel() {
        return host + ":" + port;
    }
}
