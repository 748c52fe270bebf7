package com.cmdchat.client.support;

import com.cmdchat.client.config.ClientProperties;

import java.time.Duration;

public final class ClientFixtures {

    private ClientFixtures() {
    }

    /** Settings with short waits so loops react within tens of milliseconds. */
    public static ClientProperties properties() {
        return properties(1000);
    }

    public static ClientProperties properties(int port) {
        return new ClientProperties("localhost", port, "alice", "s3cret", "general",
                5, Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofHours(24),
                Duration.ofMillis(20), Duration.ZERO, Duration.ofMillis(200));
    }
}
