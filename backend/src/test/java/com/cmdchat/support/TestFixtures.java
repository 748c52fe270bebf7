package com.cmdchat.support;

import com.cmdchat.config.ChatProperties;

import java.time.Duration;

/** Hand-built settings for tests that do not start a Spring context. */
public final class TestFixtures {

    private TestFixtures() {
    }

    public static ChatProperties properties() {
        return properties(null);
    }

    public static ChatProperties properties(String adminPassword) {
        return new ChatProperties(
                adminPassword,
                "general",
                new ChatProperties.RateLimit(10, Duration.ofSeconds(60)),
                new ChatProperties.History(10_000, 50),
                Duration.ofSeconds(30),
                256,
                50);
    }

    public static ChatProperties withHistory(int maxMessages, int snapshotSize) {
        ChatProperties base = properties();
        return new ChatProperties(base.adminPassword(), base.defaultRoom(), base.rateLimit(),
                new ChatProperties.History(maxMessages, snapshotSize), base.heartbeatInterval(),
                base.outboundBufferSize(), base.roomCapacity());
    }
}
