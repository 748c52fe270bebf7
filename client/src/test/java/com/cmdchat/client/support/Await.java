package com.cmdchat.client.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

public final class Await {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private Await() {
    }

    public static void until(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for: " + description);
            }
            Thread.sleep(10);
        }
    }
}
