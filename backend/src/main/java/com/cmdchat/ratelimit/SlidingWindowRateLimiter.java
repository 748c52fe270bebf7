package com.cmdchat.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-user sliding window: at most {@code limit} accepted events within any trailing
 * {@code window}. Rejected attempts are not recorded. State is keyed by user id and is
 * kept for the process lifetime, so reconnecting does not reset a user's quota.
 */
public class SlidingWindowRateLimiter {

    private final int limit;
    private final Duration window;
    private final Clock clock;
    private final ConcurrentMap<String, Deque<Instant>> accepted = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(int limit, Duration window, Clock clock) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        this.limit = limit;
        this.window = window;
        this.clock = clock;
    }

    public boolean tryAcquire(String userId) {
        Instant now = clock.instant();
        Deque<Instant> timestamps = accepted.computeIfAbsent(userId, id -> new ArrayDeque<>());
        synchronized (timestamps) {
            evictExpired(timestamps, now);
            if (timestamps.size() >= limit) {
                return false;
            }
            timestamps.addLast(now);
            return true;
        }
    }

    /** Accepted events still inside the window for this user. */
    public int recentCount(String userId) {
        Deque<Instant> timestamps = accepted.get(userId);
        if (timestamps == null) {
            return 0;
        }
        synchronized (timestamps) {
            evictExpired(timestamps, clock.instant());
            return timestamps.size();
        }
    }

    private void evictExpired(Deque<Instant> timestamps, Instant now) {
        Instant cutoff = now.minus(window);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }
}
