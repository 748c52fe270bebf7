package com.cmdchat.error;

/** A single message was dropped because its sender exceeded the sliding-window quota. */
public class RateLimitException extends ChatException {

    public RateLimitException() {
        super("Rate limit exceeded");
    }
}
