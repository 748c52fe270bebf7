package com.cmdchat.error;

/** Terminal: every reconnection attempt allowed by the retry budget has failed. */
public class ConnectionFailedException extends TransportException {

    private final int attempts;

    public ConnectionFailedException(int attempts, Throwable lastFailure) {
        super("Failed to connect after " + attempts + " attempts", lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
