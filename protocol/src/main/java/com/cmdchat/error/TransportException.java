package com.cmdchat.error;

/** Socket-level failure: refused, timed out, closed, or an outbound buffer that can no longer accept frames. */
public class TransportException extends ChatException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
