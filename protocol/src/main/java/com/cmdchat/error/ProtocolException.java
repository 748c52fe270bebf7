package com.cmdchat.error;

/** A frame could not be decoded. Non-fatal: one error frame is emitted and the channel continues. */
public class ProtocolException extends ChatException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
