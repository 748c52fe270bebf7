package com.cmdchat.error;

/** A room, user or message field failed validation. The request is rejected with no state change. */
public class ValidationException extends ChatException {

    public ValidationException(String message) {
        super(message);
    }
}
