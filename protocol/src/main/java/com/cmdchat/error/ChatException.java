package com.cmdchat.error;

/**
 * Root of the chat error taxonomy.
 *
 * Every failure the server or client reasons about is one of the subtypes below;
 * anything else reaching a handler is treated as an unexpected processing error.
 */
public abstract class ChatException extends RuntimeException {

    protected ChatException(String message) {
        super(message);
    }

    protected ChatException(String message, Throwable cause) {
        super(message, cause);
    }
}
