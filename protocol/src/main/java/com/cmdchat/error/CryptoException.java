package com.cmdchat.error;

/** Key generation, key wrapping or token encryption failed. Fatal to the current handshake attempt. */
public class CryptoException extends ChatException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
