package com.cmdchat.error;

/**
 * Wrong or missing admin password. The message is deliberately generic so a
 * rejection never tells the caller anything about which usernames exist.
 */
public class AuthException extends ChatException {

    public AuthException() {
        super("unauthorized");
    }
}
