package com.cmdchat.client.handshake;

import com.cmdchat.crypto.TokenCipher;

/**
 * The symmetric key this client obtained in the handshake, wrapped in its token cipher.
 * The RSA keypair used to receive it is not retained.
 */
public class ClientKeyring {

    private final TokenCipher cipher;

    public ClientKeyring(TokenCipher cipher) {
        this.cipher = cipher;
    }

    public String encrypt(String plaintext) {
        return cipher.encrypt(plaintext);
    }

    public String decrypt(String token) {
        return cipher.decrypt(token);
    }

    /** Zeroes the key. Further encrypt or decrypt calls fail. */
    public void destroy() {
        cipher.destroy();
    }

    public boolean isDestroyed() {
        return cipher.isDestroyed();
    }
}
