package com.cmdchat.keyexchange;

import com.cmdchat.auth.AdminPasswordVerifier;
import com.cmdchat.crypto.KeyExchangeCipher;
import com.cmdchat.error.ValidationException;
import com.cmdchat.registry.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.security.PublicKey;
import java.util.Arrays;

/**
 * Server half of the hybrid handshake.
 *
 * Flow:
 *   1. Verify the admin password (no key material leaves on mismatch).
 *   2. Parse the client's PEM public key.
 *   3. Wrap the process-wide symmetric key with RSA-OAEP for that key.
 * Every client that completes the handshake ends up holding the same symmetric key,
 * which never crosses the wire in the clear.
 */
@Service
public class KeyExchangeService {

    private static final Logger log = LoggerFactory.getLogger(KeyExchangeService.class);

    private final AdminPasswordVerifier passwordVerifier;
    private final RoomRegistry registry;

    public KeyExchangeService(AdminPasswordVerifier passwordVerifier, RoomRegistry registry) {
        this.passwordVerifier = passwordVerifier;
        this.registry = registry;
    }

    public Mono<byte[]> exchange(KeyExchangeRequest request) {
        return Mono.fromCallable(() -> {
            passwordVerifier.verify(request.password());
            PublicKey clientKey = KeyExchangeCipher.decodePublicKey(request.publicKeyPem());

            byte[] secret = registry.symmetricKey();
            try {
                byte[] wrapped = KeyExchangeCipher.wrap(secret, clientKey);
                recordUser(request);
                return wrapped;
            } finally {
                Arrays.fill(secret, (byte) 0);
            }
        });
    }

    private void recordUser(KeyExchangeRequest request) {
        try {
            registry.resolveUser(request.address(), request.username());
            log.info("Key exchange completed for {}:{}", request.address(), request.username());
        } catch (ValidationException e) {
            log.info("Key exchange completed for {} with unusable username: {}", request.address(), e.getMessage());
        }
    }
}
