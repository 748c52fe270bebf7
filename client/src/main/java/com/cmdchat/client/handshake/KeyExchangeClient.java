package com.cmdchat.client.handshake;

import com.cmdchat.crypto.KeyExchangeCipher;
import com.cmdchat.crypto.TokenCipher;
import com.cmdchat.error.AuthException;
import com.cmdchat.error.TransportException;
import com.cmdchat.error.ValidationException;
import com.cmdchat.protocol.ErrorFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.time.Duration;
import java.util.Arrays;
import java.util.function.Supplier;

/**
 * Client half of the hybrid handshake.
 *
 * Flow:
 *   1. Generate a fresh RSA keypair.
 *   2. Upload the PEM public key with username and password to {@code /get_key}.
 *   3. Unwrap the returned bytes with the private key into the shared symmetric key.
 * The keypair goes out of scope when this call returns.
 */
public class KeyExchangeClient {

    private static final Logger log = LoggerFactory.getLogger(KeyExchangeClient.class);

    private final WebClient webClient;
    private final Duration messageMaxAge;
    private final Duration timeout;
    private final Supplier<KeyPair> keyPairs;

    public KeyExchangeClient(WebClient webClient, Duration messageMaxAge, Duration timeout) {
        this(webClient, messageMaxAge, timeout, KeyExchangeCipher::generateKeyPair);
    }

    KeyExchangeClient(WebClient webClient, Duration messageMaxAge, Duration timeout, Supplier<KeyPair> keyPairs) {
        this.webClient = webClient;
        this.messageMaxAge = messageMaxAge;
        this.timeout = timeout;
        this.keyPairs = keyPairs;
    }

    /**
     * @throws AuthException       the server rejected the password
     * @throws ValidationException the server rejected the request arguments
     * @throws TransportException  the server could not be reached or answered unexpectedly
     * @throws com.cmdchat.error.CryptoException the response could not be unwrapped
     */
    public ClientKeyring exchange(String username, String password) {
        KeyPair keyPair = keyPairs.get();

        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("pubkey", KeyExchangeCipher.encodePublicKey(keyPair.getPublic()).getBytes(StandardCharsets.UTF_8))
                .filename("public_key.pem")
                .contentType(MediaType.APPLICATION_OCTET_STREAM);
        body.part("username", username == null ? "" : username);
        body.part("password", password == null ? "" : password);

        byte[] wrapped = request(body);
        byte[] key = KeyExchangeCipher.unwrap(wrapped, keyPair.getPrivate());
        try {
            log.debug("Key exchange completed for {}", username);
            return new ClientKeyring(new TokenCipher(key, messageMaxAge));
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    private byte[] request(MultipartBodyBuilder body) {
        try {
            return webClient.post()
                    .uri("/get_key")
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(body.build()))
                    .retrieve()
                    .onStatus(status -> status.value() == HttpStatus.UNAUTHORIZED.value(),
                            response -> Mono.error(new AuthException()))
                    .onStatus(status -> status.value() == HttpStatus.BAD_REQUEST.value(),
                            response -> response.bodyToMono(ErrorFrame.class)
                                    .map(error -> new ValidationException(error.error()))
                                    .defaultIfEmpty(new ValidationException("bad request")))
                    .bodyToMono(byte[].class)
                    .block(timeout);
        } catch (WebClientRequestException e) {
            throw new TransportException("Cannot reach server: " + e.getMessage(), e);
        } catch (WebClientResponseException e) {
            throw new TransportException("Key exchange failed with HTTP " + e.getStatusCode().value(), e);
        } catch (IllegalStateException e) {
            throw new TransportException("Key exchange timed out after " + timeout.toSeconds() + "s", e);
        }
    }
}
