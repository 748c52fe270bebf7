package com.cmdchat.keyexchange;

/**
 * Arguments of a {@code /get_key} call, already resolved from body, form or query.
 */
public record KeyExchangeRequest(
        String publicKeyPem,
        String username,
        String password,
        String address
) {}
