package com.cmdchat.keyexchange;

import com.cmdchat.web.RequestArguments;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@RestController
public class KeyExchangeController {

    static final String UNKNOWN_USER = "unknown";

    private final KeyExchangeService keyExchangeService;
    private final ObjectMapper objectMapper;

    public KeyExchangeController(KeyExchangeService keyExchangeService, ObjectMapper objectMapper) {
        this.keyExchangeService = keyExchangeService;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the server's symmetric key encrypted for the supplied public key, as raw
     * bytes. Accepts {@code pubkey}, {@code username} and {@code password} from the
     * body, a form field or the query string.
     */
    @RequestMapping(path = "/get_key", method = {RequestMethod.GET, RequestMethod.POST})
    public Mono<ResponseEntity<byte[]>> getKey(ServerWebExchange exchange) {
        return RequestArguments.from(exchange, objectMapper)
                .map(args -> new KeyExchangeRequest(
                        args.get("pubkey"),
                        args.getOrDefault("username", UNKNOWN_USER),
                        args.get("password"),
                        args.remoteAddress()))
                .flatMap(keyExchangeService::exchange)
                .map(wrapped -> ResponseEntity.ok()
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .body(wrapped));
    }
}
