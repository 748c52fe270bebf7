package com.cmdchat.web;

import com.cmdchat.error.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.util.MultiValueMap;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named request arguments resolved through an ordered list of sources:
 * <ol>
 *   <li>request body: a multipart part (file or field) or a top-level JSON field,</li>
 *   <li>url-encoded form field,</li>
 *   <li>query parameter.</li>
 * </ol>
 * The first source holding a non-empty value wins.
 */
public final class RequestArguments {

    @FunctionalInterface
    interface Source {
        Optional<String> lookup(String name);
    }

    private final List<Source> sources;
    private final String remoteAddress;

    RequestArguments(List<Source> sources, String remoteAddress) {
        this.sources = sources;
        this.remoteAddress = remoteAddress;
    }

    public static Mono<RequestArguments> from(ServerWebExchange exchange, ObjectMapper mapper) {
        ServerHttpRequest request = exchange.getRequest();
        Mono<Map<String, String>> body = readBody(exchange, mapper);
        Mono<MultiValueMap<String, String>> form = exchange.getFormData();
        MultiValueMap<String, String> query = request.getQueryParams();

        return Mono.zip(body, form).map(tuple -> new RequestArguments(
                List.of(fromMap(tuple.getT1()), fromMultiMap(tuple.getT2()), fromMultiMap(query)),
                hostOf(request.getRemoteAddress())));
    }

    public Optional<String> first(String name) {
        for (Source source : sources) {
            Optional<String> value = source.lookup(name).filter(v -> !v.isEmpty());
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public String get(String name) {
        return first(name).orElse(null);
    }

    public String getOrDefault(String name, String fallback) {
        return first(name).orElse(fallback);
    }

    public String remoteAddress() {
        return remoteAddress;
    }

    private static Mono<Map<String, String>> readBody(ServerWebExchange exchange, ObjectMapper mapper) {
        MediaType contentType = exchange.getRequest().getHeaders().getContentType();
        if (contentType == null) {
            return Mono.just(Map.of());
        }
        if (MediaType.MULTIPART_FORM_DATA.isCompatibleWith(contentType)) {
            return exchange.getMultipartData()
                    .flatMapMany(parts -> Flux.fromIterable(parts.toSingleValueMap().values()))
                    .flatMap(part -> partValue(part).map(value -> Map.entry(part.name(), value)))
                    .collectMap(Map.Entry::getKey, Map.Entry::getValue);
        }
        if (MediaType.APPLICATION_JSON.isCompatibleWith(contentType)) {
            return DataBufferUtils.join(exchange.getRequest().getBody())
                    .map(buffer -> jsonFields(mapper, consume(buffer)))
                    .defaultIfEmpty(Map.of());
        }
        return Mono.just(Map.of());
    }

    private static Mono<String> partValue(Part part) {
        if (part instanceof FormFieldPart) {
            return Mono.just(((FormFieldPart) part).value());
        }
        return DataBufferUtils.join(part.content()).map(RequestArguments::consume);
    }

    private static String consume(DataBuffer buffer) {
        try {
            return buffer.toString(StandardCharsets.UTF_8);
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    private static Map<String, String> jsonFields(ObjectMapper mapper, String json) {
        if (json.isBlank()) {
            return Map.of();
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException("invalid JSON body");
        }
        Map<String, String> fields = new HashMap<>();
        if (root != null && root.isObject()) {
            root.fields().forEachRemaining(field -> {
                if (field.getValue().isValueNode() && !field.getValue().isNull()) {
                    fields.put(field.getKey(), field.getValue().asText());
                }
            });
        }
        return fields;
    }

    private static Source fromMap(Map<String, String> values) {
        return name -> Optional.ofNullable(values.get(name));
    }

    private static Source fromMultiMap(MultiValueMap<String, String> values) {
        return name -> Optional.ofNullable(values.getFirst(name));
    }

    /** Textual host of a peer address, {@code unknown} when the transport does not expose one. */
    public static String hostOf(InetSocketAddress remote) {
        if (remote == null) {
            return "unknown";
        }
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }
}
