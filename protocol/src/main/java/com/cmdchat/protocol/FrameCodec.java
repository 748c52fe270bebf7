package com.cmdchat.protocol;

import com.cmdchat.error.ProtocolException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON encoding of channel frames. Decoding is two-step: {@link #parse} checks that the
 * text is a JSON object, then {@link #convert} binds it once the frame type is known.
 */
public class FrameCodec {

    private final ObjectMapper mapper;

    public FrameCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public FrameCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(Object frame) {
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode " + frame.getClass().getSimpleName(), e);
        }
    }

    public JsonNode parse(String text) {
        JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException(ErrorFrame.INVALID_JSON, e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException(ErrorFrame.INVALID_JSON);
        }
        return node;
    }

    public <T> T convert(JsonNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Malformed " + type.getSimpleName(), e);
        }
    }

    public <T> T decode(String text, Class<T> type) {
        return convert(parse(text), type);
    }

    public static String typeOf(JsonNode frame) {
        return frame.path("type").asText("");
    }

    public static boolean isClose(JsonNode frame) {
        return CloseFrame.CLOSE.equals(frame.path("action").asText(null));
    }
}
