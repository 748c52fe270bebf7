package com.cmdchat.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Used both as an inline channel frame and as the body of REST error responses. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorFrame(@JsonProperty("error") String error) {

    public static final String INVALID_JSON = "Invalid JSON";
    public static final String PROCESSING_FAILED = "Message processing failed";
}
