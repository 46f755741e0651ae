package com.mk.fx.qa.load.ramp.rest;

import java.util.Arrays;

/** HTTP methods the load client is able to issue. */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS;

    /**
     * Resolves a method name case-insensitively.
     *
     * @param value the method name, e.g. {@code "post"}
     * @return the matching method
     * @throws IllegalArgumentException if the value is blank or not a supported method
     */
    public static HttpMethod fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("HTTP method is required");
        }
        return Arrays.stream(values())
                .filter(method -> method.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported HTTP method: " + value));
    }
}
