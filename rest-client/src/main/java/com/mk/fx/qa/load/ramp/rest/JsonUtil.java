package com.mk.fx.qa.load.ramp.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/** Shared Jackson mapper for request bodies and run reports. */
public final class JsonUtil {

    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    private static final ObjectMapper PRETTY_MAPPER =
            JsonMapper.builder().enable(SerializationFeature.INDENT_OUTPUT).build();

    private JsonUtil() {
        // Utility class, no instantiation
    }

    /** Compact JSON, used for request bodies on the wire. */
    public static String toJson(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    /** Indented JSON, used for reports written to logs. */
    public static String toPrettyJson(Object value) throws JsonProcessingException {
        return PRETTY_MAPPER.writeValueAsString(value);
    }
}
