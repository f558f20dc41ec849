package de.t14d3.spindle.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.t14d3.spindle.exceptions.SpindleException;

import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;

/**
 * Encodes and decodes JSON-kind column values.
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonCodec() {
    }

    public static String encode(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SpindleException("Failed to encode " + value.getClass().getName() + " as JSON", e);
        }
    }

    /**
     * Decodes a raw column value into {@code type}. Drivers hand JSON columns back
     * as text, bytes or a driver-specific object whose {@code toString()} is the
     * document.
     */
    public static Object decode(Object raw, Type type) {
        if (raw == null) {
            return null;
        }
        String text = raw instanceof byte[] bytes ? new String(bytes, StandardCharsets.UTF_8) : raw.toString();
        JavaType javaType = MAPPER.getTypeFactory().constructType(type);
        try {
            return MAPPER.readValue(text, javaType);
        } catch (JsonProcessingException e) {
            throw new SpindleException("Failed to decode JSON column as " + javaType, e);
        }
    }
}
