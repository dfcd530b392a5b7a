package io.chatstreams.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chatstreams.json.spi.JsonCodec;
import io.chatstreams.json.spi.JsonException;
import io.chatstreams.json.spi.JsonNode;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 * Registered through {@code META-INF/services} so clients find it without configuration.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     * Text after the first JSON value is rejected.
     */
    public JacksonJsonCodec() {
        this(new ObjectMapper(new JsonFactory()).enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to bytes", e);
        }
    }

    @Override
    public JsonNode readTree(String json) throws JsonException {
        if (json == null || json.isEmpty()) {
            throw new JsonException("Cannot parse empty JSON text");
        }
        try {
            return wrapRoot(mapper.readTree(json));
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException("Failed to parse JSON text", e);
        }
    }

    @Override
    public JsonNode readTree(byte[] data) throws JsonException {
        if (data == null || data.length == 0) {
            throw new JsonException("Cannot parse empty JSON data");
        }
        try {
            return wrapRoot(mapper.readTree(data));
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException("Failed to parse JSON bytes", e);
        }
    }

    private static JsonNode wrapRoot(com.fasterxml.jackson.databind.JsonNode root) throws JsonException {
        // readTree yields MissingNode for whitespace-only input
        if (root == null || root.isMissingNode()) {
            throw new JsonException("Invalid JSON: no content");
        }
        return new JacksonJsonNode(root);
    }
}
