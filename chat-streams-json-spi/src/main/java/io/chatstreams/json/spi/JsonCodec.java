package io.chatstreams.json.spi;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Minimal JSON codec used by the chat stream pipeline.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Stream payloads are open-ended objects discriminated by a {@code type} field, so reading
 * goes through the {@link JsonNode} tree rather than bound POJOs. Request payloads are plain
 * maps and lists written with {@link #writeBytes(Object)}.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Parses a JSON document into a tree.
     * @param json JSON text
     * @return the root node, never {@code null}
     * @throws JsonException if the text is not valid JSON
     */
    JsonNode readTree(String json) throws JsonException;

    /**
     * Parses a JSON document into a tree.
     * @param data JSON bytes (UTF-8)
     * @return the root node, never {@code null}
     * @throws JsonException if the data is not valid JSON
     */
    JsonNode readTree(byte[] data) throws JsonException;

    /**
     * Finds the first codec registered through {@link ServiceLoader}.
     *
     * @param cl class loader used for the lookup
     * @return the codec, or empty if no implementation is on the class path
     */
    static Optional<JsonCodec> load(ClassLoader cl) {
        return ServiceLoader.load(JsonCodec.class, cl).findFirst();
    }
}
