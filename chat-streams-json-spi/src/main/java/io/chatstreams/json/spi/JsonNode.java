package io.chatstreams.json.spi;

import java.util.Iterator;

/**
 * Abstraction for a JSON tree node. Represents any JSON value (object, array, string, number, boolean, null).
 * Implementations should provide access to node content and structure without exposing
 * the underlying JSON library.
 *
 * <p>Nodes are read-only views. Two nodes are equal when they represent the same JSON value.
 */
public interface JsonNode {

    /**
     * Returns the node type.
     */
    JsonNodeType getNodeType();

    /**
     * Returns true if this is an object node.
     */
    default boolean isObject() {
        return getNodeType() == JsonNodeType.OBJECT;
    }

    /**
     * Returns true if this is an array node.
     */
    default boolean isArray() {
        return getNodeType() == JsonNodeType.ARRAY;
    }

    /**
     * Returns true if this is a text node.
     */
    default boolean isTextual() {
        return getNodeType() == JsonNodeType.STRING;
    }

    /**
     * Returns true if this is a numeric node.
     */
    default boolean isNumber() {
        return getNodeType() == JsonNodeType.NUMBER;
    }

    /**
     * Returns true if this is a null node.
     */
    default boolean isNull() {
        return getNodeType() == JsonNodeType.NULL;
    }

    /**
     * Gets a field by name from an object node.
     * Returns null if this is not an object or the field doesn't exist.
     */
    JsonNode get(String fieldName);

    /**
     * Returns true if this node has a field with the given name.
     */
    boolean has(String fieldName);

    /**
     * Returns the size of this node.
     * For objects: number of fields
     * For arrays: number of elements
     * For others: 0
     */
    int size();

    /**
     * Returns the text value of this node.
     * For text nodes: the string value
     * For other types: string representation
     */
    String asText();

    /**
     * Returns the long value of this node.
     * For numeric nodes: the long value
     * For text nodes: parsed long
     * For others: 0
     */
    long asLong();

    /**
     * Returns the double value of this node.
     */
    double asDouble();

    /**
     * Returns the boolean value of this node.
     */
    boolean asBoolean();

    /**
     * Returns an iterator over the elements (for array nodes).
     */
    Iterator<JsonNode> elements();

    /**
     * Returns the compact JSON text of this node.
     */
    String toJson();
}
