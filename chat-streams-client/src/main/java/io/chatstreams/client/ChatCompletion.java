package io.chatstreams.client;

import io.chatstreams.json.spi.JsonNode;

/**
 * Result of a non-streaming chat completion.
 *
 * @param content the generated text, or {@code null} when the server sent none
 * @param usage token usage object (optional)
 * @param quota quota snapshot after the call (optional)
 * @param body the full response document
 */
public record ChatCompletion(String content, JsonNode usage, JsonNode quota, JsonNode body) {
}
