package io.chatstreams.client;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One chat message to stream a response for.
 *
 * @param sessionId chat session id
 * @param content user message text
 * @param images inline images, empty when none
 * @param options feature options
 */
public record ChatStreamRequest(long sessionId, String content, List<ImageAttachment> images, ChatStreamOptions options) {

    public ChatStreamRequest {
        Objects.requireNonNull(content, "content");
        images = images == null ? List.of() : List.copyOf(images);
        options = options == null ? ChatStreamOptions.none() : options;
    }

    public static ChatStreamRequest of(long sessionId, String content) {
        return new ChatStreamRequest(sessionId, content, List.of(), ChatStreamOptions.none());
    }

    public ChatStreamRequest withStreamKey(String streamKey) {
        return new ChatStreamRequest(sessionId, content, images, options.toBuilder().streamKey(streamKey).build());
    }

    /**
     * Builds the JSON body: {@code {sessionId, content, images?, ...options}}.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", sessionId);
        payload.put("content", content);
        if (!images.isEmpty()) {
            List<Map<String, String>> wire = new ArrayList<>(images.size());
            for (ImageAttachment image : images) {
                Map<String, String> entry = new LinkedHashMap<>();
                entry.put("data", image.data());
                entry.put("mime", image.mime());
                wire.add(entry);
            }
            payload.put("images", wire);
        }
        payload.putAll(options.wireFields());
        return payload;
    }
}
