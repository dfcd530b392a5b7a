package io.chatstreams.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Feature options of a chat stream request.
 *
 * <p>Options are forwarded to the server as top-level fields of the request body. Unset options are
 * omitted. {@link #streamKey()} is local only and never sent.
 */
public final class ChatStreamOptions {

    /** Reasoning effort levels understood by the server. */
    public enum ReasoningEffort {
        LOW, MEDIUM, HIGH;

        String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * An extra upstream header requested by the caller.
     */
    public record CustomHeader(String name, String value) {
        public CustomHeader {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }

    private static final ChatStreamOptions NONE = builder().build();

    private final Map<String, Object> fields;
    private final String streamKey;

    private ChatStreamOptions(Map<String, Object> fields, String streamKey) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.streamKey = streamKey;
    }

    public static ChatStreamOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the fields to merge into the request body, in insertion order, with wire names.
     */
    public Map<String, Object> wireFields() {
        return fields;
    }

    /**
     * Returns the caller-supplied stream key, or {@code null} to generate one.
     */
    public String streamKey() {
        return streamKey;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.fields.putAll(fields);
        b.streamKey = streamKey;
        return b;
    }

    public static final class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private String streamKey;

        private Builder() {}

        public Builder reasoningEnabled(boolean enabled) {
            fields.put("reasoningEnabled", enabled);
            return this;
        }

        public Builder reasoningEffort(ReasoningEffort effort) {
            fields.put("reasoningEffort", Objects.requireNonNull(effort, "effort").wireValue());
            return this;
        }

        public Builder ollamaThink(boolean think) {
            fields.put("ollamaThink", think);
            return this;
        }

        public Builder saveReasoning(boolean save) {
            fields.put("saveReasoning", save);
            return this;
        }

        public Builder contextEnabled(boolean enabled) {
            fields.put("contextEnabled", enabled);
            return this;
        }

        public Builder clientMessageId(String clientMessageId) {
            fields.put("clientMessageId", Objects.requireNonNull(clientMessageId, "clientMessageId"));
            return this;
        }

        public Builder traceEnabled(boolean enabled) {
            fields.put("traceEnabled", enabled);
            return this;
        }

        public Builder replyToMessageId(long messageId) {
            fields.put("replyToMessageId", messageId);
            return this;
        }

        /** Blank ids are not sent; others are trimmed. */
        public Builder replyToClientMessageId(String clientMessageId) {
            if (clientMessageId == null || clientMessageId.isBlank()) {
                fields.remove("replyToClientMessageId");
            } else {
                fields.put("replyToClientMessageId", clientMessageId.trim());
            }
            return this;
        }

        /** Sent as {@code custom_body}. */
        public Builder customBody(Map<String, ?> customBody) {
            fields.put("custom_body", new LinkedHashMap<>(Objects.requireNonNull(customBody, "customBody")));
            return this;
        }

        /** Sent as {@code custom_headers}. */
        public Builder customHeaders(List<CustomHeader> headers) {
            List<Map<String, String>> wire = new ArrayList<>();
            for (CustomHeader h : Objects.requireNonNull(headers, "headers")) {
                Map<String, String> entry = new LinkedHashMap<>();
                entry.put("name", h.name());
                entry.put("value", h.value());
                wire.add(entry);
            }
            fields.put("custom_headers", wire);
            return this;
        }

        public Builder knowledgeBaseIds(List<Long> ids) {
            fields.put("knowledgeBaseIds", List.copyOf(Objects.requireNonNull(ids, "ids")));
            return this;
        }

        /**
         * Adds an option this builder has no typed setter for. The name is sent as given, except
         * {@code customBody} and {@code customHeaders}, which always go out as {@code custom_body}
         * and {@code custom_headers}.
         */
        public Builder extra(String name, Object value) {
            Objects.requireNonNull(name, "name");
            switch (name) {
                case "streamKey":
                    throw new IllegalArgumentException("streamKey is not a wire field, use streamKey(String)");
                case "customBody":
                    fields.put("custom_body", value);
                    break;
                case "customHeaders":
                    fields.put("custom_headers", value);
                    break;
                default:
                    fields.put(name, value);
            }
            return this;
        }

        /** Blank keys are ignored so that a key is generated. */
        public Builder streamKey(String streamKey) {
            this.streamKey = streamKey == null || streamKey.isBlank() ? null : streamKey.trim();
            return this;
        }

        public ChatStreamOptions build() {
            return new ChatStreamOptions(fields, streamKey);
        }
    }
}
