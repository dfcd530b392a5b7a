package io.chatstreams.core;

import io.chatstreams.json.spi.JsonCodec;
import io.chatstreams.json.spi.JsonException;
import io.chatstreams.json.spi.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps one {@code data:} payload to at most one {@link Chunk}.
 *
 * <p>Dispatch is on the {@code type} field. Each arm validates only its own fields, and a payload
 * missing the fields its type requires yields {@code null} rather than an empty chunk. Unknown types
 * are ignored so that new server events never break older readers. The one fatal case is a payload
 * with a truthy {@code error} field and no recognized type: that raises
 * {@link ChatStreamException.ProtocolError}.
 *
 * <p>Stateless and thread-safe.
 */
public final class EventClassifier {

    private static final Logger log = LoggerFactory.getLogger(EventClassifier.class);

    static final String DEFAULT_ERROR_MESSAGE = "Tool call failed, please retry later";
    private static final double LONG_RANGE = 0x1p63;

    private final JsonCodec codec;
    private final boolean debug;

    public EventClassifier(JsonCodec codec) {
        this(codec, false);
    }

    /**
     * @param codec codec used to parse payloads
     * @param debug log skipped payloads at DEBUG level
     */
    public EventClassifier(JsonCodec codec, boolean debug) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.debug = debug;
    }

    /**
     * Parses a payload and classifies it.
     *
     * @return the chunk, or {@code null} when the payload is malformed or not a recognized event
     * @throws ChatStreamException.ProtocolError for an unrecognized payload carrying an error
     */
    public Chunk classify(String payload) {
        return tryParse(payload).map(this::classify).orElse(null);
    }

    /**
     * Parses a payload into a JSON object. Never throws.
     *
     * @return the object, or empty when the payload is not valid JSON or not an object
     */
    public Optional<JsonNode> tryParse(String payload) {
        JsonNode node;
        try {
            node = codec.readTree(payload);
        } catch (JsonException e) {
            if (debug) {
                log.debug("[chat-stream] JSON parse ignore: {}", e.getMessage());
            }
            return Optional.empty();
        }
        if (!node.isObject()) {
            if (debug) {
                log.debug("[chat-stream] non-object payload ignored: {}", node.getNodeType());
            }
            return Optional.empty();
        }
        return Optional.of(node);
    }

    /**
     * Classifies a parsed payload.
     *
     * @return the chunk, or {@code null} to ignore the payload
     * @throws ChatStreamException.ProtocolError for an unrecognized payload carrying an error
     */
    public Chunk classify(JsonNode payload) {
        String type = text(payload, Protocol.F_TYPE);
        switch (type == null ? "" : type) {
            case Protocol.T_CONTENT:
                return content(payload);
            case Protocol.T_USAGE:
                return usage(payload);
            case Protocol.T_REASONING:
                return reasoning(payload);
            case Protocol.T_REASONING_UNAVAILABLE:
                return new Chunk.ReasoningUnavailable(
                        scalar(payload, "code"),
                        scalar(payload, "reason"),
                        scalar(payload, "suggestion"),
                        scalar(payload, "protocol"),
                        scalar(payload, "decision"));
            case Protocol.T_TOOL:
                return new Chunk.ToolEvent(
                        scalar(payload, "tool"),
                        scalar(payload, "stage"),
                        scalar(payload, "id"),
                        scalar(payload, "query"),
                        present(payload, "hits"),
                        scalar(payload, "error"),
                        scalar(payload, "summary"),
                        present(payload, "details"),
                        present(payload, "meta"));
            case Protocol.T_IMAGE:
                return new Chunk.ImageEvent(present(payload, "generatedImages"), number(payload, "messageId"));
            case Protocol.T_ARTIFACT:
                return artifact(payload);
            case Protocol.T_START:
                return start(payload);
            case Protocol.T_END:
                return new Chunk.StreamEnd();
            case Protocol.T_COMPLETE:
                return new Chunk.StreamComplete();
            case Protocol.T_SKILL_APPROVAL_REQUEST:
                return new Chunk.SkillApprovalRequest(
                        number(payload, "requestId"),
                        number(payload, "skillId"),
                        text(payload, "skillSlug"),
                        number(payload, "skillVersionId"),
                        text(payload, "tool"),
                        text(payload, "toolCallId"),
                        text(payload, "reason"),
                        scalar(payload, "expiresAt"));
            case Protocol.T_SKILL_APPROVAL_RESULT:
                return new Chunk.SkillApprovalResult(
                        number(payload, "requestId"),
                        number(payload, "skillId"),
                        text(payload, "skillSlug"),
                        text(payload, "tool"),
                        text(payload, "toolCallId"),
                        text(payload, "decision"));
            case Protocol.T_QUOTA:
                return quota(payload);
            case Protocol.T_ERROR:
                return error(payload);
            default:
                JsonNode error = payload.get(Protocol.F_ERROR);
                if (isTruthy(error)) {
                    throw new ChatStreamException.ProtocolError(error.isTextual() ? error.asText() : error.toJson());
                }
                return null;
        }
    }

    private static Chunk content(JsonNode payload) {
        String content = text(payload, "content");
        return content == null || content.isEmpty() ? null : new Chunk.ContentDelta(content);
    }

    private static Chunk usage(JsonNode payload) {
        JsonNode usage = payload.get("usage");
        return usage != null && usage.isObject() ? new Chunk.Usage(usage) : null;
    }

    private static Chunk reasoning(JsonNode payload) {
        JsonNode meta = present(payload, "meta");
        if (isTruthy(payload.get("done"))) {
            return Chunk.Reasoning.finished(decimal(payload, "duration"), meta);
        }
        if (isTruthy(payload.get("keepalive"))) {
            return Chunk.Reasoning.heartbeat(decimal(payload, "idle_ms"), meta);
        }
        String content = text(payload, "content");
        if (content != null && !content.isEmpty()) {
            return Chunk.Reasoning.delta(content, meta);
        }
        return null;
    }

    private static Chunk artifact(JsonNode payload) {
        JsonNode artifacts = payload.get("artifacts");
        if (artifacts == null || !artifacts.isArray()) {
            return null;
        }
        List<JsonNode> items = new ArrayList<>(artifacts.size());
        for (Iterator<JsonNode> it = artifacts.elements(); it.hasNext(); ) {
            items.add(it.next());
        }
        return new Chunk.ArtifactEvent(items, number(payload, "messageId"));
    }

    private static Chunk start(JsonNode payload) {
        Long messageId = firstNonNull(number(payload, "messageId"), number(payload, "message_id"));
        Long assistantMessageId = firstNonNull(
                number(payload, "assistantMessageId"),
                number(payload, "assistant_message_id"));
        String assistantClientMessageId = firstNonNull(
                text(payload, "assistantClientMessageId"),
                text(payload, "assistant_client_message_id"));
        return new Chunk.StreamStart(messageId, assistantMessageId, assistantClientMessageId);
    }

    private static Chunk quota(JsonNode payload) {
        JsonNode quota = payload.get("quota");
        return quota != null && quota.isObject() ? new Chunk.Quota(quota) : null;
    }

    private static Chunk error(JsonNode payload) {
        String message = text(payload, Protocol.F_ERROR);
        if (message == null || message.isBlank()) {
            message = DEFAULT_ERROR_MESSAGE;
        }
        return new Chunk.ErrorChunk(message, scalar(payload, "errorType"), scalar(payload, "suggestion"));
    }

    // ===== field access =====

    /** String field, or null when absent or not a string. */
    private static String text(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    /** Integral numeric field, or null when absent, not a number, fractional or outside the long range. */
    private static Long number(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isNumber()) {
            return null;
        }
        double value = node.asDouble();
        if (value != Math.rint(value) || Math.abs(value) >= LONG_RANGE) {
            return null;
        }
        return node.asLong();
    }

    /** Numeric field as sent, or null when absent or not a number. */
    private static Double decimal(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node != null && node.isNumber() ? node.asDouble() : null;
    }

    /** Scalar field rendered as text, or null when absent, null or structured. */
    private static String scalar(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull() || node.isObject() || node.isArray()) {
            return null;
        }
        return node.asText();
    }

    /** Any non-null field. */
    private static JsonNode present(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node == null || node.isNull() ? null : node;
    }

    private static boolean isTruthy(JsonNode node) {
        if (node == null) {
            return false;
        }
        switch (node.getNodeType()) {
            case BOOLEAN:
                return node.asBoolean();
            case STRING:
                return !node.asText().isEmpty();
            case NUMBER:
                double d = node.asDouble();
                return d != 0 && !Double.isNaN(d);
            case NULL:
                return false;
            default:
                return true;
        }
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }
}
