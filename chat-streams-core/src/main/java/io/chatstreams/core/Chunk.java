package io.chatstreams.core;

import io.chatstreams.json.spi.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * Normalized events of a chat stream.
 *
 * <p>Each chunk corresponds to exactly one {@code data:} line whose JSON payload was recognized by
 * {@link EventClassifier}. Free-form parts of a payload (usage, quota, tool details, metadata) are kept
 * as {@link JsonNode} views; fields marked optional are {@code null} when absent.
 */
public sealed interface Chunk permits
        Chunk.ContentDelta,
        Chunk.Usage,
        Chunk.Reasoning,
        Chunk.ReasoningUnavailable,
        Chunk.ToolEvent,
        Chunk.ImageEvent,
        Chunk.ArtifactEvent,
        Chunk.StreamStart,
        Chunk.StreamEnd,
        Chunk.StreamComplete,
        Chunk.SkillApprovalRequest,
        Chunk.SkillApprovalResult,
        Chunk.Quota,
        Chunk.ErrorChunk {

    /**
     * Returns the wire discriminator of this chunk.
     */
    String type();

    /**
     * A fragment of assistant text.
     *
     * @param content the non-empty text delta
     */
    record ContentDelta(String content) implements Chunk {
        public ContentDelta {
            Objects.requireNonNull(content, "content");
        }

        @Override
        public String type() {
            return Protocol.T_CONTENT;
        }
    }

    /**
     * Token accounting for the response.
     *
     * @param usage the usage object as sent by the server
     */
    record Usage(JsonNode usage) implements Chunk {
        public Usage {
            Objects.requireNonNull(usage, "usage");
        }

        @Override
        public String type() {
            return Protocol.T_USAGE;
        }
    }

    /**
     * A reasoning event in one of three shapes: terminal ({@code done}), heartbeat ({@code keepalive})
     * or incremental ({@code content}).
     *
     * @param content incremental reasoning text (optional)
     * @param done whether reasoning finished
     * @param duration reasoning duration reported with {@code done} (optional)
     * @param keepalive whether this is a heartbeat without new text
     * @param idleMs idle time reported with {@code keepalive} (optional)
     * @param meta provider metadata (optional)
     */
    record Reasoning(String content, boolean done, Double duration, boolean keepalive, Double idleMs, JsonNode meta)
            implements Chunk {

        public static Reasoning finished(Double duration, JsonNode meta) {
            return new Reasoning(null, true, duration, false, null, meta);
        }

        public static Reasoning heartbeat(Double idleMs, JsonNode meta) {
            return new Reasoning(null, false, null, true, idleMs, meta);
        }

        public static Reasoning delta(String content, JsonNode meta) {
            return new Reasoning(Objects.requireNonNull(content, "content"), false, null, false, null, meta);
        }

        @Override
        public String type() {
            return Protocol.T_REASONING;
        }
    }

    /**
     * The selected model cannot produce reasoning for this request.
     */
    record ReasoningUnavailable(String code, String reason, String suggestion, String protocol, String decision)
            implements Chunk {
        @Override
        public String type() {
            return Protocol.T_REASONING_UNAVAILABLE;
        }
    }

    /**
     * Progress of a tool invocation.
     *
     * @param tool tool name
     * @param stage lifecycle stage reported by the server (e.g. {@code start}, {@code result}, {@code error})
     * @param id tool call id (optional)
     * @param query search query (optional)
     * @param hits search hits (optional)
     * @param error error text (optional)
     * @param summary result summary (optional)
     * @param details result details (optional)
     * @param meta metadata (optional)
     */
    record ToolEvent(
            String tool,
            String stage,
            String id,
            String query,
            JsonNode hits,
            String error,
            String summary,
            JsonNode details,
            JsonNode meta
    ) implements Chunk {
        @Override
        public String type() {
            return Protocol.T_TOOL;
        }
    }

    /**
     * Images produced by an image generation model.
     *
     * @param generatedImages the generated images
     * @param messageId owning message id (optional)
     */
    record ImageEvent(JsonNode generatedImages, Long messageId) implements Chunk {
        @Override
        public String type() {
            return Protocol.T_IMAGE;
        }
    }

    /**
     * Files produced by a tool run.
     *
     * @param artifacts artifact descriptors, never {@code null}
     * @param messageId owning message id (optional)
     */
    record ArtifactEvent(List<JsonNode> artifacts, Long messageId) implements Chunk {
        public ArtifactEvent {
            artifacts = List.copyOf(Objects.requireNonNull(artifacts, "artifacts"));
        }

        @Override
        public String type() {
            return Protocol.T_ARTIFACT;
        }
    }

    /**
     * Start of generation, identifying the persisted messages.
     *
     * @param messageId user message id (optional)
     * @param assistantMessageId assistant message id (optional)
     * @param assistantClientMessageId client-side id of the assistant message (optional)
     */
    record StreamStart(Long messageId, Long assistantMessageId, String assistantClientMessageId) implements Chunk {
        @Override
        public String type() {
            return Protocol.T_START;
        }
    }

    /**
     * End of the generated content. Not a completion marker.
     */
    record StreamEnd() implements Chunk {
        @Override
        public String type() {
            return Protocol.T_END;
        }
    }

    /**
     * Successful completion of the whole response.
     */
    record StreamComplete() implements Chunk {
        @Override
        public String type() {
            return Protocol.T_COMPLETE;
        }
    }

    /**
     * A skill needs user approval before one of its tools may run.
     */
    record SkillApprovalRequest(
            Long requestId,
            Long skillId,
            String skillSlug,
            Long skillVersionId,
            String tool,
            String toolCallId,
            String reason,
            String expiresAt
    ) implements Chunk {
        @Override
        public String type() {
            return Protocol.T_SKILL_APPROVAL_REQUEST;
        }
    }

    /**
     * Outcome of a skill approval request.
     */
    record SkillApprovalResult(
            Long requestId,
            Long skillId,
            String skillSlug,
            String tool,
            String toolCallId,
            String decision
    ) implements Chunk {
        @Override
        public String type() {
            return Protocol.T_SKILL_APPROVAL_RESULT;
        }
    }

    /**
     * Updated quota of the caller.
     *
     * @param quota the quota object as sent by the server
     */
    record Quota(JsonNode quota) implements Chunk {
        public Quota {
            Objects.requireNonNull(quota, "quota");
        }

        @Override
        public String type() {
            return Protocol.T_QUOTA;
        }
    }

    /**
     * A structured in-band error event. This is data for the caller to display; it does not end the stream.
     *
     * @param error the error message, never blank
     * @param errorType error classification (optional)
     * @param suggestion remediation hint (optional)
     */
    record ErrorChunk(String error, String errorType, String suggestion) implements Chunk {
        public ErrorChunk {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public String type() {
            return Protocol.T_ERROR;
        }
    }
}
