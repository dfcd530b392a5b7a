package io.chatstreams.core;

/**
 * Chat stream protocol constants (paths, header names, framing tokens and event type names).
 *
 * <p>This class intentionally contains no HTTP client bindings. It only models wire-level concerns
 * shared by the reader and the request side.
 */
public final class Protocol {
    private Protocol() {}

    // Endpoint paths, relative to the API base URI
    public static final String PATH_CHAT_STREAM = "chat/stream";
    public static final String PATH_CHAT_STREAM_CANCEL = "chat/stream/cancel";
    public static final String PATH_CHAT_COMPLETION = "chat/completion";

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_ACCEPT = "Accept";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_EVENT_STREAM = "text/event-stream";

    // SSE framing
    public static final String DATA_PREFIX = "data:";
    public static final String COMMENT_PREFIX = ":";

    /** Payload of the {@code data:} line that marks a successful end of generation. */
    public static final String DONE_SENTINEL = "[DONE]";

    /** Error code carried by {@link ChatStreamException.IncompleteStream}. */
    public static final String CODE_STREAM_INCOMPLETE = "STREAM_INCOMPLETE";

    // Payload discriminator
    public static final String F_TYPE = "type";
    public static final String F_ERROR = "error";

    // Event types
    public static final String T_CONTENT = "content";
    public static final String T_USAGE = "usage";
    public static final String T_REASONING = "reasoning";
    public static final String T_REASONING_UNAVAILABLE = "reasoning_unavailable";
    public static final String T_TOOL = "tool";
    public static final String T_IMAGE = "image";
    public static final String T_ARTIFACT = "artifact";
    public static final String T_START = "start";
    public static final String T_END = "end";
    public static final String T_COMPLETE = "complete";
    public static final String T_SKILL_APPROVAL_REQUEST = "skill_approval_request";
    public static final String T_SKILL_APPROVAL_RESULT = "skill_approval_result";
    public static final String T_QUOTA = "quota";
    public static final String T_ERROR = "error";
}
