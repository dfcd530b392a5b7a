package io.chatstreams.core;

import io.chatstreams.json.spi.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Base class for chat stream failures.
 *
 * <p>Every failure that ends a stream is one of the nested subclasses. Malformed individual lines
 * are not failures: they are skipped by the reader and never surface here.
 */
public abstract class ChatStreamException extends RuntimeException {

    protected ChatStreamException(String message) {
        super(message);
    }

    protected ChatStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised on HTTP 401. Never retried.
     */
    public static class Unauthorized extends ChatStreamException {
        public Unauthorized() {
            super("Unauthorized");
        }
    }

    /**
     * Raised on HTTP 429. Carries the structured response body when the server sent JSON.
     */
    public static class QuotaExceeded extends ChatStreamException {
        private final JsonNode payload;

        public QuotaExceeded(JsonNode payload) {
            super("Quota exceeded");
            this.payload = payload;
        }

        public int status() {
            return 429;
        }

        public Optional<JsonNode> payload() {
            return Optional.ofNullable(payload);
        }
    }

    /**
     * Raised for a non-2xx response that is not handled more specifically, including a 5xx
     * that persisted through the single retry.
     */
    public static class HttpError extends ChatStreamException {
        private final int status;
        private final JsonNode payload;

        public HttpError(int status, JsonNode payload) {
            super("HTTP error " + status);
            this.status = status;
            this.payload = payload;
        }

        public int status() {
            return status;
        }

        public Optional<JsonNode> payload() {
            return Optional.ofNullable(payload);
        }
    }

    /**
     * Raised mid-stream for a payload that carries an {@code error} field but no recognized type.
     */
    public static class ProtocolError extends ChatStreamException {
        public ProtocolError(String message) {
            super(message);
        }
    }

    /**
     * Raised when the body ends before {@code [DONE]} or a {@code complete} event was seen.
     */
    public static class IncompleteStream extends ChatStreamException {
        private final String streamKey;

        public IncompleteStream(String streamKey) {
            super("Stream closed before completion");
            this.streamKey = Objects.requireNonNull(streamKey, "streamKey");
        }

        public String code() {
            return Protocol.CODE_STREAM_INCOMPLETE;
        }

        public String streamKey() {
            return streamKey;
        }
    }

    /**
     * Raised when the caller cancelled the stream. This is an expected outcome, not a protocol violation.
     */
    public static class Aborted extends ChatStreamException {
        private final String streamKey;

        public Aborted(String streamKey) {
            super("Stream aborted: " + streamKey);
            this.streamKey = streamKey;
        }

        public String streamKey() {
            return streamKey;
        }
    }

    /**
     * Raised when the connection could not be opened or broke while reading.
     */
    public static class TransportFailure extends ChatStreamException {
        public TransportFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
