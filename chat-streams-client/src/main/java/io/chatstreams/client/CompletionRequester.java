package io.chatstreams.client;

import io.chatstreams.core.ChatStreamException;
import io.chatstreams.core.Protocol;
import io.chatstreams.json.spi.JsonCodec;
import io.chatstreams.json.spi.JsonException;
import io.chatstreams.json.spi.JsonNode;
import io.chatstreams.json.spi.JsonNodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sends a chat request to the non-streaming completion endpoint.
 *
 * <p>Status handling follows {@link RequestInitiator}: 401 runs the {@link UnauthorizedHandler},
 * 429 fails with the quota payload, and a 5xx is resent once after the backoff window. The response
 * is an envelope whose {@code data} object carries {@code content}, {@code usage} and {@code quota}.
 */
public final class CompletionRequester {

    private static final Logger log = LoggerFactory.getLogger(CompletionRequester.class);

    private static final Map<String, List<String>> JSON_HEADERS = Map.of(
            Protocol.H_CONTENT_TYPE, List.of(Protocol.CT_JSON),
            Protocol.H_ACCEPT, List.of(Protocol.CT_JSON));

    private final ChatStreamTransport transport;
    private final JsonCodec codec;
    private final URI endpoint;
    private final Duration retryBackoff;
    private final UnauthorizedHandler unauthorizedHandler;

    public CompletionRequester(
            ChatStreamTransport transport,
            JsonCodec codec,
            URI endpoint,
            Duration retryBackoff,
            UnauthorizedHandler unauthorizedHandler
    ) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.retryBackoff = Objects.requireNonNull(retryBackoff, "retryBackoff");
        this.unauthorizedHandler = unauthorizedHandler == null ? UnauthorizedHandler.NONE : unauthorizedHandler;
    }

    public ChatCompletion complete(ChatStreamRequest request) {
        byte[] body;
        try {
            body = codec.writeBytes(request.toPayload());
        } catch (JsonException e) {
            throw new IllegalArgumentException("Cannot serialize chat request", e);
        }
        TransportRequest req = new TransportRequest("POST", endpoint, JSON_HEADERS, body, null);

        TransportResponse<byte[]> resp = send(req, request.sessionId());
        if (resp.status() == 401) {
            throw unauthorized();
        }
        if (resp.status() == 429) {
            throw new ChatStreamException.QuotaExceeded(readJsonBody(resp));
        }
        if (resp.status() >= 500) {
            log.debug("Completion for session {} got status {}, retrying in {}",
                    request.sessionId(), resp.status(), retryBackoff);
            backoff();
            resp = send(req, request.sessionId());
            if (resp.status() == 401) {
                throw unauthorized();
            }
        }
        if (!resp.isSuccessful()) {
            throw new ChatStreamException.HttpError(resp.status(), readJsonBody(resp));
        }
        return toCompletion(resp);
    }

    private TransportResponse<byte[]> send(TransportRequest req, long sessionId) {
        try {
            return transport.sendBytes(req);
        } catch (ChatStreamException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new ChatStreamException.TransportFailure("Failed to request completion for session " + sessionId, e);
        }
    }

    private void backoff() {
        if (retryBackoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(retryBackoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChatStreamException.TransportFailure("Interrupted before retrying completion", e);
        }
    }

    private ChatStreamException unauthorized() {
        unauthorizedHandler.onUnauthorized();
        return new ChatStreamException.Unauthorized();
    }

    private ChatCompletion toCompletion(TransportResponse<byte[]> resp) {
        JsonNode root;
        try {
            root = codec.readTree(resp.body());
        } catch (JsonException e) {
            throw new ChatStreamException.ProtocolError("Completion response is not JSON: " + e.getMessage());
        }
        if (!root.isObject()) {
            throw new ChatStreamException.ProtocolError("Completion response is not an object");
        }
        JsonNode success = root.get("success");
        if (success != null && success.getNodeType() == JsonNodeType.BOOLEAN && !success.asBoolean()) {
            JsonNode error = root.get(Protocol.F_ERROR);
            throw new ChatStreamException.ProtocolError(
                    error != null && error.isTextual() ? error.asText() : "Completion failed");
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            data = root;
        }
        JsonNode content = data.get("content");
        return new ChatCompletion(
                content != null && content.isTextual() ? content.asText() : null,
                objectOrNull(data.get("usage")),
                objectOrNull(data.get("quota")),
                root);
    }

    private static JsonNode objectOrNull(JsonNode node) {
        return node != null && node.isObject() ? node : null;
    }

    /** Parses an error body as JSON; returns {@code null} when it is empty or not JSON. */
    private JsonNode readJsonBody(TransportResponse<byte[]> resp) {
        byte[] bytes = resp.body();
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        try {
            return codec.readTree(bytes);
        } catch (JsonException e) {
            log.debug("Ignoring unreadable error body of status {}: {}", resp.status(), e.getMessage());
            return null;
        }
    }
}
