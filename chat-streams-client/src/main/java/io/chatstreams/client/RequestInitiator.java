package io.chatstreams.client;

import io.chatstreams.core.ChatStreamException;
import io.chatstreams.core.Protocol;
import io.chatstreams.core.StreamController;
import io.chatstreams.json.spi.JsonCodec;
import io.chatstreams.json.spi.JsonException;
import io.chatstreams.json.spi.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Opens the chat stream response, applying the pre-stream retry policy.
 *
 * <ul>
 *   <li>401: run the {@link UnauthorizedHandler}, throw {@link ChatStreamException.Unauthorized}</li>
 *   <li>429: throw {@link ChatStreamException.QuotaExceeded} with the JSON body, if any</li>
 *   <li>5xx: wait the backoff window, resend once with the same body and controller; a 401 on the
 *       retry is handled as above, anything else falls through</li>
 *   <li>other non-2xx: throw {@link ChatStreamException.HttpError}</li>
 * </ul>
 *
 * <p>Nothing is retried once the response status was accepted.
 */
public final class RequestInitiator {

    private static final Logger log = LoggerFactory.getLogger(RequestInitiator.class);

    private static final Map<String, List<String>> STREAM_HEADERS = Map.of(
            Protocol.H_CONTENT_TYPE, List.of(Protocol.CT_JSON),
            Protocol.H_ACCEPT, List.of(Protocol.CT_EVENT_STREAM));

    private final ChatStreamTransport transport;
    private final JsonCodec codec;
    private final URI endpoint;
    private final Duration retryBackoff;
    private final UnauthorizedHandler unauthorizedHandler;

    public RequestInitiator(
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

    /**
     * Sends the request for a registered session.
     *
     * @return a 2xx response whose body is ready to be read
     */
    public TransportResponse<InputStream> open(ChatStreamRequest request, StreamSession session) {
        byte[] body;
        try {
            body = codec.writeBytes(request.toPayload());
        } catch (JsonException e) {
            throw new IllegalArgumentException("Cannot serialize chat request", e);
        }
        TransportRequest req = new TransportRequest("POST", endpoint, STREAM_HEADERS, body, null);

        TransportResponse<InputStream> resp = send(req, session);
        if (resp.status() == 401) {
            throw unauthorized(resp);
        }
        if (resp.status() == 429) {
            throw new ChatStreamException.QuotaExceeded(readJsonBody(resp));
        }
        if (resp.status() >= 500) {
            log.debug("Stream {} got status {}, retrying in {}", session.key(), resp.status(), retryBackoff);
            discard(resp);
            backoff(session);
            resp = send(req, session);
            if (resp.status() == 401) {
                throw unauthorized(resp);
            }
        }
        if (!resp.isSuccessful()) {
            throw new ChatStreamException.HttpError(resp.status(), readJsonBody(resp));
        }
        return resp;
    }

    private TransportResponse<InputStream> send(TransportRequest req, StreamSession session) {
        StreamController controller = session.controller();
        if (controller.isAborted()) {
            throw new ChatStreamException.Aborted(session.key());
        }
        TransportResponse<InputStream> resp;
        try {
            resp = transport.sendStream(req, controller);
        } catch (ChatStreamException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (controller.isAborted()) {
                throw new ChatStreamException.Aborted(session.key());
            }
            throw new ChatStreamException.TransportFailure("Failed to open stream " + session.key(), e);
        }
        if (controller.isAborted()) {
            discard(resp);
            throw new ChatStreamException.Aborted(session.key());
        }
        return resp;
    }

    private void backoff(StreamSession session) {
        try {
            if (session.controller().awaitAbort(retryBackoff)) {
                throw new ChatStreamException.Aborted(session.key());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.controller().abort();
            throw new ChatStreamException.Aborted(session.key());
        }
    }

    private ChatStreamException unauthorized(TransportResponse<InputStream> resp) {
        discard(resp);
        unauthorizedHandler.onUnauthorized();
        return new ChatStreamException.Unauthorized();
    }

    /** Parses an error body as JSON; returns {@code null} when it is empty or not JSON. */
    private JsonNode readJsonBody(TransportResponse<InputStream> resp) {
        if (resp.body() == null) {
            return null;
        }
        try (InputStream in = resp.body()) {
            byte[] bytes = in.readAllBytes();
            return bytes.length == 0 ? null : codec.readTree(bytes);
        } catch (IOException | JsonException e) {
            log.debug("Ignoring unreadable error body of status {}: {}", resp.status(), e.getMessage());
            return null;
        }
    }

    private static void discard(TransportResponse<InputStream> resp) {
        if (resp.body() == null) {
            return;
        }
        try {
            resp.body().close();
        } catch (IOException e) {
            log.debug("Failed to close discarded response body", e);
        }
    }
}
