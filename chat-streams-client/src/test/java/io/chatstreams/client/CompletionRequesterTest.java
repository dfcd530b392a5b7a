package io.chatstreams.client;

import io.chatstreams.core.ChatStreamException;
import io.chatstreams.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompletionRequesterTest {

    private static final URI ENDPOINT = URI.create("http://localhost/api/chat/completion");

    private final RecordingTransport transport = new RecordingTransport();
    private final AtomicInteger unauthorizedCalls = new AtomicInteger();

    @Test
    void postsChatPayloadAndUnwrapsEnvelope() {
        transport.enqueueBytes(200, "{\"success\":true,\"data\":{\"content\":\"Hello\","
                + "\"usage\":{\"total_tokens\":5},\"quota\":{\"remaining\":9}}}");
        ChatStreamOptions options = ChatStreamOptions.builder()
                .clientMessageId("c-1")
                .customBody(Map.of("temperature", 0.5))
                .build();

        ChatCompletion completion = requester(Duration.ZERO).complete(new ChatStreamRequest(4, "hi", null, options));

        assertThat(completion.content()).isEqualTo("Hello");
        assertThat(completion.usage().get("total_tokens").asLong()).isEqualTo(5L);
        assertThat(completion.quota().get("remaining").asLong()).isEqualTo(9L);
        assertThat(completion.body().get("success").asBoolean()).isTrue();

        TransportRequest req = transport.lastRequest();
        assertThat(req.method()).isEqualTo("POST");
        assertThat(req.url()).isEqualTo(ENDPOINT);
        assertThat(req.headers().get("Content-Type")).containsExactly("application/json");
        assertThat(transport.lastBody()).isEqualTo("{\"sessionId\":4,\"content\":\"hi\",\"clientMessageId\":\"c-1\","
                + "\"custom_body\":{\"temperature\":0.5}}");
    }

    @Test
    void bareResponseObjectIsAccepted() {
        transport.enqueueBytes(200, "{\"content\":\"plain\"}");

        ChatCompletion completion = requester(Duration.ZERO).complete(ChatStreamRequest.of(1, "q"));

        assertThat(completion.content()).isEqualTo("plain");
        assertThat(completion.usage()).isNull();
        assertThat(completion.quota()).isNull();
    }

    @Test
    void quotaExceededIsNotRetried() {
        transport.enqueueBytes(429, "{\"quota\":{\"remaining\":0}}");

        assertThatThrownBy(() -> requester(Duration.ZERO).complete(ChatStreamRequest.of(1, "q")))
                .isInstanceOfSatisfying(ChatStreamException.QuotaExceeded.class,
                        e -> assertThat(e.payload()).hasValueSatisfying(
                                p -> assertThat(p.get("quota").get("remaining").asLong()).isZero()));
        assertThat(transport.requests()).hasSize(1);
    }

    @Test
    void serverErrorIsRetriedOnceAfterBackoff() {
        transport.enqueueBytes(503, "").enqueueBytes(200, "{\"data\":{\"content\":\"second\"}}");

        Instant before = Instant.now();
        ChatCompletion completion = requester(Duration.ofMillis(100)).complete(ChatStreamRequest.of(2, "again"));

        assertThat(completion.content()).isEqualTo("second");
        assertThat(Duration.between(before, Instant.now())).isGreaterThanOrEqualTo(Duration.ofMillis(100));
        List<TransportRequest> requests = transport.requests();
        assertThat(requests).hasSize(2);
        assertThat(requests.get(1).body()).isEqualTo(requests.get(0).body());
    }

    @Test
    void secondServerErrorIsHttpError() {
        transport.enqueueBytes(500, "").enqueueBytes(502, "{\"error\":\"bad gateway\"}");

        assertThatThrownBy(() -> requester(Duration.ZERO).complete(ChatStreamRequest.of(1, "q")))
                .isInstanceOfSatisfying(ChatStreamException.HttpError.class, e -> {
                    assertThat(e.status()).isEqualTo(502);
                    assertThat(e.payload()).hasValueSatisfying(
                            p -> assertThat(p.get("error").asText()).isEqualTo("bad gateway"));
                });
        assertThat(transport.requests()).hasSize(2);
    }

    @Test
    void unauthorizedRunsHandler() {
        transport.enqueueBytes(401, "");

        assertThatThrownBy(() -> requester(Duration.ZERO).complete(ChatStreamRequest.of(1, "q")))
                .isInstanceOf(ChatStreamException.Unauthorized.class);
        assertThat(unauthorizedCalls).hasValue(1);
        assertThat(transport.requests()).hasSize(1);
    }

    @Test
    void failedEnvelopeIsProtocolError() {
        transport.enqueueBytes(200, "{\"success\":false,\"error\":\"model unavailable\"}");

        assertThatThrownBy(() -> requester(Duration.ZERO).complete(ChatStreamRequest.of(1, "q")))
                .isInstanceOf(ChatStreamException.ProtocolError.class)
                .hasMessage("model unavailable");
    }

    @Test
    void unreadableSuccessBodyIsProtocolError() {
        transport.enqueueBytes(200, "<html>ok</html>");

        assertThatThrownBy(() -> requester(Duration.ZERO).complete(ChatStreamRequest.of(1, "q")))
                .isInstanceOf(ChatStreamException.ProtocolError.class);
    }

    @Test
    void connectFailureIsTransportFailure() {
        transport.enqueueBytesFailure(new IOException("connection refused"));

        assertThatThrownBy(() -> requester(Duration.ZERO).complete(ChatStreamRequest.of(1, "q")))
                .isInstanceOf(ChatStreamException.TransportFailure.class)
                .hasRootCauseMessage("connection refused");
    }

    private CompletionRequester requester(Duration backoff) {
        return new CompletionRequester(transport, new JacksonJsonCodec(), ENDPOINT, backoff,
                unauthorizedCalls::incrementAndGet);
    }
}
