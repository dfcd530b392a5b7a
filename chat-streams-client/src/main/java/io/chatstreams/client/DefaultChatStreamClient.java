package io.chatstreams.client;

import io.chatstreams.core.ChunkReader;
import io.chatstreams.core.EventClassifier;
import io.chatstreams.core.FrameAssembler;
import io.chatstreams.core.Protocol;
import io.chatstreams.core.StreamController;
import io.chatstreams.core.Urls;
import io.chatstreams.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

public final class DefaultChatStreamClient implements ChatStreamClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultChatStreamClient.class);

    private final URI cancelEndpoint;
    private final ChatStreamTransport transport;
    private final JsonCodec codec;
    private final StreamKeyRegistry registry;
    private final RequestInitiator initiator;
    private final CompletionRequester completions;
    private final EventClassifier classifier;
    private final boolean debug;
    private final Clock clock;

    DefaultChatStreamClient(
            URI baseUri,
            ChatStreamTransport transport,
            JsonCodec codec,
            StreamKeyRegistry registry,
            Duration retryBackoff,
            UnauthorizedHandler unauthorizedHandler,
            boolean debug,
            Clock clock
    ) {
        Objects.requireNonNull(baseUri, "baseUri");
        this.cancelEndpoint = Urls.resolve(baseUri, Protocol.PATH_CHAT_STREAM_CANCEL);
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.initiator = new RequestInitiator(transport, codec, Urls.resolve(baseUri, Protocol.PATH_CHAT_STREAM),
                retryBackoff, unauthorizedHandler);
        this.completions = new CompletionRequester(transport, codec,
                Urls.resolve(baseUri, Protocol.PATH_CHAT_COMPLETION), retryBackoff, unauthorizedHandler);
        this.classifier = new EventClassifier(codec, debug);
        this.debug = debug;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public ChatStream open(ChatStreamRequest request) {
        Objects.requireNonNull(request, "request");
        String key = resolveKey(request);
        StreamSession session = registry.register(key, new StreamController());

        TransportResponse<InputStream> resp;
        try {
            resp = initiator.open(request, session);
        } catch (RuntimeException e) {
            registry.remove(session);
            throw e;
        }

        InputStream body = resp.body() == null ? InputStream.nullInputStream() : resp.body();
        ChunkReader reader = new ChunkReader(body, key, session.controller(), classifier,
                new FrameAssembler(debug), () -> registry.remove(session));
        return new ChatStream(session, reader);
    }

    @Override
    public ChunkPublisher publish(ChatStreamRequest request) {
        Objects.requireNonNull(request, "request");
        return new ChunkPublisher(this, request.withStreamKey(resolveKey(request)));
    }

    @Override
    public ChatCompletion complete(ChatStreamRequest request) {
        Objects.requireNonNull(request, "request");
        return completions.complete(request);
    }

    @Override
    public void cancel(String streamKey) {
        registry.cancel(streamKey);
    }

    @Override
    public void cancelAll() {
        registry.cancelAll();
    }

    @Override
    public void cancelRemote(long sessionId, String clientMessageId, String messageId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", sessionId);
        if (clientMessageId != null && !clientMessageId.isEmpty()) {
            payload.put("clientMessageId", clientMessageId);
        }
        Long numericMessageId = parseMessageId(messageId);
        if (numericMessageId != null) {
            payload.put("messageId", numericMessageId);
        }
        if (payload.size() == 1) {
            log.debug("Remote cancel for session {} skipped, no message id", sessionId);
            return;
        }

        try {
            Map<String, Iterable<String>> headers = Map.of(Protocol.H_CONTENT_TYPE, List.of(Protocol.CT_JSON));
            TransportRequest req = new TransportRequest("POST", cancelEndpoint, headers, codec.writeBytes(payload), null);
            TransportResponse<byte[]> resp = transport.sendBytes(req);
            if (!resp.isSuccessful()) {
                log.debug("Remote cancel for session {} ignored, status {}", sessionId, resp.status());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Remote cancel for session {} interrupted", sessionId);
        } catch (Exception e) {
            log.debug("Remote cancel for session {} failed", sessionId, e);
        }
    }

    @Override
    public StreamKeyRegistry registry() {
        return registry;
    }

    private String resolveKey(ChatStreamRequest request) {
        return StreamKeys.resolve(request.options().streamKey(), request.sessionId(), clock, ThreadLocalRandom.current());
    }

    private static Long parseMessageId(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(messageId.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
