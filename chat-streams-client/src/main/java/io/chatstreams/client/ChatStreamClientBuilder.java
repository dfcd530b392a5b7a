package io.chatstreams.client;

import io.chatstreams.json.spi.JsonCodec;
import okhttp3.OkHttpClient;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public final class ChatStreamClientBuilder {

    static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(2000);

    private URI baseUri;
    private ChatStreamTransport transport;
    private JsonCodec jsonCodec;
    private StreamKeyRegistry registry;
    private Duration retryBackoff = DEFAULT_RETRY_BACKOFF;
    private UnauthorizedHandler unauthorizedHandler = UnauthorizedHandler.NONE;
    private boolean debug;
    private Clock clock = Clock.systemUTC();

    /**
     * API root; {@code chat/stream} and {@code chat/stream/cancel} are resolved against it.
     */
    public ChatStreamClientBuilder baseUri(URI baseUri) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        return this;
    }

    public ChatStreamClientBuilder transport(ChatStreamTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    public ChatStreamClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = new JdkHttpTransport(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    /**
     * Uses OkHttp. Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
     */
    public ChatStreamClientBuilder okHttpClient(OkHttpClient httpClient) {
        this.transport = new OkHttpTransport(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    /**
     * Sets the JSON codec. When unset, the first {@link JsonCodec} found by {@link java.util.ServiceLoader} is used.
     */
    public ChatStreamClientBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    /**
     * Shares a registry between clients. Each client gets its own by default.
     */
    public ChatStreamClientBuilder registry(StreamKeyRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        return this;
    }

    /**
     * Wait before the single retry after a 5xx status. Defaults to 2 seconds.
     */
    public ChatStreamClientBuilder retryBackoff(Duration retryBackoff) {
        Objects.requireNonNull(retryBackoff, "retryBackoff");
        if (retryBackoff.isNegative()) {
            throw new IllegalArgumentException("retryBackoff must not be negative");
        }
        this.retryBackoff = retryBackoff;
        return this;
    }

    public ChatStreamClientBuilder unauthorizedHandler(UnauthorizedHandler unauthorizedHandler) {
        this.unauthorizedHandler = Objects.requireNonNull(unauthorizedHandler, "unauthorizedHandler");
        return this;
    }

    /**
     * Logs decoded frames and skipped payloads at DEBUG level.
     */
    public ChatStreamClientBuilder debug(boolean debug) {
        this.debug = debug;
        return this;
    }

    public ChatStreamClientBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    public ChatStreamClient build() {
        if (baseUri == null) {
            throw new IllegalStateException("baseUri is required");
        }
        ChatStreamTransport resolvedTransport = transport;
        if (resolvedTransport == null) {
            resolvedTransport = new JdkHttpTransport(HttpClient.newHttpClient());
        }
        JsonCodec resolvedCodec = jsonCodec;
        if (resolvedCodec == null) {
            resolvedCodec = JsonCodec.load(ChatStreamClientBuilder.class.getClassLoader())
                    .orElseThrow(() -> new IllegalStateException(
                            "No JsonCodec found, add chat-streams-json-jackson or set jsonCodec(...)"));
        }
        StreamKeyRegistry resolvedRegistry = registry == null ? new StreamKeyRegistry(clock) : registry;
        return new DefaultChatStreamClient(
                baseUri,
                resolvedTransport,
                resolvedCodec,
                resolvedRegistry,
                retryBackoff,
                unauthorizedHandler,
                debug,
                clock);
    }
}
