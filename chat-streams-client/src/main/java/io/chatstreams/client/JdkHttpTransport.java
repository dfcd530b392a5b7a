package io.chatstreams.client;

import io.chatstreams.core.StreamController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Transport implementation using {@link java.net.http.HttpClient}.
 */
public final class JdkHttpTransport implements ChatStreamTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient http;

    /**
     * Creates a new transport.
     *
     * @param http the JDK HttpClient to use
     */
    public JdkHttpTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public TransportResponse<InputStream> sendStream(TransportRequest request, StreamController controller) throws Exception {
        CompletableFuture<HttpResponse<InputStream>> future =
                http.sendAsync(buildRequest(request), HttpResponse.BodyHandlers.ofInputStream());
        controller.onAbort(() -> future.cancel(true));

        HttpResponse<InputStream> resp;
        try {
            resp = future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        }
        InputStream body = resp.body();
        controller.onAbort(() -> closeQuietly(body));
        return new TransportResponse<>(resp.statusCode(), resp.headers().map(), body);
    }

    @Override
    public TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception {
        HttpResponse<byte[]> resp = http.send(buildRequest(request), HttpResponse.BodyHandlers.ofByteArray());
        byte[] body = resp.body() == null ? new byte[0] : resp.body();
        return new TransportResponse<>(resp.statusCode(), resp.headers().map(), body);
    }

    private static HttpRequest buildRequest(TransportRequest request) {
        HttpRequest.BodyPublisher body = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
                .method(request.method(), body);

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        for (Map.Entry<String, ? extends Iterable<String>> entry : request.headers().entrySet()) {
            String name = entry.getKey();
            if (name == null) {
                continue;
            }
            Iterable<String> values = entry.getValue();
            if (values == null) {
                continue;
            }
            for (String value : values) {
                if (value != null) {
                    builder.header(name, value);
                }
            }
        }

        return builder.build();
    }

    private static void closeQuietly(InputStream body) {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Failed to close aborted response body", e);
        }
    }
}
