package io.chatstreams.client;

import io.chatstreams.core.Protocol;
import io.chatstreams.core.StreamController;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.InputStream;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link ChatStreamTransport} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath. Aborting the controller cancels the
 * {@link Call}, which also fails a read blocked on the response body.
 */
public final class OkHttpTransport implements ChatStreamTransport {

    private final OkHttpClient httpClient;

    public OkHttpTransport(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpTransport create() {
        return new OkHttpTransport(new OkHttpClient());
    }

    @Override
    public TransportResponse<InputStream> sendStream(TransportRequest request, StreamController controller) throws Exception {
        Call call = clientWithTimeout(request).newCall(toOkHttpRequest(request));
        controller.onAbort(call::cancel);
        Response response = call.execute();
        ResponseBody body = response.body();
        InputStream stream = body != null ? body.byteStream() : InputStream.nullInputStream();
        return new TransportResponse<>(response.code(), response.headers().toMultimap(), stream);
    }

    @Override
    public TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception {
        try (Response response = clientWithTimeout(request).newCall(toOkHttpRequest(request)).execute()) {
            ResponseBody body = response.body();
            byte[] bytes = body != null ? body.bytes() : new byte[0];
            return new TransportResponse<>(response.code(), response.headers().toMultimap(), bytes);
        }
    }

    private OkHttpClient clientWithTimeout(TransportRequest request) {
        if (request.timeout() == null) {
            return httpClient;
        }
        long millis = request.timeout().toMillis();
        return httpClient.newBuilder()
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .writeTimeout(millis, TimeUnit.MILLISECONDS)
                .callTimeout(millis, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Request toOkHttpRequest(TransportRequest request) {
        Request.Builder builder = new Request.Builder()
                .url(request.url().toString());

        String contentType = null;
        for (Map.Entry<String, ? extends Iterable<String>> entry : request.headers().entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            for (String value : entry.getValue()) {
                if (value == null) {
                    continue;
                }
                builder.addHeader(entry.getKey(), value);
                if (Protocol.H_CONTENT_TYPE.equalsIgnoreCase(entry.getKey())) {
                    contentType = value;
                }
            }
        }

        RequestBody body = null;
        if (request.body() != null) {
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
            body = RequestBody.create(request.body(), mediaType);
        }

        String method = request.method();
        switch (method) {
            case "GET" -> builder.get();
            case "POST" -> builder.post(body != null ? body : RequestBody.create(new byte[0], null));
            default -> builder.method(method, body);
        }

        return builder.build();
    }
}
