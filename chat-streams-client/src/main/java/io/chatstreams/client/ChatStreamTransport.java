package io.chatstreams.client;

import io.chatstreams.core.StreamController;

import java.io.InputStream;

/**
 * HTTP binding used by {@link ChatStreamClient}.
 *
 * <p>Implementations must be thread-safe. {@link #sendStream} must honour the controller: an abort
 * while the request is in flight makes the call fail, and an abort after the response arrived closes
 * its body so that a blocked read returns.
 */
public interface ChatStreamTransport {

    /**
     * Sends a request and returns as soon as the status line and headers are available.
     * The caller owns and must close the body stream.
     */
    TransportResponse<InputStream> sendStream(TransportRequest request, StreamController controller) throws Exception;

    /**
     * Sends a request and reads the whole response body.
     */
    TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception;
}
