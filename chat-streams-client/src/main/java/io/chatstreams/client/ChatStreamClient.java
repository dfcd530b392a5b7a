package io.chatstreams.client;

import java.net.URI;

public interface ChatStreamClient {

    /**
     * Opens a chat stream and returns once the response status was accepted.
     *
     * @throws io.chatstreams.core.ChatStreamException if the stream cannot be opened
     */
    ChatStream open(ChatStreamRequest request);

    /**
     * Streams on a daemon thread. The stream starts when the first subscriber subscribes.
     */
    ChunkPublisher publish(ChatStreamRequest request);

    /**
     * Sends the request to the non-streaming completion endpoint and waits for the whole answer.
     * A 5xx is retried once after the retry backoff.
     *
     * @throws io.chatstreams.core.ChatStreamException on a rejected status, a transport failure or an
     *         unreadable response
     */
    ChatCompletion complete(ChatStreamRequest request);

    /**
     * Aborts the local stream registered under a key. Does nothing for an unknown key.
     */
    void cancel(String streamKey);

    void cancelAll();

    /**
     * Asks the server to stop generating a response. Never throws; failures are logged.
     *
     * @param messageId server message id, used only when it is numeric
     */
    void cancelRemote(long sessionId, String clientMessageId, String messageId);

    default void cancelRemote(long sessionId, String clientMessageId, long messageId) {
        cancelRemote(sessionId, clientMessageId, Long.toString(messageId));
    }

    StreamKeyRegistry registry();

    static ChatStreamClient create(URI baseUri) {
        return builder().baseUri(baseUri).build();
    }

    static ChatStreamClientBuilder builder() {
        return new ChatStreamClientBuilder();
    }
}
