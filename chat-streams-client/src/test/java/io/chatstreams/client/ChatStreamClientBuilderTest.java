package io.chatstreams.client;

import io.chatstreams.core.Chunk;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatStreamClientBuilderTest {

    @Test
    void baseUriIsRequired() {
        assertThatThrownBy(() -> ChatStreamClient.builder().build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("baseUri");
    }

    @Test
    void negativeBackoffIsRejected() {
        assertThatThrownBy(() -> ChatStreamClient.builder().retryBackoff(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void jsonCodecIsDiscoveredFromClasspath() {
        RecordingTransport transport = new RecordingTransport();
        transport.enqueueStream(200, "data: {\"type\":\"content\",\"content\":\"x\"}\n\ndata: [DONE]\n");

        ChatStreamClient client = ChatStreamClient.builder()
                .baseUri(URI.create("http://localhost"))
                .transport(transport)
                .build();

        try (ChatStream stream = client.open(ChatStreamRequest.of(1, "q"))) {
            assertThat(stream.next()).isEqualTo(new Chunk.ContentDelta("x"));
        }
        assertThat(transport.lastRequest().url()).isEqualTo(URI.create("http://localhost/chat/stream"));
    }

    @Test
    void sharedRegistryIsUsed() {
        StreamKeyRegistry registry = new StreamKeyRegistry();

        ChatStreamClient client = ChatStreamClient.builder()
                .baseUri(URI.create("http://localhost"))
                .transport(new RecordingTransport())
                .registry(registry)
                .build();

        assertThat(client.registry()).isSameAs(registry);
    }
}
