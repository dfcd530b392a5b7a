package io.chatstreams.client;

import io.chatstreams.core.ChatStreamException;
import io.chatstreams.core.Chunk;
import io.chatstreams.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatStreamCancellationTest {

    private final RecordingTransport transport = new RecordingTransport();
    private final ChatStreamClient client = ChatStreamClient.builder()
            .baseUri(URI.create("http://localhost/api/"))
            .transport(transport)
            .jsonCodec(new JacksonJsonCodec())
            .retryBackoff(Duration.ofSeconds(30))
            .build();

    @Test
    void cancelKnownKeyMidIterationStopsStream() throws Exception {
        BlockingBody body = new BlockingBody();
        body.push("data: {\"type\":\"content\",\"content\":\"first\"}\n");
        transport.enqueueStream(200, body);

        ChatStream stream = client.open(keyed("tab-1"));
        assertThat(stream.next()).isEqualTo(new Chunk.ContentDelta("first"));
        assertThat(client.registry().contains("tab-1")).isTrue();

        CompletableFuture<Throwable> pending = pendingNext(stream);
        Thread.sleep(50);
        client.cancel("tab-1");

        assertThat(pending.get(2, TimeUnit.SECONDS))
                .isInstanceOfSatisfying(ChatStreamException.Aborted.class,
                        e -> assertThat(e.streamKey()).isEqualTo("tab-1"));
        assertThat(body.isClosed()).isTrue();
        assertThat(client.registry().contains("tab-1")).isFalse();
        assertThat(stream.hasNext()).isFalse();
    }

    @Test
    void cancelUnknownKeyIsNoOp() {
        transport.enqueueStream(200, "data: {\"type\":\"content\",\"content\":\"a\"}\n\ndata: [DONE]\n");
        ChatStream stream = client.open(keyed("live"));

        client.cancel("missing");
        client.cancel(null);

        assertThat(stream.next()).isEqualTo(new Chunk.ContentDelta("a"));
        assertThat(stream.hasNext()).isFalse();
        assertThat(client.registry().size()).isZero();
    }

    @Test
    void cancelAllAbortsEveryStream() throws Exception {
        BlockingBody first = new BlockingBody();
        BlockingBody second = new BlockingBody();
        transport.enqueueStream(200, first).enqueueStream(200, second);
        ChatStream a = client.open(keyed("a"));
        ChatStream b = client.open(keyed("b"));
        assertThat(client.registry().size()).isEqualTo(2);

        client.cancelAll();

        assertThatThrownBy(a::hasNext).isInstanceOf(ChatStreamException.Aborted.class);
        assertThatThrownBy(b::hasNext).isInstanceOf(ChatStreamException.Aborted.class);
        assertThat(first.isClosed()).isTrue();
        assertThat(second.isClosed()).isTrue();
        assertThat(client.registry().size()).isZero();
    }

    @Test
    void reusedKeyAbortsPreviousStream() {
        BlockingBody first = new BlockingBody();
        BlockingBody second = new BlockingBody();
        transport.enqueueStream(200, first).enqueueStream(200, second);

        ChatStream older = client.open(keyed("same"));
        ChatStream newer = client.open(keyed("same"));

        assertThatThrownBy(older::hasNext).isInstanceOf(ChatStreamException.Aborted.class);
        assertThat(client.registry().find("same")).containsSame(newer.session());

        newer.close();
        assertThat(second.isClosed()).isTrue();
        assertThat(client.registry().size()).isZero();
    }

    @Test
    void cancelDuringBackoffRemovesKey() throws Exception {
        transport.enqueueStream(500, "").enqueueStream(200, "data: [DONE]\n");

        CompletableFuture<Throwable> opening = CompletableFuture.supplyAsync(() -> {
            try {
                client.open(keyed("slow"));
                return null;
            } catch (Throwable t) {
                return t;
            }
        });
        Thread.sleep(100);
        assertThat(client.registry().contains("slow")).isTrue();
        client.cancel("slow");

        assertThat(opening.get(2, TimeUnit.SECONDS)).isInstanceOf(ChatStreamException.Aborted.class);
        assertThat(transport.requests()).hasSize(1);
        assertThat(client.registry().size()).isZero();
    }

    @Test
    void cancellingStreamHandleAbortsIt() throws Exception {
        BlockingBody body = new BlockingBody();
        transport.enqueueStream(200, body);
        ChatStream stream = client.open(keyed("handle"));

        CompletableFuture<Throwable> pending = pendingNext(stream);
        Thread.sleep(50);
        stream.cancel();

        assertThat(pending.get(2, TimeUnit.SECONDS)).isInstanceOf(ChatStreamException.Aborted.class);
        assertThat(client.registry().size()).isZero();
    }

    @Test
    void closeBeforeEndReleasesBodyAndKey() {
        BlockingBody body = new BlockingBody();
        transport.enqueueStream(200, body);

        try (ChatStream stream = client.open(keyed("closed"))) {
            assertThat(stream.streamKey()).isEqualTo("closed");
        }

        assertThat(body.isClosed()).isTrue();
        assertThat(client.registry().size()).isZero();
    }

    @Test
    void closeFromAnotherThreadDuringBlockedReadSurfacesAsAborted() throws Exception {
        BlockingBody body = new BlockingBody();
        body.push("data: {\"type\":\"content\",\"content\":\"first\"}\n");
        transport.enqueueStream(200, body);
        ChatStream stream = client.open(keyed("closing"));
        assertThat(stream.next()).isEqualTo(new Chunk.ContentDelta("first"));

        CompletableFuture<Throwable> pending = pendingNext(stream);
        Thread.sleep(50);
        stream.close();

        assertThat(pending.get(2, TimeUnit.SECONDS))
                .isInstanceOfSatisfying(ChatStreamException.Aborted.class,
                        e -> assertThat(e.streamKey()).isEqualTo("closing"));
        assertThat(body.isClosed()).isTrue();
        assertThat(client.registry().contains("closing")).isFalse();
        assertThat(stream.hasNext()).isFalse();
    }

    private static ChatStreamRequest keyed(String key) {
        return new ChatStreamRequest(5, "q", List.of(), ChatStreamOptions.builder().streamKey(key).build());
    }

    private static CompletableFuture<Throwable> pendingNext(ChatStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                stream.hasNext();
                return null;
            } catch (Throwable t) {
                return t;
            }
        });
    }
}
