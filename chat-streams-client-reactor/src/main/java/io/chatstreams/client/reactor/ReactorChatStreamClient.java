package io.chatstreams.client.reactor;

import io.chatstreams.client.ChatCompletion;
import io.chatstreams.client.ChatStreamClient;
import io.chatstreams.client.ChatStreamRequest;
import io.chatstreams.client.ChunkPublisher;
import io.chatstreams.core.Chunk;
import org.reactivestreams.FlowAdapters;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;

/**
 * Reactor adapter over {@link ChatStreamClient}.
 */
public final class ReactorChatStreamClient {

    private final ChatStreamClient delegate;

    public ReactorChatStreamClient(ChatStreamClient delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public ChatStreamClient delegate() {
        return delegate;
    }

    /**
     * Each subscription opens its own stream. Cancelling the subscription cancels the stream.
     */
    public Flux<Chunk> stream(ChatStreamRequest request) {
        Objects.requireNonNull(request, "request");
        return Flux.defer(() -> {
            ChunkPublisher pub = delegate.publish(request);
            return Flux.from(FlowAdapters.toPublisher(pub)).doOnCancel(pub::cancel);
        });
    }

    /**
     * Non-streaming completion on a bounded-elastic worker.
     */
    public Mono<ChatCompletion> complete(ChatStreamRequest request) {
        Objects.requireNonNull(request, "request");
        return Mono.fromCallable(() -> delegate.complete(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public void cancel(String streamKey) {
        delegate.cancel(streamKey);
    }

    /**
     * Remote cancel on a bounded-elastic worker. Completes empty; failures are only logged.
     */
    public Mono<Void> cancelRemote(long sessionId, String clientMessageId, String messageId) {
        return Mono.<Void>fromRunnable(() -> delegate.cancelRemote(sessionId, clientMessageId, messageId))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
