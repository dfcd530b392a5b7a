package io.chatstreams.client.rxjava3;

import io.chatstreams.client.ChatCompletion;
import io.chatstreams.client.ChatStreamClient;
import io.chatstreams.client.ChatStreamRequest;
import io.chatstreams.client.ChunkPublisher;
import io.chatstreams.core.Chunk;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import org.reactivestreams.FlowAdapters;

import java.util.Objects;

/**
 * RxJava3 adapter over {@link ChatStreamClient}.
 */
public final class RxJavaChatStreamClient {

    private final ChatStreamClient delegate;

    public RxJavaChatStreamClient(ChatStreamClient delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public ChatStreamClient delegate() {
        return delegate;
    }

    public Flowable<Chunk> stream(ChatStreamRequest request) {
        Objects.requireNonNull(request, "request");
        return Flowable.defer(() -> {
            ChunkPublisher pub = delegate.publish(request);
            return Flowable.fromPublisher(FlowAdapters.toPublisher(pub)).doOnCancel(pub::cancel);
        });
    }

    public Single<ChatCompletion> complete(ChatStreamRequest request) {
        Objects.requireNonNull(request, "request");
        return Single.fromCallable(() -> delegate.complete(request)).subscribeOn(Schedulers.io());
    }

    public void cancel(String streamKey) {
        delegate.cancel(streamKey);
    }

    public Completable cancelRemote(long sessionId, String clientMessageId, String messageId) {
        return Completable.fromRunnable(() -> delegate.cancelRemote(sessionId, clientMessageId, messageId))
                .subscribeOn(Schedulers.io());
    }
}
