package io.chatstreams.client;

import io.chatstreams.core.ChatStreamException;
import io.chatstreams.core.Chunk;

import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishes the chunks of one chat stream.
 *
 * <p>The stream is opened on a daemon thread when the first subscriber subscribes, so early chunks are
 * not dropped. Failures close the publisher exceptionally with the {@link ChatStreamException}. A stream
 * stopped through {@link #cancel()}, or left without subscribers, completes normally.
 */
public final class ChunkPublisher implements Flow.Publisher<Chunk> {

    private final ChatStreamClient client;
    private final ChatStreamRequest request;
    private final SubmissionPublisher<Chunk> pub = new SubmissionPublisher<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean cancelled;
    private volatile ChatStream active;

    ChunkPublisher(ChatStreamClient client, ChatStreamRequest request) {
        this.client = Objects.requireNonNull(client, "client");
        this.request = Objects.requireNonNull(request, "request");
    }

    /**
     * Key the stream is registered under, known before it starts.
     */
    public String streamKey() {
        return request.options().streamKey();
    }

    @Override
    public void subscribe(Flow.Subscriber<? super Chunk> subscriber) {
        pub.subscribe(subscriber);
        if (started.compareAndSet(false, true)) {
            Thread t = new Thread(this::run, "chat-streams-reader");
            t.setDaemon(true);
            t.start();
        }
    }

    /**
     * Stops the stream, whether it is still being opened or already reading.
     */
    public void cancel() {
        cancelled = true;
        ChatStream stream = active;
        if (stream != null) {
            stream.cancel();
        } else {
            client.cancel(streamKey());
        }
    }

    private void run() {
        if (cancelled) {
            pub.close();
            return;
        }
        try (ChatStream stream = client.open(request)) {
            active = stream;
            if (cancelled) {
                stream.cancel();
            }
            while (stream.hasNext()) {
                pub.submit(stream.next());
                if (pub.getNumberOfSubscribers() == 0) {
                    cancelled = true;
                    stream.cancel();
                }
            }
            pub.close();
        } catch (ChatStreamException.Aborted e) {
            if (cancelled) {
                pub.close();
            } else {
                pub.closeExceptionally(e);
            }
        } catch (RuntimeException e) {
            pub.closeExceptionally(e);
        }
    }
}
