package io.chatstreams.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Read loop turning an open event-stream body into chunks.
 *
 * <p>Lines are classified lazily, one per {@link #hasNext()} step, so chunks surface in source-line
 * order and everything yielded before a failure stays valid. The loop ends on {@code [DONE]}, on end
 * of input, on a fatal payload or on cancellation. In every case the body is closed and the cleanup
 * callback runs exactly once.
 *
 * <p>Outcomes:
 * <ul>
 *   <li>{@code [DONE]}, or end of input after a {@code complete} event: iteration ends normally</li>
 *   <li>end of input without a completion marker: {@link ChatStreamException.IncompleteStream}</li>
 *   <li>controller aborted, or {@link #close()} while a read is blocked: {@link ChatStreamException.Aborted}</li>
 *   <li>read failure: {@link ChatStreamException.TransportFailure}</li>
 *   <li>unrecognized error payload: {@link ChatStreamException.ProtocolError}</li>
 * </ul>
 *
 * <p>Not thread-safe except for {@link #close()}, which may race a blocked read. The blocked read then
 * fails with {@link ChatStreamException.Aborted}, whatever the body reports once closed.
 */
public final class ChunkReader implements Iterator<Chunk>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChunkReader.class);
    private static final int READ_BUFFER_SIZE = 8192;

    private final InputStream body;
    private final String streamKey;
    private final StreamController controller;
    private final EventClassifier classifier;
    private final FrameAssembler assembler;
    private final CompletionGuard guard;
    private final Runnable onCleanup;

    private final byte[] readBuffer = new byte[READ_BUFFER_SIZE];
    private final Deque<String> lines = new ArrayDeque<>();
    private final AtomicBoolean cleanedUp = new AtomicBoolean();
    private volatile boolean closed;
    private boolean terminated;
    private Chunk next;

    public ChunkReader(
            InputStream body,
            String streamKey,
            StreamController controller,
            EventClassifier classifier,
            FrameAssembler assembler,
            Runnable onCleanup
    ) {
        this.body = Objects.requireNonNull(body, "body");
        this.streamKey = Objects.requireNonNull(streamKey, "streamKey");
        this.controller = Objects.requireNonNull(controller, "controller");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.guard = new CompletionGuard(streamKey);
        this.onCleanup = onCleanup == null ? () -> {} : onCleanup;
        controller.onAbort(this::closeBody);
    }

    public String streamKey() {
        return streamKey;
    }

    public boolean completed() {
        return guard.completed();
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (cleanedUp.get()) {
            return false;
        }
        try {
            next = advance();
        } catch (RuntimeException e) {
            cleanup();
            throw e;
        }
        if (next == null) {
            cleanup();
            return false;
        }
        return true;
    }

    @Override
    public Chunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Chunk chunk = next;
        next = null;
        return chunk;
    }

    /**
     * Stops reading and releases the body. Safe to call at any time and more than once.
     */
    @Override
    public void close() {
        closed = true;
        cleanup();
    }

    private Chunk advance() {
        while (true) {
            if (stopped()) {
                throw new ChatStreamException.Aborted(streamKey);
            }
            String line = lines.pollFirst();
            if (line != null) {
                String payload = FrameAssembler.payloadOf(line);
                if (payload == null) {
                    continue;
                }
                if (FrameAssembler.isDone(payload)) {
                    guard.markDone();
                    lines.clear();
                    terminated = true;
                    return null;
                }
                Chunk chunk = classifier.classify(payload);
                if (chunk != null) {
                    guard.observe(chunk);
                    return chunk;
                }
                continue;
            }
            if (terminated) {
                return null;
            }
            readMore();
        }
    }

    private void readMore() {
        int n;
        try {
            n = body.read(readBuffer);
        } catch (IOException e) {
            if (stopped()) {
                throw new ChatStreamException.Aborted(streamKey);
            }
            throw new ChatStreamException.TransportFailure("Failed to read stream " + streamKey, e);
        }
        if (n < 0) {
            int discarded = assembler.finish();
            if (discarded > 0) {
                log.debug("Stream {} ended with {} chars of unterminated line", streamKey, discarded);
            }
            terminated = true;
            // closing the body on abort also looks like end of input
            if (stopped()) {
                throw new ChatStreamException.Aborted(streamKey);
            }
            guard.onEndOfStream();
            return;
        }
        if (n > 0) {
            lines.addAll(assembler.feed(readBuffer, 0, n));
        }
    }

    private boolean stopped() {
        return closed || controller.isAborted();
    }

    private void cleanup() {
        if (!cleanedUp.compareAndSet(false, true)) {
            return;
        }
        try {
            closeBody();
        } finally {
            onCleanup.run();
        }
    }

    private void closeBody() {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Failed to close body of stream {}", streamKey, e);
        }
    }
}
