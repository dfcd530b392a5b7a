package io.chatstreams.client;

import io.chatstreams.core.Chunk;
import io.chatstreams.core.ChunkReader;

import java.util.Iterator;
import java.util.Objects;

/**
 * An open chat response, consumed as a blocking iterator of chunks.
 *
 * <p>{@link #hasNext()} and {@link #next()} throw {@link io.chatstreams.core.ChatStreamException} when the
 * stream fails. The registry entry of the stream is removed once, when iteration ends, fails or the
 * stream is closed. Use with try-with-resources:
 *
 * <pre>{@code
 * try (ChatStream stream = client.open(ChatStreamRequest.of(42, "hello"))) {
 *     while (stream.hasNext()) {
 *         Chunk chunk = stream.next();
 *     }
 * }
 * }</pre>
 */
public final class ChatStream implements Iterator<Chunk>, AutoCloseable {

    private final StreamSession session;
    private final ChunkReader reader;

    ChatStream(StreamSession session, ChunkReader reader) {
        this.session = Objects.requireNonNull(session, "session");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public String streamKey() {
        return session.key();
    }

    public StreamSession session() {
        return session;
    }

    /**
     * Whether a completion marker ({@code [DONE]} or a {@code complete} event) has been seen.
     */
    public boolean completed() {
        return reader.completed();
    }

    @Override
    public boolean hasNext() {
        return reader.hasNext();
    }

    @Override
    public Chunk next() {
        return reader.next();
    }

    /**
     * Aborts the stream. May be called from any thread; a blocked {@link #hasNext()} then throws
     * {@link io.chatstreams.core.ChatStreamException.Aborted}.
     */
    public void cancel() {
        session.controller().abort();
    }

    @Override
    public void close() {
        reader.close();
    }
}
