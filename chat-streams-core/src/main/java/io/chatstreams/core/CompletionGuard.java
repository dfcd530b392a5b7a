package io.chatstreams.core;

import java.util.Objects;

/**
 * Tracks whether a stream ended intentionally.
 *
 * <p>The guard completes on the {@code [DONE]} sentinel or a {@code complete} event and never
 * resets. Reaching the end of the body without either means the connection was truncated, which is
 * reported as {@link ChatStreamException.IncompleteStream} instead of a silent success.
 */
public final class CompletionGuard {

    private final String streamKey;
    private volatile boolean completed;

    public CompletionGuard(String streamKey) {
        this.streamKey = Objects.requireNonNull(streamKey, "streamKey");
    }

    /** Records the {@code [DONE]} sentinel. */
    public void markDone() {
        completed = true;
    }

    /** Observes a classified chunk; a {@link Chunk.StreamComplete} completes the guard. */
    public void observe(Chunk chunk) {
        if (chunk instanceof Chunk.StreamComplete) {
            completed = true;
        }
    }

    public boolean completed() {
        return completed;
    }

    /**
     * Called once the body reported end of input.
     *
     * @throws ChatStreamException.IncompleteStream if no completion marker was seen
     */
    public void onEndOfStream() {
        if (!completed) {
            throw new ChatStreamException.IncompleteStream(streamKey);
        }
    }
}
