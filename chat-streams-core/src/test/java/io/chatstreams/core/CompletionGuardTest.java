package io.chatstreams.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompletionGuardTest {

    @Test
    void endWithoutMarkerIsIncomplete() {
        CompletionGuard guard = new CompletionGuard("session:1:abc:def");
        guard.observe(new Chunk.ContentDelta("x"));
        guard.observe(new Chunk.StreamEnd());

        assertThat(guard.completed()).isFalse();
        assertThatThrownBy(guard::onEndOfStream)
                .isInstanceOfSatisfying(ChatStreamException.IncompleteStream.class, e -> {
                    assertThat(e.code()).isEqualTo(Protocol.CODE_STREAM_INCOMPLETE);
                    assertThat(e.streamKey()).isEqualTo("session:1:abc:def");
                });
    }

    @Test
    void doneSentinelCompletes() {
        CompletionGuard guard = new CompletionGuard("k");
        guard.markDone();

        assertThatCode(guard::onEndOfStream).doesNotThrowAnyException();
    }

    @Test
    void completeChunkCompletesAndNeverResets() {
        CompletionGuard guard = new CompletionGuard("k");
        guard.observe(new Chunk.StreamComplete());
        guard.observe(new Chunk.ContentDelta("after"));

        assertThat(guard.completed()).isTrue();
        assertThatCode(guard::onEndOfStream).doesNotThrowAnyException();
    }
}
