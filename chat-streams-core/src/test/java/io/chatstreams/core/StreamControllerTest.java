package io.chatstreams.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class StreamControllerTest {

    @Test
    void abortRunsHooksOnce() {
        StreamController controller = new StreamController();
        AtomicInteger runs = new AtomicInteger();
        controller.onAbort(runs::incrementAndGet);
        controller.onAbort(runs::incrementAndGet);

        controller.abort();
        controller.abort();

        assertThat(controller.isAborted()).isTrue();
        assertThat(runs).hasValue(2);
    }

    @Test
    void hookRegisteredAfterAbortRunsImmediately() {
        StreamController controller = new StreamController();
        controller.abort();
        AtomicInteger runs = new AtomicInteger();

        controller.onAbort(runs::incrementAndGet);

        assertThat(runs).hasValue(1);
    }

    @Test
    void failingHookDoesNotStopOthers() {
        StreamController controller = new StreamController();
        AtomicInteger runs = new AtomicInteger();
        controller.onAbort(() -> {
            throw new IllegalStateException("boom");
        });
        controller.onAbort(runs::incrementAndGet);

        controller.abort();

        assertThat(runs).hasValue(1);
    }

    @Test
    void awaitAbortTimesOutOrReturnsEarly() throws Exception {
        StreamController controller = new StreamController();
        assertThat(controller.awaitAbort(Duration.ofMillis(20))).isFalse();

        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return controller.awaitAbort(Duration.ofSeconds(30));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });
        controller.abort();

        assertThat(waiter.get(2, TimeUnit.SECONDS)).isTrue();
    }
}
