package io.chatstreams.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation handle of one logical stream.
 *
 * <p>{@link #abort()} is idempotent and may be called from any thread. It runs the registered abort
 * hooks, which tear down whatever the stream is blocked on (an in-flight request, an open body),
 * and releases threads waiting in {@link #awaitAbort(Duration)}.
 */
public final class StreamController {

    private static final Logger log = LoggerFactory.getLogger(StreamController.class);

    private final CountDownLatch abortLatch = new CountDownLatch(1);
    private final List<Runnable> hooks = new ArrayList<>();
    private boolean aborted;

    /**
     * Aborts the stream. Subsequent calls do nothing.
     */
    public void abort() {
        List<Runnable> toRun;
        synchronized (this) {
            if (aborted) {
                return;
            }
            aborted = true;
            toRun = List.copyOf(hooks);
            hooks.clear();
        }
        abortLatch.countDown();
        for (Runnable hook : toRun) {
            runHook(hook);
        }
    }

    public synchronized boolean isAborted() {
        return aborted;
    }

    /**
     * Registers a hook to run on abort. Runs it immediately if the controller is already aborted.
     */
    public void onAbort(Runnable hook) {
        Objects.requireNonNull(hook, "hook");
        synchronized (this) {
            if (!aborted) {
                hooks.add(hook);
                return;
            }
        }
        runHook(hook);
    }

    /**
     * Waits until the controller is aborted or the timeout elapses.
     *
     * @return {@code true} if aborted
     */
    public boolean awaitAbort(Duration timeout) throws InterruptedException {
        return abortLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private static void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("Abort hook failed", e);
        }
    }
}
