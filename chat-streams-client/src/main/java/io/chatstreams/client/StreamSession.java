package io.chatstreams.client;

import io.chatstreams.core.StreamController;

import java.time.Instant;
import java.util.Objects;

/**
 * Registry entry of one in-flight stream.
 *
 * <p>Sessions compare by identity: a new session registered under a reused key is a different entry.
 *
 * @param key stream key
 * @param controller cancellation handle
 * @param startedAt registration time
 */
public record StreamSession(String key, StreamController controller, Instant startedAt) {
    public StreamSession {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(controller, "controller");
        Objects.requireNonNull(startedAt, "startedAt");
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }
}
