package io.chatstreams.client;

import io.chatstreams.core.StreamController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-flight streams addressable by key for cancellation.
 *
 * <p>One registry is created per client and shared by every stream it opens. Each stream removes its
 * own entry exactly once when it ends, whatever the outcome. Registering a key that is still live
 * aborts the stream previously registered under it.
 *
 * <p>Thread-safe.
 */
public final class StreamKeyRegistry {

    private static final Logger log = LoggerFactory.getLogger(StreamKeyRegistry.class);

    private final Map<String, StreamSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public StreamKeyRegistry() {
        this(Clock.systemUTC());
    }

    public StreamKeyRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Registers a controller under a key.
     *
     * @return the new session
     */
    public StreamSession register(String key, StreamController controller) {
        StreamSession session = new StreamSession(key, controller, clock.instant());
        StreamSession previous = sessions.put(key, session);
        if (previous != null) {
            log.debug("Stream key {} re-registered, aborting previous stream", key);
            previous.controller().abort();
        }
        return session;
    }

    /**
     * Aborts and removes the stream registered under a key. Does nothing for an unknown key.
     */
    public void cancel(String key) {
        if (key == null) {
            return;
        }
        StreamSession session = sessions.remove(key);
        if (session != null) {
            session.controller().abort();
        }
    }

    /**
     * Aborts and removes every registered stream.
     */
    public void cancelAll() {
        for (String key : sessions.keySet()) {
            cancel(key);
        }
    }

    /**
     * Removes a session if it is still the one registered under its key.
     *
     * @return {@code true} if this call removed it
     */
    public boolean remove(StreamSession session) {
        return sessions.remove(session.key(), session);
    }

    public Optional<StreamSession> find(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(sessions.get(key));
    }

    public boolean contains(String key) {
        return key != null && sessions.containsKey(key);
    }

    public int size() {
        return sessions.size();
    }
}
