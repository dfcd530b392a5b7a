package io.chatstreams.client;

import java.time.Clock;
import java.util.Random;

/**
 * Stream key generation.
 */
final class StreamKeys {
    private StreamKeys() {}

    /**
     * Returns the caller-supplied key, or a fresh {@code session:<id>:<base36 millis>:<base36 random>}
     * key unique across concurrent streams of one chat session.
     */
    static String resolve(String requested, long sessionId, Clock clock, Random random) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        return "session:" + sessionId
                + ":" + Long.toString(clock.millis(), 36)
                + ":" + Long.toString(random.nextLong() & Long.MAX_VALUE, 36);
    }
}
