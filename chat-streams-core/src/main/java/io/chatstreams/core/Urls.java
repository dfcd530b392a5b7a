package io.chatstreams.core;

import java.net.URI;
import java.util.Objects;

/**
 * Utility to build endpoint URLs from an API base URI.
 */
public final class Urls {
    private Urls() {}

    /**
     * Appends a relative path to a base URI, keeping any path the base already has.
     * {@code http://h/api} and {@code http://h/api/} both resolve {@code chat/stream} to {@code http://h/api/chat/stream}.
     */
    public static URI resolve(URI base, String path) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(path, "path");
        String b = base.toString();
        while (b.endsWith("/")) b = b.substring(0, b.length() - 1);
        String p = path.startsWith("/") ? path.substring(1) : path;
        return URI.create(b + "/" + p);
    }
}
