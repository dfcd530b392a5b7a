package io.chatstreams.client;

import java.util.Objects;

/**
 * An inline image sent with a chat message.
 *
 * @param data base64 image data
 * @param mime MIME type, e.g. {@code image/png}
 */
public record ImageAttachment(String data, String mime) {
    public ImageAttachment {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(mime, "mime");
    }
}
