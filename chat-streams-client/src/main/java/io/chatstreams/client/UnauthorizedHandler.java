package io.chatstreams.client;

/**
 * Side effect run when the server answers 401, before {@link io.chatstreams.core.ChatStreamException.Unauthorized}
 * is thrown. Typically clears the local session and sends the user to a login page.
 */
@FunctionalInterface
public interface UnauthorizedHandler {

    UnauthorizedHandler NONE = () -> {};

    void onUnauthorized();
}
