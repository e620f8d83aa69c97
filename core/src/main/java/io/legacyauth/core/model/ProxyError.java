package io.legacyauth.core.model;

import java.util.Objects;

/**
 * A request-terminal failure that the listener turns into a plain-text
 * response instead of forwarding the request.
 *
 * @param statusCode HTTP status to return to the client
 * @param message    human-readable explanation, used as the response body
 */
public record ProxyError(int statusCode, String message) {

    public ProxyError {
        Objects.requireNonNull(message, "message must not be null");
    }

    /** Inbound body could not be read completely. */
    public static ProxyError bodyReadFailed() {
        return new ProxyError(400, "Failed to receive request body");
    }

    /** The extracted token cannot be carried in a header. */
    public static ProxyError invalidToken() {
        return new ProxyError(400, "Legacy auth token cannot be used as an Authorization header value");
    }
}
