package io.legacyauth.standalone.proxy;

/**
 * Thrown when the upstream backend does not respond within the configured
 * timeout. Never thrown when no timeout is configured.
 */
public class UpstreamTimeoutException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
