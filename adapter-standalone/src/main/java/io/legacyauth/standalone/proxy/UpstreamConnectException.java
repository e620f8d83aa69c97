package io.legacyauth.standalone.proxy;

/**
 * Thrown when the upstream backend cannot be reached or the exchange breaks
 * off before a complete response arrives.
 *
 * <p>
 * Wraps low-level network exceptions ({@code ConnectException}, DNS
 * resolution failures, resets) so the handler can answer {@code 502}.
 */
public class UpstreamConnectException extends UpstreamException {

    private static final long serialVersionUID = 1L;

    public UpstreamConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
