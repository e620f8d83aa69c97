package io.legacyauth.standalone.proxy;

/**
 * Base exception for upstream backend communication failures.
 *
 * <p>
 * Subtypes represent specific failure modes:
 * <ul>
 * <li>{@link UpstreamConnectException} — connection refused, host unreachable,
 * connection dropped mid-exchange
 * <li>{@link UpstreamTimeoutException} — configured response timeout exceeded
 * </ul>
 * Both end the request with {@code 502 Bad Gateway}.
 */
public abstract class UpstreamException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * @param message human-readable error description
     * @param cause   the underlying exception
     */
    protected UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
