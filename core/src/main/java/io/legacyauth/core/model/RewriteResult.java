package io.legacyauth.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of the auth-rewrite pipeline for one request.
 *
 * <ul>
 * <li>{@link Type#SUCCESS} — forward {@code body} with {@code headers}.
 * {@code tokenSource} tells whether an {@code Authorization} field was added.
 * <li>{@link Type#ERROR} — respond with {@code error}; the upstream is never
 * contacted.
 * </ul>
 */
public final class RewriteResult {

    /** The type of rewrite outcome. */
    public enum Type {
        SUCCESS,
        ERROR
    }

    private final Type type;
    private final HttpHeaders headers;
    private final RequestBody body;
    private final AuthSource tokenSource;
    private final ProxyError error;

    private RewriteResult(Type type, HttpHeaders headers, RequestBody body, AuthSource tokenSource, ProxyError error) {
        this.type = type;
        this.headers = headers;
        this.body = body;
        this.tokenSource = tokenSource;
        this.error = error;
    }

    /**
     * Creates a SUCCESS result.
     *
     * @param headers     outgoing headers
     * @param body        outgoing body
     * @param tokenSource source of the injected token, or {@code null} if the
     *                    headers were passed through
     */
    public static RewriteResult success(HttpHeaders headers, RequestBody body, AuthSource tokenSource) {
        Objects.requireNonNull(headers, "headers must not be null for SUCCESS");
        Objects.requireNonNull(body, "body must not be null for SUCCESS");
        return new RewriteResult(Type.SUCCESS, headers, body, tokenSource, null);
    }

    /** Creates an ERROR result. */
    public static RewriteResult error(ProxyError error) {
        Objects.requireNonNull(error, "error must not be null for ERROR");
        return new RewriteResult(Type.ERROR, null, null, null, error);
    }

    public Type type() {
        return type;
    }

    /** Outgoing headers. Only valid when {@code type() == SUCCESS}. */
    public HttpHeaders headers() {
        return headers;
    }

    /** Outgoing body. Only valid when {@code type() == SUCCESS}. */
    public RequestBody body() {
        return body;
    }

    /** Where the injected token came from; empty when nothing was injected. */
    public Optional<AuthSource> tokenSource() {
        return Optional.ofNullable(tokenSource);
    }

    /** The failure. Only valid when {@code type() == ERROR}. */
    public ProxyError error() {
        return error;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "RewriteResult[SUCCESS"
                    + (tokenSource != null ? ", injected from " + tokenSource : ", passthrough") + "]";
            case ERROR -> "RewriteResult[ERROR, status=" + error.statusCode() + "]";
        };
    }
}
