package io.legacyauth.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of looking for a legacy auth token. Exactly one of three states:
 *
 * <ul>
 * <li>{@link Type#NO_TOKEN} — nothing to rewrite; {@code body} is what must be
 * forwarded (the original body, or an exact reconstruction if it was read).
 * <li>{@link Type#TOKEN} — a token was found; {@code body} as above.
 * <li>{@link Type#ERROR} — the request cannot continue; {@code error} holds the
 * response to send.
 * </ul>
 */
public final class ExtractionResult {

    /** The type of extraction outcome. */
    public enum Type {
        NO_TOKEN,
        TOKEN,
        ERROR
    }

    private final Type type;
    private final RequestBody body;
    private final AuthToken token;
    private final ProxyError error;

    private ExtractionResult(Type type, RequestBody body, AuthToken token, ProxyError error) {
        this.type = type;
        this.body = body;
        this.token = token;
        this.error = error;
    }

    /** No token present; forward {@code body}. */
    public static ExtractionResult noToken(RequestBody body) {
        Objects.requireNonNull(body, "body must not be null for NO_TOKEN");
        return new ExtractionResult(Type.NO_TOKEN, body, null, null);
    }

    /** Token found; forward {@code body}. */
    public static ExtractionResult token(RequestBody body, AuthToken token) {
        Objects.requireNonNull(body, "body must not be null for TOKEN");
        Objects.requireNonNull(token, "token must not be null for TOKEN");
        return new ExtractionResult(Type.TOKEN, body, token, null);
    }

    /** Terminal failure; do not forward. */
    public static ExtractionResult error(ProxyError error) {
        Objects.requireNonNull(error, "error must not be null for ERROR");
        return new ExtractionResult(Type.ERROR, null, null, error);
    }

    public Type type() {
        return type;
    }

    /** The body to forward. {@code null} when {@code type() == ERROR}. */
    public RequestBody body() {
        return body;
    }

    /** The token, present only when {@code type() == TOKEN}. */
    public Optional<AuthToken> token() {
        return Optional.ofNullable(token);
    }

    /** The failure. Only valid when {@code type() == ERROR}. */
    public ProxyError error() {
        return error;
    }

    public boolean hasToken() {
        return type == Type.TOKEN;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        return switch (type) {
            case NO_TOKEN -> "ExtractionResult[NO_TOKEN, " + body + "]";
            case TOKEN -> "ExtractionResult[TOKEN, source=" + token.source() + ", " + body + "]";
            case ERROR -> "ExtractionResult[ERROR, status=" + error.statusCode() + "]";
        };
    }
}
