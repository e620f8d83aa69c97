package io.legacyauth.core.model;

import java.util.Objects;

/**
 * A legacy auth token and where it came from.
 *
 * <p>
 * The value is a credential: {@link #toString()} masks it so the token never
 * ends up in a log line by accident.
 *
 * @param value  the raw token, exactly as extracted (may be empty)
 * @param source where the token was found
 */
public record AuthToken(String value, AuthSource source) {

    public AuthToken {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    @Override
    public String toString() {
        return "AuthToken[source=" + source + ", value=***]";
    }
}
