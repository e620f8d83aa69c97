package io.legacyauth.core.model;

/** Where a legacy auth token was found. */
public enum AuthSource {
    /** The {@code auth} query-string parameter. */
    QUERY,
    /** The top-level {@code auth} string of a JSON object body. */
    JSON_BODY
}
