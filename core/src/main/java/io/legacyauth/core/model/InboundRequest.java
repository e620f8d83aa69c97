package io.legacyauth.core.model;

import java.util.Objects;

/**
 * Gateway-neutral view of one inbound request.
 *
 * @param method   HTTP method, verbatim
 * @param path     raw (undecoded) request path
 * @param rawQuery raw query string without the leading {@code ?}, or
 *                 {@code null} if the URI has none
 * @param headers  all header fields in arrival order
 * @param body     the request body
 */
public record InboundRequest(String method, String path, String rawQuery, HttpHeaders headers, RequestBody body) {

    public InboundRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        headers = headers != null ? headers : HttpHeaders.empty();
        body = body != null ? body : RequestBody.empty();
    }

    /**
     * Returns the path and query exactly as received, e.g.
     * {@code /x?auth=TOKEN}.
     */
    public String pathAndQuery() {
        return rawQuery == null ? path : path + "?" + rawQuery;
    }
}
