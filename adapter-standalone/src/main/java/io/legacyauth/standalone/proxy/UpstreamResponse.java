package io.legacyauth.standalone.proxy;

import io.legacyauth.core.model.HttpHeaders;

/**
 * Immutable container for an upstream backend HTTP response.
 *
 * <p>
 * Returned by {@link UpstreamClient#forward} after forwarding a request to the
 * configured backend. Headers keep every value; framing headers
 * ({@code content-length} and hop-by-hop fields) are already removed.
 *
 * @param statusCode the HTTP status code from the backend
 * @param headers    response headers, multi-valued
 * @param body       exact response body bytes (empty for no-body responses)
 */
public record UpstreamResponse(int statusCode, HttpHeaders headers, byte[] body) {}
