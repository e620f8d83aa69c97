package io.legacyauth.core.spi;

import io.legacyauth.core.model.InboundRequest;

/**
 * Gateway adapter SPI. Bridges a server product's native request type and the
 * pipeline's {@link InboundRequest}.
 *
 * <p>
 * Implementations MUST:
 * <ul>
 * <li>keep the path and query string raw, exactly as received (no decoding,
 * no normalization)</li>
 * <li>keep every header value, in arrival order, with its original name</li>
 * <li>hand the body over unread as a streaming
 * {@link io.legacyauth.core.model.RequestBody}; the pipeline decides whether
 * it needs to be read</li>
 * </ul>
 *
 * <p>
 * Implementations MUST be thread-safe. A single adapter instance is shared
 * across concurrent server threads.
 *
 * @param <R> the server-native request type
 */
public interface GatewayAdapter<R> {

    /**
     * Wraps a server-native request.
     *
     * @param nativeRequest the server-native request object
     * @return the request as seen by the pipeline
     */
    InboundRequest wrapRequest(R nativeRequest);
}
