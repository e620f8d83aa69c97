package io.legacyauth.standalone.proxy;

import io.javalin.http.Context;
import io.legacyauth.core.model.ProxyError;

/**
 * Writes responses the proxy synthesizes itself, as opposed to responses
 * relayed from the upstream.
 *
 * <p>
 * Every body is a short, non-empty {@code text/plain} explanation. Messages
 * never echo the request query or body, which may hold the legacy token.
 *
 * <p>
 * Thread-safe — all methods are stateless.
 */
public final class ErrorResponses {

    static final String CONTENT_TYPE = "text/plain; charset=utf-8";
    static final String UPSTREAM_FAILED_PREFIX = "Upstream failed to respond: ";
    static final String NOT_FORWARDABLE = "Request cannot be forwarded: a header or the method is not acceptable";

    private ErrorResponses() {
        // utility class
    }

    /** Writes a pipeline error with its own status. */
    public static void write(Context ctx, ProxyError error) {
        write(ctx, error.statusCode(), error.message());
    }

    /** {@code 502} for a failed upstream exchange. */
    public static void upstreamFailed(Context ctx, String reason) {
        write(ctx, 502, UPSTREAM_FAILED_PREFIX + reason);
    }

    /** {@code 400} for a request the HTTP client refused to send. */
    public static void badRequest(Context ctx) {
        write(ctx, 400, NOT_FORWARDABLE);
    }

    /** {@code 500} for anything unexpected. */
    public static void internalError(Context ctx) {
        write(ctx, 500, "Internal proxy error");
    }

    static void write(Context ctx, int statusCode, String message) {
        ctx.status(statusCode);
        ctx.contentType(CONTENT_TYPE);
        ctx.result(message);
    }
}
