package io.legacyauth.standalone.proxy;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.legacyauth.core.engine.AuthRewritePipeline;
import io.legacyauth.core.model.HttpHeaders;
import io.legacyauth.core.model.InboundRequest;
import io.legacyauth.core.model.RewriteResult;
import io.legacyauth.core.spi.GatewayAdapter;
import jakarta.servlet.http.HttpServletResponse;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main HTTP proxy handler.
 *
 * <p>
 * Orchestrates the proxy cycle:
 * <ol>
 * <li>Wrap the inbound request (via {@link GatewayAdapter})</li>
 * <li>Rewrite legacy auth (via {@link AuthRewritePipeline})</li>
 * <li>Dispatch on {@link RewriteResult}: {@code ERROR} answers the client
 * immediately and the upstream is never called</li>
 * <li>Forward to the upstream (via {@link UpstreamClient})</li>
 * <li>Relay status, headers and body bytes to the client</li>
 * </ol>
 *
 * <p>
 * The handler is total: whatever happens, exactly one response is written.
 * Upstream failures become {@code 502}, requests the HTTP client rejects
 * become {@code 400}, anything else becomes {@code 500}.
 *
 * <p>
 * This class is thread-safe — all state is local to each
 * {@link #handle(Context)} invocation.
 */
public final class ProxyHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyHandler.class);

    private final GatewayAdapter<Context> adapter;
    private final AuthRewritePipeline pipeline;
    private final UpstreamClient upstreamClient;

    /**
     * @param adapter        the Javalin-to-{@link InboundRequest} adapter
     * @param pipeline       the shared auth rewrite pipeline
     * @param upstreamClient the shared upstream HTTP client
     */
    public ProxyHandler(GatewayAdapter<Context> adapter, AuthRewritePipeline pipeline, UpstreamClient upstreamClient) {
        this.adapter = adapter;
        this.pipeline = pipeline;
        this.upstreamClient = upstreamClient;
    }

    @Override
    public void handle(Context ctx) {
        try {
            proxy(ctx);
        } catch (Exception e) {
            LOG.error("Unexpected error proxying {} {}", ctx.method(), ctx.path(), e);
            ErrorResponses.internalError(ctx);
        }
    }

    private void proxy(Context ctx) {
        InboundRequest request = adapter.wrapRequest(ctx);

        RewriteResult result = pipeline.process(request);
        if (result.isError()) {
            LOG.warn(
                    "Rejected {} {}: {} {}",
                    request.method(),
                    request.path(),
                    result.error().statusCode(),
                    result.error().message());
            ErrorResponses.write(ctx, result.error());
            return;
        }

        UpstreamResponse upstreamResponse;
        try {
            upstreamResponse =
                    upstreamClient.forward(request.method(), request.pathAndQuery(), result.headers(), result.body());
        } catch (UpstreamException e) {
            LOG.warn("Upstream failed for {} {}: {}", request.method(), request.path(), e.getMessage());
            ErrorResponses.upstreamFailed(ctx, e.getMessage());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while forwarding {} {}", request.method(), request.path());
            ErrorResponses.upstreamFailed(ctx, "interrupted while waiting for the response");
            return;
        } catch (IllegalArgumentException e) {
            // the client's message can quote the header value or the full target
            LOG.warn(
                    "Request not forwardable {} {}: rejected by the HTTP client ({})",
                    request.method(),
                    request.path(),
                    e.getClass().getSimpleName());
            ErrorResponses.badRequest(ctx);
            return;
        }

        writeUpstreamResponse(ctx, upstreamResponse);
    }

    /**
     * Relays the upstream response. The first value of each header replaces
     * anything the server set by default ({@code Date}, the default content
     * type); further values are added. Framing headers are left to Jetty.
     */
    private static void writeUpstreamResponse(Context ctx, UpstreamResponse upstreamResponse) {
        HttpServletResponse res = ctx.res();
        ctx.status(upstreamResponse.statusCode());

        Set<String> seen = new HashSet<>();
        for (HttpHeaders.Field field : upstreamResponse.headers().fields()) {
            String lowerName = field.name().toLowerCase(Locale.ROOT);
            if ("content-length".equals(lowerName) || UpstreamClient.HOP_BY_HOP_HEADERS.contains(lowerName)) {
                continue;
            }
            if (seen.add(lowerName)) {
                res.setHeader(field.name(), field.value());
            } else {
                res.addHeader(field.name(), field.value());
            }
        }
        if (!seen.contains("content-type")) {
            res.setContentType(null);
        }

        ctx.result(upstreamResponse.body());
    }
}
