package io.legacyauth.core.engine;

import io.legacyauth.core.model.ExtractionResult;
import io.legacyauth.core.model.InboundRequest;
import io.legacyauth.core.model.RewriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link AuthExtractor} then {@link HeaderRewriter} for one request.
 *
 * <p>
 * Errors are returned as values: an extraction failure short-circuits into a
 * {@link RewriteResult#error} and the header step never runs. One instance is
 * shared by every request; it holds no per-request state.
 */
public final class AuthRewritePipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AuthRewritePipeline.class);

    private final AuthExtractor extractor;

    public AuthRewritePipeline(AuthExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * Rewrites the request's auth, if needed.
     *
     * @param request the inbound request; its streaming body may be consumed
     * @return the headers and body to forward, or the error to return
     */
    public RewriteResult process(InboundRequest request) {
        ExtractionResult extraction = extractor.extract(request.rawQuery(), request.headers(), request.body());
        if (extraction.isError()) {
            LOG.debug("{} {}: {}", request.method(), request.path(), extraction);
            return RewriteResult.error(extraction.error());
        }

        RewriteResult result = HeaderRewriter.rewrite(request.headers(), extraction.token(), extraction.body());
        LOG.debug("{} {}: {}", request.method(), request.path(), result);
        return result;
    }
}
