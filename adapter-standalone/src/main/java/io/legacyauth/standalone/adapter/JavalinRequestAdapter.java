package io.legacyauth.standalone.adapter;

import io.javalin.http.Context;
import io.legacyauth.core.model.HttpHeaders;
import io.legacyauth.core.model.InboundRequest;
import io.legacyauth.core.model.RequestBody;
import io.legacyauth.core.spi.GatewayAdapter;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Javalin gateway adapter.
 *
 * <p>
 * Implements {@link GatewayAdapter} for Javalin's {@link Context}. The body is
 * never read here: it is wrapped as a streaming {@link RequestBody} over
 * {@link Context#bodyInputStream()} so a request that does not need inspecting
 * is forwarded without being buffered.
 *
 * <p>
 * This class is thread-safe — all state is local to each method invocation.
 */
public final class JavalinRequestAdapter implements GatewayAdapter<Context> {

    private static final Logger LOG = LoggerFactory.getLogger(JavalinRequestAdapter.class);

    @Override
    public InboundRequest wrapRequest(Context ctx) {
        HttpServletRequest req = ctx.req();
        HttpHeaders headers = buildHeaders(req);
        RequestBody body = buildBody(ctx, req, headers);
        String method = ExtensionMethodFilter.originalMethod(req);

        LOG.debug("wrapRequest: {} {} (headers={}, body={})", method, ctx.path(), headers.size(), body);

        return new InboundRequest(method, ctx.path(), ctx.queryString(), headers, body);
    }

    /**
     * Collects every header value from the servlet request. Values sharing a
     * name stay in arrival order; the container groups them by name.
     */
    private static HttpHeaders buildHeaders(HttpServletRequest req) {
        List<HttpHeaders.Field> fields = new ArrayList<>();
        Enumeration<String> headerNames = req.getHeaderNames();
        if (headerNames != null) {
            while (headerNames.hasMoreElements()) {
                String name = headerNames.nextElement();
                Enumeration<String> values = req.getHeaders(name);
                if (values == null) {
                    continue;
                }
                while (values.hasMoreElements()) {
                    fields.add(new HttpHeaders.Field(name, values.nextElement()));
                }
            }
        }
        return HttpHeaders.of(fields);
    }

    /**
     * A body exists when the client declared a positive {@code Content-Length}
     * or sent {@code Transfer-Encoding} without one.
     */
    private static RequestBody buildBody(Context ctx, HttpServletRequest req, HttpHeaders headers) {
        long contentLength = req.getContentLengthLong();
        boolean hasBody = contentLength > 0 || (contentLength < 0 && headers.contains("Transfer-Encoding"));
        if (!hasBody) {
            return RequestBody.empty();
        }
        return RequestBody.streaming(new LazyBodyStream(ctx), contentLength > 0 ? contentLength : -1);
    }

    /**
     * Defers {@link Context#bodyInputStream()} until the first read so that
     * obtaining the stream cannot fail during wrapping; a failure surfaces as
     * an {@link IOException} from {@code read}, like any other body error.
     */
    private static final class LazyBodyStream extends InputStream {

        private final Context ctx;
        private InputStream delegate;

        LazyBodyStream(Context ctx) {
            this.ctx = ctx;
        }

        private InputStream delegate() throws IOException {
            if (delegate == null) {
                try {
                    delegate = ctx.bodyInputStream();
                } catch (UncheckedIOException e) {
                    throw e.getCause();
                }
            }
            return delegate;
        }

        @Override
        public int read() throws IOException {
            return delegate().read();
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            return delegate().read(b, off, len);
        }

        @Override
        public int available() throws IOException {
            return delegate().available();
        }

        @Override
        public void close() throws IOException {
            if (delegate != null) {
                delegate.close();
            }
        }
    }
}
