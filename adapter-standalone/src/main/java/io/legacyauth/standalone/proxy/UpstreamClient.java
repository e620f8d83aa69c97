package io.legacyauth.standalone.proxy;

import io.legacyauth.core.model.HttpHeaders;
import io.legacyauth.core.model.RequestBody;
import io.legacyauth.standalone.config.ProxyConfig;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based upstream forwarder.
 *
 * <p>
 * Forwards HTTP requests to the configured backend and returns the response
 * with status, headers, and body bytes intact. Uses HTTP/1.1 for all upstream
 * connections and never follows redirects: a 3xx from the backend goes back
 * to the client as-is.
 *
 * <p>
 * This class is thread-safe — the underlying {@link HttpClient} is
 * thread-safe, pools connections and is shared by all requests.
 */
public final class UpstreamClient {

    private static final Logger LOG = LoggerFactory.getLogger(UpstreamClient.class);

    /** Hop-by-hop headers per RFC 7230 §6.1, never forwarded in either direction. */
    static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection",
            "transfer-encoding",
            "keep-alive",
            "proxy-authenticate",
            "proxy-authorization",
            "te",
            "trailer",
            "upgrade");

    /** Headers the JDK client computes itself and refuses to accept from callers. */
    private static final Set<String> TRANSPORT_OWNED_HEADERS =
            Set.of("host", "content-length", "connection", "expect", "upgrade");

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final HttpClient httpClient;
    private final String backendBaseUrl;
    private final Duration readTimeout;

    /**
     * Creates an {@code UpstreamClient} for the given proxy configuration.
     *
     * @param config proxy configuration containing the upstream and timeout
     *               settings; a timeout of {@code 0} means none
     */
    public UpstreamClient(ProxyConfig config) {
        this.backendBaseUrl = "http://" + config.upstream().authority();
        this.readTimeout =
                config.backendReadTimeoutMs() > 0 ? Duration.ofMillis(config.backendReadTimeoutMs()) : null;

        HttpClient.Builder builder =
                HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).followRedirects(HttpClient.Redirect.NEVER);
        if (config.backendConnectTimeoutMs() > 0) {
            builder.connectTimeout(Duration.ofMillis(config.backendConnectTimeoutMs()));
        }
        this.httpClient = builder.build();

        LOG.debug("UpstreamClient initialized: backend={}", backendBaseUrl);
    }

    /**
     * Forwards an HTTP request to the configured backend.
     *
     * @param method       the HTTP method, sent verbatim
     * @param pathAndQuery the raw request target, e.g. {@code /api/users?page=2}
     * @param headers      request headers to forward, in order
     * @param body         the request body; a streaming body is consumed here
     * @return the upstream response with status code, headers, and body
     * @throws UpstreamConnectException if the backend is unreachable, refuses
     *                                  the connection, or the exchange fails
     * @throws UpstreamTimeoutException if a configured timeout expires
     * @throws IllegalArgumentException if the method or a header is rejected by
     *                                  the HTTP client
     * @throws InterruptedException     if the thread is interrupted while waiting
     */
    public UpstreamResponse forward(String method, String pathAndQuery, HttpHeaders headers, RequestBody body)
            throws UpstreamException, InterruptedException {

        URI targetUri = URI.create(backendBaseUrl + toUriTarget(pathAndQuery));
        // the query may carry the legacy token, so it never appears in messages
        String target = backendBaseUrl + stripQuery(pathAndQuery);

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder().uri(targetUri).method(method, publisher(body));
        if (readTimeout != null) {
            requestBuilder.timeout(readTimeout);
        }

        for (HttpHeaders.Field field : headers.fields()) {
            String lowerName = field.name().toLowerCase(Locale.ROOT);
            if (TRANSPORT_OWNED_HEADERS.contains(lowerName) || HOP_BY_HOP_HEADERS.contains(lowerName)) {
                continue;
            }
            requestBuilder.header(field.name(), field.value());
        }

        HttpRequest request = requestBuilder.build();

        LOG.debug("Forwarding {} {}", method, target);

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpConnectTimeoutException e) {
            throw new UpstreamConnectException("connect timeout to " + target, e);
        } catch (HttpTimeoutException e) {
            throw new UpstreamTimeoutException("response timeout from " + target, e);
        } catch (ConnectException e) {
            throw new UpstreamConnectException("connection refused by " + target, e);
        } catch (IOException e) {
            throw new UpstreamConnectException(describe(e) + " (" + target + ")", e);
        }

        List<HttpHeaders.Field> responseFields = new ArrayList<>();
        response.headers().map().forEach((name, values) -> {
            String lowerName = name.toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP_HEADERS.contains(lowerName) || "content-length".equals(lowerName)) {
                return;
            }
            for (String value : values) {
                responseFields.add(new HttpHeaders.Field(name, value));
            }
        });

        byte[] responseBody = response.body() != null ? response.body() : new byte[0];

        LOG.debug("Backend responded: {} {} → {}", method, target, response.statusCode());

        return new UpstreamResponse(response.statusCode(), HttpHeaders.of(responseFields), responseBody);
    }

    /**
     * Returns the underlying {@link HttpClient} — package-private for testing.
     */
    HttpClient httpClient() {
        return httpClient;
    }

    private static HttpRequest.BodyPublisher publisher(RequestBody body) {
        if (body.isEmpty() || body.contentLength() == 0) {
            return HttpRequest.BodyPublishers.noBody();
        }
        if (body.isBuffered()) {
            return HttpRequest.BodyPublishers.ofByteArray(body.bytes());
        }
        HttpRequest.BodyPublisher stream = HttpRequest.BodyPublishers.ofInputStream(body::openStream);
        // known length → Content-Length framing; unknown → chunked
        return body.contentLength() > 0
                ? HttpRequest.BodyPublishers.fromPublisher(stream, body.contentLength())
                : stream;
    }

    /**
     * Makes a raw request target acceptable to {@link URI}, which is stricter
     * than the listener. Characters it refuses, and a {@code %} that does not
     * start a valid escape, are percent-encoded as UTF-8; everything else,
     * valid escapes included, goes out as received.
     */
    static String toUriTarget(String pathAndQuery) {
        StringBuilder out = new StringBuilder(pathAndQuery.length() + 16);
        int i = 0;
        while (i < pathAndQuery.length()) {
            int cp = pathAndQuery.codePointAt(i);
            if (isUriTargetChar(cp) || (cp == '%' && isEscape(pathAndQuery, i))) {
                out.appendCodePoint(cp);
            } else {
                for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                    out.append('%').append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
                }
            }
            i += Character.charCount(cp);
        }
        return out.toString();
    }

    /** RFC 3986 unreserved, sub-delims, {@code :@} and the path and query separators. */
    private static boolean isUriTargetChar(int c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || "-._~!$&'()*+,;=:@/?".indexOf(c) >= 0;
    }

    private static boolean isEscape(String s, int percentIndex) {
        return percentIndex + 2 < s.length()
                && isHexDigit(s.charAt(percentIndex + 1))
                && isHexDigit(s.charAt(percentIndex + 2));
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static String stripQuery(String pathAndQuery) {
        int q = pathAndQuery.indexOf('?');
        return q < 0 ? pathAndQuery : pathAndQuery.substring(0, q);
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        return message == null || message.isBlank()
                ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + message;
    }
}
