package io.legacyauth.core.engine;

import io.legacyauth.core.model.AuthSource;
import io.legacyauth.core.model.AuthToken;
import io.legacyauth.core.model.ExtractionResult;
import io.legacyauth.core.model.HttpHeaders;
import io.legacyauth.core.model.ProxyError;
import io.legacyauth.core.model.RequestBody;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds a legacy auth token in an inbound request.
 *
 * <p>
 * Sources are tried in strict order and the first hit wins:
 * <ol>
 * <li>an existing {@code Authorization} header: nothing is extracted and the
 * body stream is left unread;</li>
 * <li>the first {@code auth} query parameter;</li>
 * <li>the top-level {@code auth} string of a JSON object body, read only when
 * {@code Content-Type} contains {@code application/json}.</li>
 * </ol>
 *
 * <p>
 * Reading the body is non-destructive: whenever bytes are taken from the
 * client they come back in the result body, byte for byte. The only terminal
 * outcome is an I/O failure while reading, reported as
 * {@link ProxyError#bodyReadFailed()}.
 *
 * <p>
 * This class is thread-safe — all state is local to each
 * {@link #extract(String, HttpHeaders, RequestBody)} call.
 */
public final class AuthExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(AuthExtractor.class);

    static final String AUTHORIZATION = "Authorization";
    static final String CONTENT_TYPE = "Content-Type";
    static final String QUERY_PARAM = "auth";
    static final String JSON_MEDIA_TYPE = "application/json";

    private final int maxJsonInspectBytes;

    /** Creates an extractor that buffers JSON bodies of any size. */
    public AuthExtractor() {
        this(0);
    }

    /**
     * @param maxJsonInspectBytes largest JSON body to inspect; larger bodies
     *                            are replayed untouched and treated as carrying
     *                            no token. {@code <= 0} means no limit.
     */
    public AuthExtractor(int maxJsonInspectBytes) {
        this.maxJsonInspectBytes = maxJsonInspectBytes;
    }

    /**
     * Looks for a legacy token.
     *
     * @param rawQuery raw query string without {@code ?}; may be null
     * @param headers  inbound headers
     * @param body     inbound body; consumed only on the JSON path
     * @return the outcome, carrying the body that must be forwarded
     */
    public ExtractionResult extract(String rawQuery, HttpHeaders headers, RequestBody body) {
        if (headers.contains(AUTHORIZATION)) {
            return ExtractionResult.noToken(body);
        }

        Optional<String> queryToken = QueryStrings.firstValue(rawQuery, QUERY_PARAM);
        if (queryToken.isPresent()) {
            return ExtractionResult.token(body, new AuthToken(queryToken.get(), AuthSource.QUERY));
        }

        if (!isJson(headers.first(CONTENT_TYPE)) || body.isEmpty()) {
            return ExtractionResult.noToken(body);
        }

        return extractFromJsonBody(body);
    }

    private ExtractionResult extractFromJsonBody(RequestBody body) {
        byte[] content;
        try {
            if (maxJsonInspectBytes > 0 && body.isStreaming()) {
                InputStream in = body.openStream();
                int probe = maxJsonInspectBytes == Integer.MAX_VALUE ? maxJsonInspectBytes : maxJsonInspectBytes + 1;
                content = in.readNBytes(probe);
                if (content.length > maxJsonInspectBytes) {
                    LOG.debug("JSON body exceeds {} bytes, forwarding without inspection", maxJsonInspectBytes);
                    return ExtractionResult.noToken(RequestBody.replay(content, in, body.contentLength()));
                }
            } else {
                content = body.readAllBytes();
            }
        } catch (IOException e) {
            LOG.warn("Failed to read JSON request body: {}", e.getMessage());
            return ExtractionResult.error(ProxyError.bodyReadFailed());
        }

        RequestBody replay = RequestBody.buffered(content);
        return JsonAuthField.read(content)
                .map(value -> ExtractionResult.token(replay, new AuthToken(value, AuthSource.JSON_BODY)))
                .orElseGet(() -> ExtractionResult.noToken(replay));
    }

    private static boolean isJson(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains(JSON_MEDIA_TYPE);
    }
}
