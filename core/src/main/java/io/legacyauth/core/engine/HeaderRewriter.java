package io.legacyauth.core.engine;

import io.legacyauth.core.model.AuthToken;
import io.legacyauth.core.model.HttpHeaders;
import io.legacyauth.core.model.ProxyError;
import io.legacyauth.core.model.RequestBody;
import io.legacyauth.core.model.RewriteResult;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Builds the outgoing header set.
 *
 * <p>
 * With a token, one {@code Authorization: Bearer <token>} field is
 * <strong>appended</strong>; the token is used verbatim, without encoding.
 * Without a token the headers pass through. No existing field is ever
 * modified, removed or reordered.
 *
 * <p>
 * Header values are octets on the wire. The token's UTF-8 bytes are carried
 * one char per byte (ISO-8859-1), which is how the forwarding client writes
 * header values, so the upstream receives exactly those bytes.
 */
public final class HeaderRewriter {

    static final String AUTHORIZATION = "Authorization";
    static final String BEARER_PREFIX = "Bearer ";

    private HeaderRewriter() {
        // utility class
    }

    /**
     * Produces the outgoing headers for a request.
     *
     * @param headers original headers (never mutated)
     * @param token   the extracted token, if any
     * @param body    the body to forward alongside the headers
     * @return SUCCESS with the outgoing headers, or ERROR if the token cannot
     *         be carried in a header field
     */
    public static RewriteResult rewrite(HttpHeaders headers, Optional<AuthToken> token, RequestBody body) {
        if (token.isEmpty()) {
            return RewriteResult.success(headers, body, null);
        }
        byte[] tokenBytes = token.get().value().getBytes(StandardCharsets.UTF_8);
        if (!isValidFieldValue(tokenBytes)) {
            return RewriteResult.error(ProxyError.invalidToken());
        }
        String value = BEARER_PREFIX + new String(tokenBytes, StandardCharsets.ISO_8859_1);
        return RewriteResult.success(headers.append(AUTHORIZATION, value), body, token.get().source());
    }

    /**
     * RFC 9110 field-value check on raw octets: visible ASCII, space,
     * horizontal tab and obs-text (0x80-0xFF). Other controls and DEL are
     * rejected.
     */
    static boolean isValidFieldValue(byte[] value) {
        for (byte b : value) {
            int octet = b & 0xFF;
            if (octet == '\t') {
                continue;
            }
            if (octet < 0x20 || octet == 0x7F) {
                return false;
            }
        }
        return true;
    }
}
