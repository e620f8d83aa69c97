package io.legacyauth.core.engine;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Lenient {@code application/x-www-form-urlencoded} query parsing.
 *
 * <p>
 * Pairs are separated by {@code &}; the first {@code =} splits name from
 * value; {@code +} decodes to a space. Malformed percent escapes are kept
 * literally and invalid UTF-8 becomes U+FFFD, so no query string is ever
 * rejected: a query that cannot be understood simply has no matching key.
 */
public final class QueryStrings {

    private QueryStrings() {
        // utility class
    }

    /**
     * Returns the decoded value of the first pair whose decoded name equals
     * {@code name}. Scanning stops at the first match.
     *
     * @param rawQuery the raw query string without {@code ?}; may be null
     * @param name     the parameter name to find (compared exactly)
     * @return the decoded value, or empty if no pair has that name
     */
    public static Optional<String> firstValue(String rawQuery, String name) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return Optional.empty();
        }
        int start = 0;
        int length = rawQuery.length();
        while (start <= length) {
            int end = rawQuery.indexOf('&', start);
            if (end < 0) {
                end = length;
            }
            if (end > start) {
                String pair = rawQuery.substring(start, end);
                int eq = pair.indexOf('=');
                String rawName = eq >= 0 ? pair.substring(0, eq) : pair;
                String rawValue = eq >= 0 ? pair.substring(eq + 1) : "";
                if (decode(rawName).equals(name)) {
                    return Optional.of(decode(rawValue));
                }
            }
            start = end + 1;
        }
        return Optional.empty();
    }

    /**
     * Decodes one form-encoded component: {@code +} to space, {@code %XX} to
     * the byte it names, then the bytes as UTF-8.
     */
    static String decode(String component) {
        if (component.indexOf('%') < 0 && component.indexOf('+') < 0) {
            return component;
        }
        byte[] raw = component.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream(raw.length);
        for (int i = 0; i < raw.length; i++) {
            byte b = raw[i];
            if (b == '+') {
                out.write(' ');
            } else if (b == '%' && i + 2 < raw.length && isHex(raw[i + 1]) && isHex(raw[i + 2])) {
                out.write((Character.digit(raw[i + 1], 16) << 4) | Character.digit(raw[i + 2], 16));
                i += 2;
            } else {
                out.write(b);
            }
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private static boolean isHex(byte b) {
        return Character.digit(b, 16) >= 0;
    }
}
