package io.legacyauth.core.engine;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Reads the top-level {@code auth} string of a JSON object body.
 *
 * <p>
 * Anything that is not a well-formed UTF-8 JSON object with a string-valued
 * {@code auth} member yields an empty result. No input makes this class throw.
 */
public final class JsonAuthField {

    static final String FIELD_NAME = "auth";

    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonAuthField() {
        // utility class
    }

    /**
     * Looks for {@code {"auth": "<string>"}} in the given bytes.
     *
     * @param content raw body bytes (not modified)
     * @return the string value, or empty if the bytes are not UTF-8, not JSON,
     *         not an object, or have no string {@code auth} member
     */
    public static Optional<String> read(byte[] content) {
        String text;
        try {
            text = StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JacksonException e) {
            return Optional.empty();
        }

        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode auth = root.get(FIELD_NAME);
        if (auth == null || !auth.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(auth.textValue());
    }
}
