package io.legacyauth.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.legacyauth.core.model.AuthSource;
import io.legacyauth.core.model.AuthToken;
import io.legacyauth.core.model.ExtractionResult;
import io.legacyauth.core.model.HttpHeaders;
import io.legacyauth.core.model.HttpHeaders.Field;
import io.legacyauth.core.model.RequestBody;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link AuthExtractor}. */
@DisplayName("AuthExtractor — token detection and body replay")
class AuthExtractorTest {

    private final AuthExtractor extractor = new AuthExtractor();

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static HttpHeaders headers(String... nameValues) {
        List<Field> fields = new ArrayList<>();
        for (int i = 0; i < nameValues.length; i += 2) {
            fields.add(new Field(nameValues[i], nameValues[i + 1]));
        }
        return HttpHeaders.of(fields);
    }

    private static RequestBody streaming(String content) {
        byte[] bytes = utf8(content);
        return RequestBody.streaming(new ByteArrayInputStream(bytes), bytes.length);
    }

    private static HttpHeaders json() {
        return headers("Content-Type", "application/json");
    }

    // ---------------------------------------------------------------
    // Existing Authorization header
    // ---------------------------------------------------------------

    @Nested
    @DisplayName("Authorization header present")
    class ExistingHeader {

        @Test
        @DisplayName("query token is ignored and body is not read")
        void headerWinsOverQuery() {
            RequestBody body = streaming("{\"auth\":\"body\"}");
            ExtractionResult result = extractor.extract(
                    "auth=query", headers("Authorization", "Bearer real", "Content-Type", "application/json"), body);

            assertThat(result.type()).isEqualTo(ExtractionResult.Type.NO_TOKEN);
            assertThat(result.body()).isSameAs(body);
            assertThat(body.isConsumed()).isFalse();
        }

        @Test
        @DisplayName("presence is checked by key: an empty value still counts")
        void emptyAuthorizationStillCounts() {
            RequestBody body = streaming("{\"auth\":\"body\"}");
            ExtractionResult result =
                    extractor.extract(null, headers("authorization", "", "Content-Type", "application/json"), body);

            assertThat(result.hasToken()).isFalse();
            assertThat(body.isConsumed()).isFalse();
        }
    }

    // ---------------------------------------------------------------
    // Query parameter
    // ---------------------------------------------------------------

    @Nested
    @DisplayName("auth query parameter")
    class QueryParameter {

        @Test
        void queryTokenIsExtracted() {
            RequestBody body = RequestBody.empty();
            ExtractionResult result = extractor.extract("auth=TOKEN", HttpHeaders.empty(), body);

            assertThat(result.token()).contains(new AuthToken("TOKEN", AuthSource.QUERY));
            assertThat(result.body()).isSameAs(body);
        }

        @Test
        @DisplayName("query token wins and the JSON body is never read")
        void queryWinsOverBody() {
            RequestBody body = streaming("{\"auth\":\"body\"}");
            ExtractionResult result = extractor.extract("auth=query", json(), body);

            assertThat(result.token()).map(AuthToken::value).contains("query");
            assertThat(result.body()).isSameAs(body);
            assertThat(body.isConsumed()).isFalse();
        }

        @Test
        void firstDuplicateWins() {
            ExtractionResult result = extractor.extract("auth=a&auth=b", HttpHeaders.empty(), RequestBody.empty());
            assertThat(result.token()).map(AuthToken::value).contains("a");
        }

        @Test
        @DisplayName("malformed query is not an error")
        void malformedQueryIsNoToken() {
            ExtractionResult result = extractor.extract("%%%&=&", HttpHeaders.empty(), RequestBody.empty());
            assertThat(result.type()).isEqualTo(ExtractionResult.Type.NO_TOKEN);
        }
    }

    // ---------------------------------------------------------------
    // JSON body
    // ---------------------------------------------------------------

    @Nested
    @DisplayName("JSON body")
    class JsonBody {

        @Test
        @DisplayName("auth field is extracted and the body replayed byte for byte")
        void jsonTokenIsExtracted() throws Exception {
            ExtractionResult result = extractor.extract(null, json(), streaming("{\"auth\":\"abc123\"}"));

            assertThat(result.token()).contains(new AuthToken("abc123", AuthSource.JSON_BODY));
            assertThat(result.body().isBuffered()).isTrue();
            assertThat(result.body().readAllBytes()).isEqualTo(utf8("{\"auth\":\"abc123\"}"));
        }

        @Test
        void contentTypeWithParametersAndOddCase() {
            ExtractionResult result = extractor.extract(
                    null,
                    headers("content-type", "Application/JSON; charset=utf-8"),
                    streaming("{\"auth\":\"abc\"}"));
            assertThat(result.token()).map(AuthToken::value).contains("abc");
        }

        @Test
        void vendorJsonTypeContainingSubstringIsInspected() {
            ExtractionResult result = extractor.extract(
                    null, headers("Content-Type", "application/json-patch+json"), streaming("{\"auth\":\"abc\"}"));
            assertThat(result.hasToken()).isTrue();
        }

        @Test
        @DisplayName("invalid JSON is replayed exactly with no token")
        void invalidJsonReplayedExactly() throws Exception {
            ExtractionResult result = extractor.extract(null, json(), streaming("not valid json"));

            assertThat(result.type()).isEqualTo(ExtractionResult.Type.NO_TOKEN);
            assertThat(result.body().readAllBytes()).isEqualTo(utf8("not valid json"));
        }

        @Test
        void missingFieldReplayedExactly() throws Exception {
            ExtractionResult result = extractor.extract(null, json(), streaming("{\"other\":\"value\"}"));

            assertThat(result.hasToken()).isFalse();
            assertThat(result.body().readAllBytes()).isEqualTo(utf8("{\"other\":\"value\"}"));
        }

        @Test
        @DisplayName("invalid UTF-8 is replayed exactly with no token")
        void invalidUtf8ReplayedExactly() throws Exception {
            byte[] bytes = {'{', '"', 'a', 'u', 't', 'h', '"', ':', '"', (byte) 0xFF, '"', '}'};
            ExtractionResult result = extractor.extract(
                    null, json(), RequestBody.streaming(new ByteArrayInputStream(bytes), bytes.length));

            assertThat(result.hasToken()).isFalse();
            assertThat(result.body().readAllBytes()).isEqualTo(bytes);
        }

        @Test
        @DisplayName("whitespace and key order survive the round trip")
        void formattingPreserved() throws Exception {
            String body = "{\n  \"z\" : 1,\n  \"auth\" : \"t\"\n}\n";
            ExtractionResult result = extractor.extract(null, json(), streaming(body));

            assertThat(result.token()).map(AuthToken::value).contains("t");
            assertThat(result.body().readAllBytes()).isEqualTo(utf8(body));
        }

        @Test
        void emptyBodyIsNotRead() {
            ExtractionResult result = extractor.extract(null, json(), RequestBody.empty());

            assertThat(result.hasToken()).isFalse();
            assertThat(result.body().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("read failure is a 400 error")
        void readFailureIsError() {
            InputStream failing = new InputStream() {
                @Override
                public int read() throws IOException {
                    throw new IOException("connection reset");
                }

                @Override
                public int read(byte[] b, int off, int len) throws IOException {
                    throw new IOException("connection reset");
                }
            };

            ExtractionResult result = extractor.extract(null, json(), RequestBody.streaming(failing, 100));

            assertThat(result.isError()).isTrue();
            assertThat(result.error().statusCode()).isEqualTo(400);
            assertThat(result.error().message()).isNotBlank();
        }

        @Test
        @DisplayName("extraction is deterministic for the same bytes")
        void idempotent() throws Exception {
            String body = "{\"auth\":\"abc123\",\"n\":[1,2,3]}";

            ExtractionResult first = extractor.extract(null, json(), streaming(body));
            byte[] replayed = first.body().readAllBytes();
            ExtractionResult second = extractor.extract(
                    null, json(), RequestBody.streaming(new ByteArrayInputStream(replayed), replayed.length));

            assertThat(second.token()).isEqualTo(first.token());
            assertThat(second.body().readAllBytes()).isEqualTo(replayed).isEqualTo(utf8(body));
        }
    }

    // ---------------------------------------------------------------
    // Non-JSON body
    // ---------------------------------------------------------------

    @Nested
    @DisplayName("non-JSON body")
    class NonJsonBody {

        @Test
        @DisplayName("body stream stays unread")
        void nonJsonBodyUntouched() {
            RequestBody body = streaming("auth=form-token");
            ExtractionResult result =
                    extractor.extract(null, headers("Content-Type", "application/x-www-form-urlencoded"), body);

            assertThat(result.hasToken()).isFalse();
            assertThat(result.body()).isSameAs(body);
            assertThat(body.isConsumed()).isFalse();
        }

        @Test
        void missingContentTypeUntouched() {
            RequestBody body = streaming("{\"auth\":\"x\"}");
            ExtractionResult result = extractor.extract(null, HttpHeaders.empty(), body);

            assertThat(result.hasToken()).isFalse();
            assertThat(body.isConsumed()).isFalse();
        }
    }

    // ---------------------------------------------------------------
    // Inspection limit
    // ---------------------------------------------------------------

    @Nested
    @DisplayName("JSON inspection limit")
    class InspectionLimit {

        @Test
        @DisplayName("oversized body is replayed intact without a token")
        void oversizedBodyReplayed() throws Exception {
            AuthExtractor limited = new AuthExtractor(8);
            String body = "{\"auth\":\"abc123\"}";

            ExtractionResult result = limited.extract(null, json(), streaming(body));

            assertThat(result.hasToken()).isFalse();
            assertThat(result.body().isStreaming()).isTrue();
            assertThat(result.body().contentLength()).isEqualTo(body.length());
            assertThat(result.body().readAllBytes()).isEqualTo(utf8(body));
        }

        @Test
        void bodyAtLimitIsInspected() throws Exception {
            String body = "{\"auth\":\"abc123\"}";
            AuthExtractor limited = new AuthExtractor(body.length());

            ExtractionResult result = limited.extract(null, json(), streaming(body));

            assertThat(result.token()).map(AuthToken::value).contains("abc123");
            assertThat(result.body().readAllBytes()).isEqualTo(utf8(body));
        }
    }
}
