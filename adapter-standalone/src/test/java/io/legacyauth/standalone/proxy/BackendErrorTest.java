package io.legacyauth.standalone.proxy;

import static org.assertj.core.api.Assertions.assertThat;

import io.legacyauth.standalone.config.ProxyConfig;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Upstream failures become {@code 502} plain-text responses naming the
 * failure.
 */
@DisplayName("Proxy — backend error handling")
class BackendErrorTest {

    @Nested
    @DisplayName("Unreachable upstream")
    class Unreachable {

        private ProxyApp proxy;

        @AfterEach
        void tearDown() {
            if (proxy != null) {
                proxy.stop();
            }
        }

        @Test
        @DisplayName("connection refused → 502 with a non-empty explanation")
        void connectionRefused() throws Exception {
            // nobody listens on port 1
            proxy = ProxyApp.start(ProxyConfig.builder()
                    .proxyPort(0)
                    .upstream("127.0.0.1:1")
                    .build());

            HttpResponse<String> response = send(proxy.port(), "/api/test?auth=s3cret");

            assertThat(response.statusCode()).isEqualTo(502);
            assertThat(response.headers().firstValue("content-type")).hasValueSatisfying(ct -> assertThat(ct)
                    .startsWith("text/plain"));
            assertThat(response.body())
                    .startsWith("Upstream failed to respond: ")
                    .contains("127.0.0.1:1")
                    .doesNotContain("s3cret");
        }
    }

    @Nested
    @DisplayName("Slow upstream")
    class Slow extends ProxyTestHarness {

        @AfterEach
        void tearDown() {
            stopInfrastructure();
        }

        @Test
        @DisplayName("configured response timeout exceeded → 502")
        void timeout() throws Exception {
            startInfrastructure(builder -> builder.backendReadTimeoutMs(200));
            registerBackendHandler("/slow", exchange -> {
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                exchange.sendResponseHeaders(200, -1);
                exchange.close();
            });

            HttpResponse<byte[]> response = get("/slow");

            assertThat(response.statusCode()).isEqualTo(502);
            assertThat(new String(response.body(), StandardCharsets.UTF_8))
                    .startsWith("Upstream failed to respond: ")
                    .contains("timeout");
        }

        @Test
        @DisplayName("upstream closing the connection without a response → 502")
        void connectionDropped() throws Exception {
            startInfrastructure();
            registerBackendHandler("/drop", exchange -> {
                throw new java.io.IOException("dropping connection");
            });

            HttpResponse<byte[]> response = get("/drop");

            assertThat(response.statusCode()).isEqualTo(502);
            assertThat(new String(response.body(), StandardCharsets.UTF_8)).startsWith("Upstream failed to respond: ");
        }
    }

    private static HttpResponse<String> send(int port, String pathAndQuery) throws Exception {
        HttpClient client =
                HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + port + pathAndQuery))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
