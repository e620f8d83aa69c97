package io.legacyauth.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader} YAML loading and config path resolution.
 * All tests pass an explicit env lookup so the real environment never leaks
 * in.
 */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    @Nested
    @DisplayName("YAML loading")
    class YamlLoading {

        @Test
        @DisplayName("minimal file: upstream only, everything else defaulted")
        void minimal() throws Exception {
            ProxyConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV);

            assertThat(config.upstream().authority()).isEqualTo("127.0.0.1:8080");
            assertThat(config.proxyHost()).isEqualTo("127.0.0.1");
            assertThat(config.proxyPort()).isEqualTo(8536);
            assertThat(config.backendConnectTimeoutMs()).isZero();
            assertThat(config.backendReadTimeoutMs()).isZero();
            assertThat(config.maxJsonInspectBytes()).isZero();
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
        }

        @Test
        @DisplayName("full file: every key mapped")
        void full() throws Exception {
            ProxyConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV);

            assertThat(config.upstream()).isEqualTo(new UpstreamTarget("backend.internal", 9000));
            assertThat(config.backendConnectTimeoutMs()).isEqualTo(2500);
            assertThat(config.backendReadTimeoutMs()).isEqualTo(15000);
            assertThat(config.maxJsonInspectBytes()).isEqualTo(65536);
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("listen address is not configurable from YAML")
        void listenAddressFixed(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("proxy.yaml");
            Files.writeString(file, "upstream: \"127.0.0.1:8080\"\nproxy:\n  host: 0.0.0.0\n  port: 9999\n");

            ProxyConfig config = ConfigLoader.load(file, NO_ENV);

            assertThat(config.proxyHost()).isEqualTo("127.0.0.1");
            assertThat(config.proxyPort()).isEqualTo(8536);
        }

        @Test
        @DisplayName("no file at all: environment alone is enough")
        void noFile() {
            ProxyConfig config = ConfigLoader.load(null, Map.of("UPSTREAM", "localhost:3000")::get);

            assertThat(config.upstream().authority()).isEqualTo("localhost:3000");
        }

        @Test
        @DisplayName("empty file behaves like no file")
        void emptyFile() throws Exception {
            ProxyConfig config =
                    ConfigLoader.load(fixture("empty-config.yaml"), Map.of("UPSTREAM", "localhost:3000")::get);

            assertThat(config.upstream().authority()).isEqualTo("localhost:3000");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("explicit file that does not exist")
        void missingFile(@TempDir Path dir) {
            Path missing = dir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found")
                    .hasMessageContaining("nope.yaml");
        }

        @Test
        @DisplayName("invalid YAML")
        void invalidYaml() throws Exception {
            Path file = fixture("invalid-yaml-config.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML");
        }

        @Test
        @DisplayName("no upstream anywhere")
        void noUpstream() throws Exception {
            Path file = fixture("no-upstream-config.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("upstream");
        }

        @Test
        @DisplayName("upstream given as a URL")
        void malformedUpstream() throws Exception {
            Path file = fixture("malformed-upstream-config.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("host:port");
        }

        @Test
        @DisplayName("non-numeric timeout")
        void nonNumeric() throws Exception {
            Path file = fixture("non-numeric-config.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("backend.read-timeout-ms");
        }
    }

    @Nested
    @DisplayName("Config path resolution")
    class PathResolution {

        @Test
        @DisplayName("--config wins")
        void explicitPath() {
            Path resolved = ConfigLoader.resolveConfigPath(new String[] {"--config", "/etc/proxy/custom.yaml"});

            assertThat(resolved).isEqualTo(Path.of("/etc/proxy/custom.yaml"));
        }

        @Test
        @DisplayName("--config without a value")
        void explicitPathMissingValue() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("--config");
        }

        @Test
        @DisplayName("without --config: default file only if present")
        void defaultPath() {
            Path resolved = ConfigLoader.resolveConfigPath(new String[0]);

            if (Files.exists(Path.of(ConfigLoader.DEFAULT_CONFIG_FILE))) {
                assertThat(resolved).isEqualTo(Path.of(ConfigLoader.DEFAULT_CONFIG_FILE));
            } else {
                assertThat(resolved).isNull();
            }
        }
    }
}
