package io.legacyauth.standalone.config;

import java.util.List;
import java.util.Locale;

/**
 * Root configuration for the legacy-auth proxy.
 *
 * <p>
 * Built once at startup by {@link ConfigLoader} and handed to each component.
 * Every field has a default except {@code upstream}, which is required. The
 * listen address is not read from YAML or the environment; the builder
 * exposes it so tests can bind an ephemeral port.
 *
 * @param proxyHost               bind address, fixed at {@code 127.0.0.1}
 * @param proxyPort               listen port, fixed at {@code 8536}; {@code 0}
 *                                picks an ephemeral port
 * @param upstream                the backend to forward to (required)
 * @param backendConnectTimeoutMs TCP connect timeout in ms, {@code 0} = none
 * @param backendReadTimeoutMs    response timeout in ms, {@code 0} = none
 * @param maxJsonInspectBytes     largest JSON body inspected for a token,
 *                                {@code 0} = unlimited
 * @param loggingFormat           {@code json} or {@code text}
 * @param loggingLevel            root log level
 */
public record ProxyConfig(
        String proxyHost,
        int proxyPort,
        UpstreamTarget upstream,
        int backendConnectTimeoutMs,
        int backendReadTimeoutMs,
        int maxJsonInspectBytes,
        String loggingFormat,
        String loggingLevel) {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 8536;

    static final List<String> LOGGING_FORMATS = List.of("text", "json");
    static final List<String> LOGGING_LEVELS = List.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR");

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ProxyConfig}. All fields have defaults except {@code upstream}. */
    public static final class Builder {
        private String proxyHost = DEFAULT_HOST;
        private int proxyPort = DEFAULT_PORT;
        private UpstreamTarget upstream;
        private int backendConnectTimeoutMs = 0;
        private int backendReadTimeoutMs = 0;
        private int maxJsonInspectBytes = 0;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder proxyHost(String proxyHost) {
            this.proxyHost = proxyHost;
            return this;
        }

        public Builder proxyPort(int proxyPort) {
            this.proxyPort = proxyPort;
            return this;
        }

        public Builder upstream(UpstreamTarget upstream) {
            this.upstream = upstream;
            return this;
        }

        /** Parses and sets the upstream from {@code host:port}. */
        public Builder upstream(String hostAndPort) {
            this.upstream = UpstreamTarget.parse(hostAndPort);
            return this;
        }

        public Builder backendConnectTimeoutMs(int backendConnectTimeoutMs) {
            this.backendConnectTimeoutMs = backendConnectTimeoutMs;
            return this;
        }

        public Builder backendReadTimeoutMs(int backendReadTimeoutMs) {
            this.backendReadTimeoutMs = backendReadTimeoutMs;
            return this;
        }

        public Builder maxJsonInspectBytes(int maxJsonInspectBytes) {
            this.maxJsonInspectBytes = maxJsonInspectBytes;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if {@code upstream} is missing, a numeric
         *                             setting is negative, or a logging setting
         *                             is unknown
         */
        public ProxyConfig build() {
            if (upstream == null) {
                throw new ConfigLoadException("Missing required configuration: upstream (host:port)");
            }
            requireNonNegative("backend.connect-timeout-ms", backendConnectTimeoutMs);
            requireNonNegative("backend.read-timeout-ms", backendReadTimeoutMs);
            requireNonNegative("auth.max-json-inspect-bytes", maxJsonInspectBytes);
            if (!LOGGING_FORMATS.contains(loggingFormat.toLowerCase(Locale.ROOT))) {
                throw new ConfigLoadException("logging.format must be one of " + LOGGING_FORMATS + ", got '"
                        + loggingFormat + "'");
            }
            if (!LOGGING_LEVELS.contains(loggingLevel.toUpperCase(Locale.ROOT))) {
                throw new ConfigLoadException("logging.level must be one of " + LOGGING_LEVELS + ", got '"
                        + loggingLevel + "'");
            }
            if (proxyPort < 0 || proxyPort > 65535) {
                throw new ConfigLoadException("Listen port out of range: " + proxyPort);
            }

            return new ProxyConfig(
                    proxyHost,
                    proxyPort,
                    upstream,
                    backendConnectTimeoutMs,
                    backendReadTimeoutMs,
                    maxJsonInspectBytes,
                    loggingFormat,
                    loggingLevel);
        }

        private static void requireNonNegative(String key, int value) {
            if (value < 0) {
                throw new ConfigLoadException(key + " must be >= 0, got " + value);
            }
        }
    }
}
