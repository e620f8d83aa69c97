package io.legacyauth.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ProxyConfig} from an optional YAML file with an environment
 * variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code legacy-auth-proxy.yaml} from the current directory
 * if it exists, otherwise runs on defaults plus environment</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path,
 * which must exist</li>
 * </ul>
 *
 * <p>
 * Environment variables take precedence over YAML values. An env var is
 * considered "set" if and only if it is defined AND its trimmed value is
 * non-empty; empty or whitespace-only values are treated as "unset" and the
 * YAML value is used.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "legacy-auth-proxy.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link ProxyConfig}, applying environment variable overrides
     * from {@link System#getenv}.
     *
     * @param configPath path to the YAML file, or {@code null} for none
     * @return a fully constructed {@link ProxyConfig}
     * @throws ConfigLoadException if the file is missing or invalid, or the
     *                             resulting configuration is incomplete
     */
    public static ProxyConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link ProxyConfig}, applying environment variable overrides from
     * the supplied lookup function.
     *
     * <p>
     * The {@code envLookup} function maps environment variable names to their
     * values. Returning {@code null} means the variable is not defined.
     *
     * @param configPath path to the YAML file, or {@code null} for none
     * @param envLookup  environment variable lookup function
     * @return a fully constructed {@link ProxyConfig}
     * @throws ConfigLoadException if the file is missing or invalid, or the
     *                             resulting configuration is incomplete
     */
    public static ProxyConfig load(Path configPath, Function<String, String> envLookup) {
        JsonNode root = configPath == null ? MissingNode.getInstance() : readYaml(configPath);
        try {
            return mapToConfig(root, envLookup);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid numeric configuration value: " + e.getMessage(), e);
        }
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the explicit {@code --config} path, the default file if it exists
     *         in the working directory, or {@code null} when there is none
     * @throws ConfigLoadException if {@code --config} has no argument
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new ConfigLoadException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        Path fallback = Path.of(DEFAULT_CONFIG_FILE);
        return Files.exists(fallback) ? fallback : null;
    }

    private static JsonNode readYaml(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            // an empty file parses to null / MissingNode
            return root == null ? MissingNode.getInstance() : root;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    /**
     * Maps a parsed YAML tree to a {@link ProxyConfig} via the builder, then
     * overlays environment variable overrides.
     */
    private static ProxyConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ProxyConfig.Builder builder = ProxyConfig.builder();
        String upstream = textOrNull(root, "upstream");

        JsonNode backend = root.path("backend");
        if (backend.has("connect-timeout-ms"))
            builder.backendConnectTimeoutMs(intValue(backend, "backend.connect-timeout-ms", "connect-timeout-ms"));
        if (backend.has("read-timeout-ms"))
            builder.backendReadTimeoutMs(intValue(backend, "backend.read-timeout-ms", "read-timeout-ms"));

        JsonNode auth = root.path("auth");
        if (auth.has("max-json-inspect-bytes"))
            builder.maxJsonInspectBytes(intValue(auth, "auth.max-json-inspect-bytes", "max-json-inspect-bytes"));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---
        upstream = envStringOrDefault(envLookup, "UPSTREAM", upstream);
        envInt(envLookup, "BACKEND_CONNECT_TIMEOUT_MS", builder::backendConnectTimeoutMs);
        envInt(envLookup, "BACKEND_READ_TIMEOUT_MS", builder::backendReadTimeoutMs);
        envInt(envLookup, "AUTH_MAX_JSON_INSPECT_BYTES", builder::maxJsonInspectBytes);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        builder.upstream(UpstreamTarget.parse(upstream));
        return builder.build();
    }

    // --- Env helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies an integer env var override if set. */
    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + raw + "'", e);
            }
        }
    }

    /** Returns the env var value if set, otherwise the YAML default. */
    private static String envStringOrDefault(Function<String, String> envLookup, String envVar, String yamlDefault) {
        return isSet(envLookup, envVar) ? envLookup.apply(envVar).trim() : yamlDefault;
    }

    // --- YAML helpers ---

    private static String textOrNull(JsonNode node, String field) {
        return node.has(field) && !node.get(field).isNull() ? node.get(field).asText() : null;
    }

    private static int intValue(JsonNode node, String key, String field) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException(key + " must be an integer, got '" + value.asText() + "'");
        }
        return value.intValue();
    }
}
