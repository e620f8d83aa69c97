package io.legacyauth.standalone.proxy;

import io.javalin.Javalin;
import io.javalin.http.HandlerType;
import io.legacyauth.core.engine.AuthExtractor;
import io.legacyauth.core.engine.AuthRewritePipeline;
import io.legacyauth.standalone.adapter.ExtensionMethodFilter;
import io.legacyauth.standalone.adapter.JavalinRequestAdapter;
import io.legacyauth.standalone.config.ConfigLoader;
import io.legacyauth.standalone.config.ProxyConfig;
import jakarta.servlet.DispatcherType;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.eclipse.jetty.servlet.FilterHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the proxy startup sequence.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback</li>
 * <li>Build the pipeline and the upstream HTTP client</li>
 * <li>Start the Javalin HTTP server, with every path on every method routed
 * to {@link ProxyHandler}; methods Javalin has no route type for go through
 * {@link ExtensionMethodFilter}</li>
 * </ol>
 *
 * <p>
 * Separate from {@link io.legacyauth.standalone.StandaloneMain} so tests can
 * start and stop a proxy without going through {@code main()}.
 */
public final class ProxyApp {

    private static final Logger LOG = LoggerFactory.getLogger(ProxyApp.class);

    /** Methods routed to the proxy handler. */
    static final List<HandlerType> PROXIED_METHODS = List.of(
            HandlerType.GET,
            HandlerType.POST,
            HandlerType.PUT,
            HandlerType.PATCH,
            HandlerType.DELETE,
            HandlerType.HEAD,
            HandlerType.OPTIONS,
            HandlerType.TRACE);

    private final Javalin app;
    private final ProxyConfig config;

    private ProxyApp(Javalin app, ProxyConfig config) {
        this.app = app;
        this.config = config;
    }

    /**
     * Loads configuration from the command line and environment, then starts
     * the proxy.
     *
     * @param args command-line arguments (e.g.
     *             {@code --config path/to/config.yaml})
     * @return a running proxy application
     * @throws io.legacyauth.standalone.config.ConfigLoadException if the
     *                                                             configuration
     *                                                             is invalid
     */
    public static ProxyApp start(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ProxyConfig config = ConfigLoader.load(configPath);

        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath != null ? configPath : "environment");

        return start(config);
    }

    /**
     * Starts the proxy with an already-built configuration. Logging is left
     * as it is.
     *
     * @param config the proxy configuration
     * @return a running proxy application
     */
    public static ProxyApp start(ProxyConfig config) {
        long startTime = System.nanoTime();

        AuthRewritePipeline pipeline = new AuthRewritePipeline(new AuthExtractor(config.maxJsonInspectBytes()));
        UpstreamClient upstreamClient = new UpstreamClient(config);
        ProxyHandler proxyHandler = new ProxyHandler(new JavalinRequestAdapter(), pipeline, upstreamClient);

        Javalin app = Javalin.create(javalinConfig -> {
            // upstream bytes go back untouched
            javalinConfig.http.disableCompression();
            javalinConfig.showJavalinBanner = false;
            javalinConfig.jetty.modifyServletContextHandler(handler -> handler.addFilter(
                    new FilterHolder(new ExtensionMethodFilter(routedMethodNames())),
                    "/*",
                    EnumSet.of(DispatcherType.REQUEST)));
        });
        for (HandlerType method : PROXIED_METHODS) {
            app.addHttpHandler(method, "/", proxyHandler);
            app.addHttpHandler(method, "/<path>", proxyHandler);
        }

        app.start(config.proxyHost(), config.proxyPort());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info(
                "legacy-auth-proxy started: listen={}:{}, upstream={}, connectTimeoutMs={}, readTimeoutMs={}, "
                        + "maxJsonInspectBytes={}, startupMs={}",
                config.proxyHost(),
                app.port(),
                config.upstream(),
                config.backendConnectTimeoutMs(),
                config.backendReadTimeoutMs(),
                config.maxJsonInspectBytes(),
                elapsedMs);

        return new ProxyApp(app, config);
    }

    private static Set<String> routedMethodNames() {
        return PROXIED_METHODS.stream().map(HandlerType::name).collect(Collectors.toSet());
    }

    /** Returns the port the proxy is listening on. */
    public int port() {
        return app.port();
    }

    /** Returns the Javalin application. */
    public Javalin javalin() {
        return app;
    }

    /** Returns the proxy configuration. */
    public ProxyConfig config() {
        return config;
    }

    /** Stops the Javalin server. */
    public void stop() {
        app.stop();
        LOG.info("legacy-auth-proxy stopped");
    }
}
