package io.legacyauth.standalone;

import io.legacyauth.standalone.proxy.ProxyApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the legacy-auth proxy.
 *
 * <p>
 * Delegates to {@link ProxyApp#start(String[])} and stops the listener on JVM
 * shutdown. If startup fails (bad configuration, port already bound) the
 * error is logged and the process exits with {@link #EXIT_STARTUP_FAILURE}.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    static final int EXIT_STARTUP_FAILURE = 1;

    private StandaloneMain() {
        // utility class
    }

    /**
     * @param args command-line arguments (e.g.
     *             {@code --config path/to/config.yaml})
     */
    public static void main(String[] args) {
        ProxyApp proxy;
        try {
            proxy = ProxyApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(EXIT_STARTUP_FAILURE);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(proxy::stop, "legacy-auth-proxy-shutdown"));
    }
}
