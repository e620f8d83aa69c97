package io.legacyauth.standalone.adapter;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import java.io.IOException;
import java.util.Set;

/**
 * Lets requests with methods Javalin cannot route (WebDAV {@code PROPFIND},
 * cache {@code PURGE}, ...) reach the proxy handler.
 *
 * <p>
 * Such a request is presented to Javalin as {@link #ROUTED_AS}; the method the
 * client actually sent is kept in the {@link #ORIGINAL_METHOD} request
 * attribute, where {@link JavalinRequestAdapter} picks it up. Requests with a
 * routable method pass through untouched.
 */
public final class ExtensionMethodFilter implements Filter {

    /** Request attribute holding the client's method for a rerouted request. */
    public static final String ORIGINAL_METHOD = ExtensionMethodFilter.class.getName() + ".originalMethod";

    /** Method Javalin sees for a rerouted request. */
    public static final String ROUTED_AS = "POST";

    private final Set<String> routableMethods;

    /**
     * @param routableMethods methods with a registered Javalin route, matched
     *                        case-sensitively
     */
    public ExtensionMethodFilter(Set<String> routableMethods) {
        this.routableMethods = Set.copyOf(routableMethods);
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest)) {
            chain.doFilter(request, response);
            return;
        }
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String method = httpRequest.getMethod();
        if (routableMethods.contains(method)) {
            chain.doFilter(request, response);
            return;
        }
        httpRequest.setAttribute(ORIGINAL_METHOD, method);
        chain.doFilter(new ReroutedRequest(httpRequest), response);
    }

    /**
     * Returns the method the client sent, looking through a reroute.
     */
    public static String originalMethod(HttpServletRequest request) {
        Object original = request.getAttribute(ORIGINAL_METHOD);
        return original instanceof String ? (String) original : request.getMethod();
    }

    static final class ReroutedRequest extends HttpServletRequestWrapper {

        ReroutedRequest(HttpServletRequest request) {
            super(request);
        }

        @Override
        public String getMethod() {
            return ROUTED_AS;
        }
    }
}
