package com.cronium.runtime.web;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpMethod;

/**
 * Which requests go through authentication and rate limiting.
 *
 * Everything under /executions and /tool-actions is protected; operational
 * endpoints (/health, /metrics) and CORS preflight requests are not.
 */
public final class ProtectedRoutes {

    private static final String[] PREFIXES = { "/executions/", "/tool-actions/" };

    private ProtectedRoutes() {}

    public static boolean requiresAuthentication(HttpServletRequest request) {
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return false;
        }
        String path = pathWithinApplication(request);
        for (String prefix : PREFIXES) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
