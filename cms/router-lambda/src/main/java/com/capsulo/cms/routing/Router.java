package com.capsulo.cms.routing;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;

/**
 * Exact-path routing. Paths are compared without a trailing slash, methods case-insensitively.
 */
public final class Router {
    private final Map<String, Map<String, Route>> byPath = new LinkedHashMap<>();

    public Router add(String method, String path, Route handler) {
        byPath.computeIfAbsent(normalize(path), p -> new LinkedHashMap<>())
                .put(method.toUpperCase(Locale.ROOT), handler);
        return this;
    }

    public Route match(APIGatewayV2HTTPEvent e) {
        String m = method(e);
        Map<String, Route> methods = byPath.get(normalize(e.getRawPath()));
        if (m == null || methods == null) return null;
        return methods.get(m.toUpperCase(Locale.ROOT));
    }

    /** Methods registered for the event's path, empty for an unknown path. */
    public Set<String> allowed(APIGatewayV2HTTPEvent e) {
        Map<String, Route> methods = byPath.get(normalize(e.getRawPath()));
        return methods == null ? Set.of() : methods.keySet();
    }

    static String method(APIGatewayV2HTTPEvent e) {
        if (e.getRequestContext() != null && e.getRequestContext().getHttp() != null) {
            return e.getRequestContext().getHttp().getMethod();
        }
        return null;
    }

    private static String normalize(String path) {
        if (path == null) return "";
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
