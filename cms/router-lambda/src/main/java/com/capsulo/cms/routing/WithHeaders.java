package com.capsulo.cms.routing;

import java.util.Map;

/**
 * A route result that needs response headers besides content-type.
 */
public record WithHeaders(Object body, Map<String, String> headers) {
    public static WithHeaders privateCache(Object body, int maxAgeSeconds) {
        return new WithHeaders(body, Map.of("cache-control", "private, max-age=" + maxAgeSeconds));
    }
}
