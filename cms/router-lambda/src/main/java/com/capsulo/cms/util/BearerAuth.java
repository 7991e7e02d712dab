package com.capsulo.cms.util;

import java.util.Map;

public final class BearerAuth {
    private BearerAuth() {}

    /**
     * The token from an {@code Authorization: Bearer ...} header (any header-name case),
     * or {@code null} when there is none.
     */
    public static String token(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) return null;

        String got = getHeaderIgnoreCase(headers, "authorization");
        if (got == null) return null;
        got = got.trim();
        if (got.length() < 7 || !got.regionMatches(true, 0, "Bearer ", 0, 7)) return null;

        String token = got.substring(7).trim();
        return token.isEmpty() ? null : token;
    }

    private static String getHeaderIgnoreCase(Map<String, String> headers, String name) {
        for (var e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }
}
