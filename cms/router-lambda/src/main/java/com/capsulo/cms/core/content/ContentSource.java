package com.capsulo.cms.core.content;

import com.capsulo.cms.util.ApiException;

public enum ContentSource {
    MAIN, DRAFT;

    public static ContentSource parse(String raw) {
        if (raw != null) {
            String s = raw.trim().toLowerCase();
            if ("main".equals(s)) return MAIN;
            if ("draft".equals(s)) return DRAFT;
        }
        throw new ApiException(400, "Missing or invalid branch parameter. Use \"main\" or \"draft\"");
    }
}
