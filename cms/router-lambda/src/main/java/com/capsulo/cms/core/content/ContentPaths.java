package com.capsulo.cms.core.content;

import java.util.regex.Pattern;

import com.capsulo.cms.util.ApiException;

/**
 * Where content documents live in the site repository.
 */
public final class ContentPaths {
    private ContentPaths() {}

    public static final String PAGES_DIR = "src/content/pages";
    public static final String GLOBALS_PATH = "src/content/globals.json";

    private static final Pattern SAFE_PAGE_NAME = Pattern.compile("^[A-Za-z0-9_-]+$");

    /** The home page is stored as {@code index.json}. */
    public static String pagePath(String pageName) {
        return PAGES_DIR + "/" + fileName(pageName) + ".json";
    }

    static String fileName(String pageName) {
        validatePageName(pageName);
        return "home".equals(pageName) ? "index" : pageName;
    }

    public static void validatePageName(String pageName) {
        if (pageName == null || pageName.isBlank()) throw new ApiException(400, "pageName is required");
        if (pageName.indexOf('\0') >= 0) {
            throw new ApiException(400, "Invalid page name \"" + pageName.replace("\0", "") + "\": contains null bytes");
        }
        if (pageName.contains("/") || pageName.contains("\\") || pageName.contains("..")) {
            throw new ApiException(400, "Invalid page name \"" + pageName + "\": contains path characters");
        }
        if (!SAFE_PAGE_NAME.matcher(pageName).matches()) {
            throw new ApiException(400, "Invalid page name \"" + pageName + "\": contains invalid characters");
        }
    }
}
