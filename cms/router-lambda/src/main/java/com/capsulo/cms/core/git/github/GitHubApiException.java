package com.capsulo.cms.core.git.github;

import com.capsulo.cms.util.ApiException;

/**
 * A non-2xx answer from the GitHub REST API. Keeps the raw response body so callers can tell
 * apart the different 409/422 flavours GitHub uses.
 */
public class GitHubApiException extends ApiException {
    private final String method;
    private final String url;
    private final String body;

    public GitHubApiException(int status, String method, String url, String body) {
        super(status, "GitHub error " + status + " for " + method + " " + url + ": " + body);
        this.method = method;
        this.url = url;
        this.body = body == null ? "" : body;
    }

    public String method() {
        return method;
    }

    public String url() {
        return url;
    }

    public String body() {
        return body;
    }

    public boolean isNotFound() {
        return status() == 404;
    }

    public boolean isConflict() {
        return status() == 409;
    }

    public boolean isUnprocessable() {
        return status() == 422;
    }

    /** Case-insensitive search of the raw response body. */
    public boolean bodyMentions(String fragment) {
        return body.toLowerCase().contains(fragment.toLowerCase());
    }
}
