package com.capsulo.cms.core.git.github;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.capsulo.cms.util.ApiException;

public final class GitHubHttp {
    private static final Logger log = LoggerFactory.getLogger(GitHubHttp.class);

    static final String API_VERSION = "2022-11-28";
    static final String USER_AGENT = "Capsulo-CMS";

    private final HttpClient http;
    private final String token;
    private final String apiUrl;
    private final Duration timeout;

    public GitHubHttp(HttpClient http, String token, String apiUrl, Duration timeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.token = Objects.requireNonNull(token, "token");
        String base = Objects.requireNonNull(apiUrl, "apiUrl").trim();
        this.apiUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.timeout = timeout == null ? Duration.ofSeconds(15) : timeout;
    }

    public String getJson(String path) {
        return send("GET", path, null);
    }

    public String postJson(String path, String body) {
        return send("POST", path, body);
    }

    public String putJson(String path, String body) {
        return send("PUT", path, body);
    }

    public String patchJson(String path, String body) {
        return send("PATCH", path, body);
    }

    public void delete(String path) {
        send("DELETE", path, null);
    }

    /**
     * Issues one request. Throws {@link GitHubApiException} for any status >= 400, 404 included;
     * callers that treat absence as a normal outcome catch it themselves.
     */
    private String send(String method, String path, String body) {
        String url = path.startsWith("http") ? path : apiUrl + path;
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/vnd.github+json")
                .header("Authorization", "Bearer " + token)
                .header("X-GitHub-Api-Version", API_VERSION)
                .header("User-Agent", USER_AGENT)
                .header("Content-Type", "application/json")
                .method(method, publisher)
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException(502, "GitHub request interrupted: " + method + " " + url, e);
        } catch (IOException e) {
            throw new ApiException(502, "GitHub request failed: " + method + " " + url + ": " + e.getMessage(), e);
        }

        int code = resp.statusCode();
        log.debug("{} {} -> {}", method, url, code);
        if (code >= 400) throw new GitHubApiException(code, method, url, resp.body());
        return resp.body() == null ? "" : resp.body();
    }
}
