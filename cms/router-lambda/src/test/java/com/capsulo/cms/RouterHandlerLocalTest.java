package com.capsulo.cms;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

import com.amazonaws.services.lambda.runtime.ClientContext;
import com.amazonaws.services.lambda.runtime.CognitoIdentity;
import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import com.capsulo.cms.app.App;
import com.capsulo.cms.app.Config;
import com.capsulo.cms.core.draft.FakeGit;
import com.capsulo.cms.handler.RouterHandler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class RouterHandlerLocalTest {

    private final ObjectMapper om = new ObjectMapper();
    private final FakeGit git = new FakeGit().withBranch("main", "abc123");
    private final List<String> tokensUsed = new ArrayList<>();

    private RouterHandler handler(String serverToken) {
        Config config = new Config("http://127.0.0.1:1", serverToken, "capsulo", "site", "cms-draft",
                Duration.ofSeconds(30), 3, Duration.ZERO, Duration.ofSeconds(1));
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        return new RouterHandler(new App(config, clock, (token, owner, repo) -> {
            tokensUsed.add(token);
            return git;
        }));
    }

    private APIGatewayV2HTTPResponse call(RouterHandler h, String method, String path, String body, String token) {
        return call(h, method, path, body, token, null);
    }

    private APIGatewayV2HTTPResponse call(RouterHandler h, String method, String path, String body, String token,
                                          Map<String, String> query) {
        APIGatewayV2HTTPEvent evt = newEvent(method, path, body, token);
        evt.setQueryStringParameters(query);
        return h.handleRequest(evt, new FakeContext());
    }

    private JsonNode json(APIGatewayV2HTTPResponse resp) throws Exception {
        return om.readTree(resp.getBody());
    }

    @Test
    void healthz_ok() throws Exception {
        var resp = call(handler(""), "GET", "/healthz", null, null);

        assertEquals(200, resp.getStatusCode());
        assertTrue(json(resp).path("ok").asBoolean());
    }

    @Test
    void unknownRouteIs404() throws Exception {
        var resp = call(handler(""), "GET", "/cms/nope", null, "t");

        assertEquals(404, resp.getStatusCode());
        assertEquals("NOT_FOUND", json(resp).path("error").path("code").asText());
    }

    @Test
    void wrongMethodIs405WithAllowHeader() throws Exception {
        var resp = call(handler(""), "GET", "/cms/publish", null, "t");

        assertEquals(405, resp.getStatusCode());
        assertEquals("POST", resp.getHeaders().get("allow"));
        assertEquals("METHOD_NOT_ALLOWED", json(resp).path("error").path("code").asText());
        assertEquals(0, git.calls.size());
    }

    @Test
    void trailingSlashIsIgnored() {
        assertEquals(200, call(handler(""), "GET", "/healthz/", null, null).getStatusCode());
    }

    @Test
    void missingTokenIs401() throws Exception {
        var resp = call(handler(""), "GET", "/cms/me", null, null);

        assertEquals(401, resp.getStatusCode());
        assertEquals("UNAUTHORIZED", json(resp).path("error").path("code").asText());
        assertTrue(tokensUsed.isEmpty());
    }

    @Test
    void meReturnsTheLogin() throws Exception {
        var resp = call(handler(""), "GET", "/cms/me", null, "ghp_editor");

        assertEquals(200, resp.getStatusCode());
        assertEquals("octocat", json(resp).path("login").asText());
        assertEquals(List.of("ghp_editor"), tokensUsed);
    }

    @Test
    void serverTokenIsUsedWhenRequestHasNone() {
        var resp = call(handler("ghp_server"), "GET", "/cms/me", null, null);

        assertEquals(200, resp.getStatusCode());
        assertEquals(List.of("ghp_server"), tokensUsed);
    }

    @Test
    void saveWithEmptyBodyIs400() {
        var resp = call(handler(""), "POST", "/cms/save", "", "t");

        assertEquals(400, resp.getStatusCode());
    }

    @Test
    void saveWithInvalidJsonIs400() throws Exception {
        var resp = call(handler(""), "POST", "/cms/save", "{not json", "t");

        assertEquals(400, resp.getStatusCode());
        assertEquals("Invalid JSON in request body", json(resp).path("error").path("message").asText());
    }

    @Test
    void saveWithUnsafePageNameIs400() {
        var resp = call(handler(""), "POST", "/cms/save",
                "{\"pageName\":\"../etc\",\"data\":{\"a\":1}}", "t");

        assertEquals(400, resp.getStatusCode());
        assertTrue(git.calls.isEmpty());
    }

    @Test
    void saveWritesToTheDraftBranch() throws Exception {
        var resp = call(handler(""), "POST", "/cms/save",
                "{\"pageName\":\"home\",\"data\":{\"title\":\"Hi\"}}", "t");

        assertEquals(200, resp.getStatusCode());
        JsonNode body = json(resp);
        assertTrue(body.path("githubSynced").asBoolean());
        assertEquals("cms-draft", body.path("draftBranch").asText());
        assertTrue(git.file("cms-draft", "src/content/pages/index.json").contains("\"Hi\""));
    }

    @Test
    void publishWithoutDraftIs409() throws Exception {
        var resp = call(handler(""), "POST", "/cms/publish", null, "t");

        assertEquals(409, resp.getStatusCode());
        assertEquals("CONFLICT", json(resp).path("error").path("code").asText());
    }

    @Test
    void draftStatusFollowsTheDraftBranch() throws Exception {
        var h = handler("");
        assertFalse(json(call(h, "GET", "/cms/draft", null, "t")).path("exists").asBoolean());

        git.withBranch("cms-draft", "abc123");
        var resp = call(handler(""), "GET", "/cms/draft", null, "t");

        assertEquals(200, resp.getStatusCode());
        assertTrue(json(resp).path("exists").asBoolean());
        assertEquals("cms-draft", json(resp).path("branch").asText());
    }

    @Test
    void commitShaIsPrivatelyCacheable() throws Exception {
        var resp = call(handler(""), "GET", "/cms/commit-sha", null, "t");

        assertEquals(200, resp.getStatusCode());
        assertEquals("private, max-age=30", resp.getHeaders().get("cache-control"));
        assertEquals("abc123", json(resp).path("sha").asText());
    }

    @Test
    void changesNeedsAPageAndAKnownSource() {
        var h = handler("");

        assertEquals(400, call(h, "GET", "/cms/changes", null, "t").getStatusCode());
        assertEquals(400, call(h, "GET", "/cms/changes", null, "t",
                Map.of("page", "home", "branch", "feature")).getStatusCode());
        assertEquals(200, call(h, "GET", "/cms/changes", null, "t",
                Map.of("page", "home", "branch", "draft")).getStatusCode());
    }

    @Test
    void upstreamFailureKeepsItsStatus() throws Exception {
        var resp = call(handler(""), "GET", "/cms/commit", null, "t", Map.of("sha", "missing"));

        assertEquals(404, resp.getStatusCode());
    }

    private static APIGatewayV2HTTPEvent newEvent(String method, String path, String body, String token) {
        APIGatewayV2HTTPEvent evt = new APIGatewayV2HTTPEvent();
        evt.setRawPath(path);
        evt.setBody(body);

        Map<String, String> headers = new HashMap<>();
        headers.put("content-type", "application/json");
        if (token != null) headers.put("Authorization", "Bearer " + token);
        evt.setHeaders(headers);

        APIGatewayV2HTTPEvent.RequestContext rc = new APIGatewayV2HTTPEvent.RequestContext();
        APIGatewayV2HTTPEvent.RequestContext.Http http = new APIGatewayV2HTTPEvent.RequestContext.Http();
        http.setMethod(method);
        http.setPath(path);
        rc.setHttp(http);
        evt.setRequestContext(rc);

        return evt;
    }

    static final class FakeContext implements Context {
        private final LambdaLogger logger = new LambdaLogger() {
            @Override public void log(String message) { System.out.println(message); }
            @Override public void log(byte[] message) { System.out.println(new String(message)); }
        };

        @Override public String getAwsRequestId() { return "test"; }
        @Override public String getLogGroupName() { return "test"; }
        @Override public String getLogStreamName() { return "test"; }
        @Override public String getFunctionName() { return "test"; }
        @Override public String getFunctionVersion() { return "test"; }
        @Override public String getInvokedFunctionArn() { return "test"; }
        @Override public CognitoIdentity getIdentity() { return null; }
        @Override public ClientContext getClientContext() { return null; }
        @Override public int getRemainingTimeInMillis() { return 30_000; }
        @Override public int getMemoryLimitInMB() { return 512; }
        @Override public LambdaLogger getLogger() { return logger; }
    }
}
