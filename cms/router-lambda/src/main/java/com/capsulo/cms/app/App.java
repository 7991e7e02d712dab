package com.capsulo.cms.app;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

import com.capsulo.cms.core.content.ContentService;
import com.capsulo.cms.core.content.ContentSource;
import com.capsulo.cms.core.draft.CommitEngine;
import com.capsulo.cms.core.draft.DraftStores;
import com.capsulo.cms.core.git.github.GitHubProvider;
import com.capsulo.cms.model.cms.BatchSaveRequest;
import com.capsulo.cms.model.cms.IdentityResponse;
import com.capsulo.cms.model.cms.SaveGlobalsRequest;
import com.capsulo.cms.model.cms.SavePageRequest;
import com.capsulo.cms.routing.CmsRequest;
import com.capsulo.cms.routing.Router;
import com.capsulo.cms.routing.WithHeaders;
import com.capsulo.cms.util.ApiException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class App {
    private static volatile App INSTANCE;

    public final Config config;
    public final ObjectMapper om;
    public final HttpClient http;
    public final Clock clock;

    // shared by every request this process serves
    public final DraftStores stores;

    public final Router router;

    private App() {
        this(Config.fromEnv(), Clock.systemUTC());
    }

    public App(Config config, Clock clock) {
        this(config, clock, null);
    }

    /**
     * {@code providers} binds a token and repository to a provider; null means GitHub as configured.
     */
    public App(Config config, Clock clock, DraftStores.ProviderFactory providers) {
        this.config = config;
        this.clock = clock;
        this.om = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();

        this.stores = new DraftStores(
                providers != null ? providers : (token, owner, repo) -> new GitHubProvider(http, token,
                        config.githubApiUrl(), config.httpTimeout(), owner, repo, om),
                config.repoOwner(),
                config.repoName(),
                om,
                clock,
                config.branchCacheTtl(),
                config.commitMaxAttempts(),
                config.commitRetryBaseDelay(),
                d -> Thread.sleep(d.toMillis())
        );

        this.router = new Router()
                .add("GET", "/healthz", req -> new Healthz(true))

                .add("GET", "/cms/me", req ->
                        new IdentityResponse(stores.open(req.requireToken()).getAuthenticatedIdentity()))

                .add("POST", "/cms/save", req -> {
                    var body = req.body(SavePageRequest.class);
                    return content(req).savePage(body.pageName(), body.data(), body.commitMessage());
                })

                .add("POST", "/cms/globals/save", req -> {
                    var body = req.body(SaveGlobalsRequest.class);
                    return content(req).saveGlobals(body.data(), body.commitMessage());
                })

                .add("POST", "/cms/batch-save", req -> {
                    var body = req.body(BatchSaveRequest.class);
                    return content(req).batchCommit(body.pages(), body.globals(), body.commitMessage());
                })

                .add("POST", "/cms/publish", req -> content(req).publish())

                .add("GET", "/cms/draft", req -> content(req).draftStatus())

                .add("GET", "/cms/changes", req -> {
                    String page = req.query("page");
                    if (page == null) throw new ApiException(400, "Missing page parameter");
                    return content(req).loadPage(page, ContentSource.parse(req.query("branch")));
                })

                .add("GET", "/cms/globals/load", req ->
                        content(req).loadGlobals(ContentSource.parse(req.query("branch"))))

                .add("GET", "/cms/commit-sha", req ->
                        WithHeaders.privateCache(content(req).latestCommitSha(), 30))

                .add("GET", "/cms/history", req ->
                        content(req).history(req.queryInt("page", 1), req.queryInt("perPage", 20)))

                .add("GET", "/cms/commit", req -> content(req).commitDetail(req.query("sha")));
    }

    private ContentService content(CmsRequest req) {
        return new ContentService(stores.open(req.requireToken()), om, config.draftBranch(), clock);
    }

    public static App get() {
        if (INSTANCE == null) {
            synchronized (App.class) {
                if (INSTANCE == null) INSTANCE = new App();
            }
        }
        return INSTANCE;
    }

    public record Healthz(boolean ok) {}
}
