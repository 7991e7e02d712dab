package com.capsulo.cms.core.draft;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import com.capsulo.cms.core.cache.BranchExistenceCache;
import com.capsulo.cms.core.cache.IdentityCache;
import com.capsulo.cms.core.concurrent.SingleFlight;
import com.capsulo.cms.core.git.GitProvider;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Owns the process-wide state of the engine (identity cache, branch-existence cache, in-flight
 * branch creations) and opens {@link DraftStore}s that share it, one per credential and
 * repository. Branch state is kept apart per repository; identities are per credential.
 */
public final class DraftStores {

    /** Binds a credential to one repository. */
    @FunctionalInterface
    public interface ProviderFactory {
        GitProvider create(String token, String owner, String repo);
    }

    private final ProviderFactory providers;
    private final String defaultOwner;
    private final String defaultRepo;
    private final ObjectMapper om;
    private final IdentityCache identities = new IdentityCache();
    private final BranchExistenceCache existence;
    private final SingleFlight<String> creations = new SingleFlight<>();
    private final int maxAttempts;
    private final Duration baseDelay;
    private final CommitEngine.Sleeper sleeper;

    public DraftStores(ProviderFactory providers, String defaultOwner, String defaultRepo, ObjectMapper om,
                       Clock clock, Duration branchCacheTtl, int maxAttempts, Duration baseDelay,
                       CommitEngine.Sleeper sleeper) {
        this.providers = Objects.requireNonNull(providers, "providers");
        this.defaultOwner = defaultOwner;
        this.defaultRepo = defaultRepo;
        this.om = Objects.requireNonNull(om, "om");
        this.existence = new BranchExistenceCache(clock, branchCacheTtl);
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
    }

    /** A store for the configured repository. */
    public DraftStore open(String token) {
        if (defaultOwner == null || defaultOwner.isBlank() || defaultRepo == null || defaultRepo.isBlank()) {
            throw new IllegalStateException("no default repository configured (REPO_OWNER / REPO_NAME)");
        }
        return open(token, defaultOwner, defaultRepo);
    }

    public DraftStore open(String token, String owner, String repo) {
        if (token == null || token.isBlank()) throw new IllegalArgumentException("token is required");
        if (owner == null || owner.isBlank()) throw new IllegalArgumentException("repository owner is required");
        if (repo == null || repo.isBlank()) throw new IllegalArgumentException("repository name is required");

        GitProvider git = providers.create(token, owner.trim(), repo.trim());
        BranchCoordinator branches = new BranchCoordinator(git, existence, creations);
        CommitEngine commits = new CommitEngine(git, branches, maxAttempts, baseDelay, sleeper);
        return new DraftStore(git, token, om, identities, branches, commits);
    }

    public IdentityCache identities() {
        return identities;
    }

    public BranchExistenceCache existence() {
        return existence;
    }
}
