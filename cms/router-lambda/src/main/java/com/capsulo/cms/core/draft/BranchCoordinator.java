package com.capsulo.cms.core.draft;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.capsulo.cms.core.cache.BranchExistenceCache;
import com.capsulo.cms.core.concurrent.SingleFlight;
import com.capsulo.cms.core.git.GitProvider;
import com.capsulo.cms.util.ApiException;

/**
 * Makes sure a branch exists before anything is written to it, creating it from the tip of the
 * repository's default branch when it does not. Within one process at most one creation per
 * repository and branch name is in flight; concurrent callers share its result.
 *
 * <p>The cache and the in-flight map are shared between coordinators of different repositories,
 * so every key is scoped by {@link GitProvider#name()}.
 */
public final class BranchCoordinator {
    private static final Logger log = LoggerFactory.getLogger(BranchCoordinator.class);

    private final GitProvider git;
    private final BranchExistenceCache existence;
    private final SingleFlight<String> creations;

    public BranchCoordinator(GitProvider git, BranchExistenceCache existence, SingleFlight<String> creations) {
        this.git = Objects.requireNonNull(git, "git");
        this.existence = Objects.requireNonNull(existence, "existence");
        this.creations = Objects.requireNonNull(creations, "creations");
    }

    public String ensureBranch(String branch) {
        requireBranch(branch);
        return creations.run(flightKey(branch), () -> createIfAbsent(branch));
    }

    /** Cached for the existence TTL; a missing branch is a normal {@code false}. */
    public boolean branchExists(String branch) {
        requireBranch(branch);
        var cached = existence.lookup(git.name(), branch);
        if (cached.isPresent()) {
            log.debug("branch {} of {} existence served from cache: {}", branch, git.name(), cached.get());
            return cached.get();
        }
        boolean exists = git.getBranchHeadSha(branch).isPresent();
        existence.record(git.name(), branch, exists);
        return exists;
    }

    /**
     * Called after a commit landed on {@code branch}. Overrides a stale {@code false} recorded by a
     * lookup that raced with the branch's creation.
     */
    public void markExists(String branch) {
        existence.record(git.name(), branch, true);
    }

    /** {@code null} forgets every branch of this repository. */
    public void forget(String branch) {
        if (branch == null) existence.clear(git.name());
        else existence.invalidate(git.name(), branch);
    }

    String flightKey(String branch) {
        return git.name() + ":" + branch;
    }

    private String createIfAbsent(String branch) {
        if (branchExists(branch)) return branch;

        String defaultBranch = git.getDefaultBranch();
        String tip = git.getBranchHeadSha(defaultBranch)
                .orElseThrow(() -> new ApiException(502, "default branch " + defaultBranch + " has no head"));

        log.info("creating branch {} in {} from {}@{}", branch, git.name(), defaultBranch, tip);
        git.createBranch(branch, tip);
        existence.invalidate(git.name(), branch);
        return branch;
    }

    private static void requireBranch(String branch) {
        if (branch == null || branch.isBlank()) throw new IllegalArgumentException("branch is required");
    }
}
