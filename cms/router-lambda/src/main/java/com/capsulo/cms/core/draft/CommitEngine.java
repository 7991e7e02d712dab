package com.capsulo.cms.core.draft;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.capsulo.cms.core.codec.ContentCodec;
import com.capsulo.cms.core.git.GitProvider;
import com.capsulo.cms.core.git.github.GitHubApiException;
import com.capsulo.cms.model.git.FileChange;
import com.capsulo.cms.model.git.TreeEntry;
import com.capsulo.cms.util.ApiException;

/**
 * Writes files to a branch as commits.
 *
 * <p>A single file goes through the contents API with the blob sha as an optimistic lock: the
 * sha is read fresh before every attempt and a stale one makes the remote answer 409, after which
 * the write is retried with linear backoff ({@code attempt * baseDelay}).
 *
 * <p>Several files are committed at once through the git data API: blobs, one tree on top of the
 * branch's current tree, one commit with the current head as its only parent, and a
 * non-forced ref update. If the branch moved in between, the ref update is rejected as not a
 * fast-forward and the tree and commit are rebuilt on the new head, with the same bound and
 * backoff as single-file writes.
 */
public final class CommitEngine {
    private static final Logger log = LoggerFactory.getLogger(CommitEngine.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);

    // fragments of GitHub's 422 messages
    private static final String SHA_NOT_SUPPLIED = "wasn't supplied";
    private static final String NOT_FAST_FORWARD = "not a fast forward";

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration d) throws InterruptedException;
    }

    private final GitProvider git;
    private final BranchCoordinator branches;
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public CommitEngine(GitProvider git, BranchCoordinator branches) {
        this(git, branches, DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, d -> Thread.sleep(d.toMillis()));
    }

    public CommitEngine(GitProvider git, BranchCoordinator branches, int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.git = Objects.requireNonNull(git, "git");
        this.branches = Objects.requireNonNull(branches, "branches");
        this.maxAttempts = maxAttempts;
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Returns the sha of the commit that was created.
     */
    public String commitSingleFile(String path, String content, String message, String branch, boolean ensureBranchFirst) {
        requireText(path, "path");
        requireText(branch, "branch");
        if (content == null) throw new IllegalArgumentException("content is required");

        if (ensureBranchFirst) branches.ensureBranch(branch);
        String encoded = ContentCodec.encode(content);

        for (int attempt = 1; ; attempt++) {
            String sha = git.getFileSha(path, branch).orElse(null);
            try {
                String commitSha = git.putFile(path, encoded, message, branch, sha);
                branches.markExists(branch);
                log.info("committed {} to {} ({})", path, branch, shortSha(commitSha));
                return commitSha;
            } catch (GitHubApiException e) {
                if (!isStaleSha(e, sha) || attempt >= maxAttempts) throw e;
                log.warn("stale sha for {} on {} (attempt {}/{}), retrying", path, branch, attempt, maxAttempts);
                backoff(attempt);
            }
        }
    }

    /**
     * No files is a no-op and one file is a plain single-file commit. Returns the new head sha,
     * or null when nothing was committed.
     */
    public String commitMultipleFiles(List<FileChange> files, String message, String branch, boolean ensureBranchFirst) {
        requireText(branch, "branch");
        if (files == null || files.isEmpty()) return null;

        Map<String, String> byPath = new LinkedHashMap<>();
        for (FileChange f : files) {
            if (f == null) continue;
            requireText(f.path(), "path");
            if (f.content() == null) throw new IllegalArgumentException("content is required for " + f.path());
            byPath.put(f.path(), f.content());
        }
        if (byPath.isEmpty()) return null;
        if (byPath.size() == 1) {
            var only = byPath.entrySet().iterator().next();
            return commitSingleFile(only.getKey(), only.getValue(), message, branch, ensureBranchFirst);
        }

        if (ensureBranchFirst) branches.ensureBranch(branch);

        List<TreeEntry> entries = null;
        for (int attempt = 1; ; attempt++) {
            String head = git.getBranchHeadSha(branch)
                    .orElseThrow(() -> new ApiException(404, "branch " + branch + " does not exist"));
            String baseTree = git.getCommitTreeSha(head);

            // blobs are content-addressed, so a retry can reuse them
            if (entries == null) entries = createBlobs(byPath);

            String tree = git.createTree(baseTree, entries);
            String commit = git.createCommit(message, tree, head);
            try {
                git.updateRef(branch, commit);
                branches.markExists(branch);
                log.info("committed {} files to {} ({})", entries.size(), branch, shortSha(commit));
                return commit;
            } catch (GitHubApiException e) {
                if (!isMovedBranch(e) || attempt >= maxAttempts) throw e;
                log.warn("branch {} moved past {} (attempt {}/{}), rebuilding commit", branch, shortSha(head), attempt, maxAttempts);
                backoff(attempt);
            }
        }
    }

    private List<TreeEntry> createBlobs(Map<String, String> byPath) {
        List<TreeEntry> entries = new ArrayList<>(byPath.size());
        for (var e : byPath.entrySet()) {
            entries.add(new TreeEntry(e.getKey(), git.createBlob(e.getValue())));
        }
        return entries;
    }

    /**
     * 409 is a sha mismatch. A 422 saying the sha "wasn't supplied" means the file appeared after
     * we looked. Any other 422 (bad content, bad path) is not a race.
     */
    private static boolean isStaleSha(GitHubApiException e, String sentSha) {
        if (e.isConflict()) return true;
        return e.isUnprocessable() && sentSha == null && e.bodyMentions(SHA_NOT_SUPPLIED);
    }

    /** Only a rejected fast-forward means the branch moved; a missing object or ref does not. */
    private static boolean isMovedBranch(GitHubApiException e) {
        return e.isUnprocessable() && e.bodyMentions(NOT_FAST_FORWARD);
    }

    private void backoff(int attempt) {
        try {
            sleeper.sleep(baseDelay.multipliedBy(attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException(503, "interrupted while waiting to retry commit", e);
        }
    }

    private static String shortSha(String sha) {
        if (sha == null) return "?";
        return sha.length() > 7 ? sha.substring(0, 7) : sha;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException(field + " is required");
    }
}
