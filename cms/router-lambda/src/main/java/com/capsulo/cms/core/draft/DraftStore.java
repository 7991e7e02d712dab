package com.capsulo.cms.core.draft;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.capsulo.cms.core.cache.IdentityCache;
import com.capsulo.cms.core.git.GitProvider;
import com.capsulo.cms.model.git.CommitDetail;
import com.capsulo.cms.model.git.CommitSummary;
import com.capsulo.cms.model.git.FileChange;
import com.capsulo.cms.util.ApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The storage engine as seen by one caller: a repository and a credential, backed by caches that
 * are shared with every other {@code DraftStore} opened from the same {@link DraftStores}.
 */
public final class DraftStore {

    private final GitProvider git;
    private final String token;
    private final ObjectMapper om;
    private final IdentityCache identities;
    private final BranchCoordinator branches;
    private final CommitEngine commits;

    DraftStore(GitProvider git, String token, ObjectMapper om, IdentityCache identities,
               BranchCoordinator branches, CommitEngine commits) {
        this.git = Objects.requireNonNull(git, "git");
        this.token = Objects.requireNonNull(token, "token");
        this.om = Objects.requireNonNull(om, "om");
        this.identities = Objects.requireNonNull(identities, "identities");
        this.branches = Objects.requireNonNull(branches, "branches");
        this.commits = Objects.requireNonNull(commits, "commits");
    }

    public String getAuthenticatedIdentity() {
        return identities.get(token, git::getAuthenticatedUser);
    }

    /** Read on every call; the default branch of a repository can be renamed. */
    public String getDefaultBranch() {
        return git.getDefaultBranch();
    }

    public boolean branchExists(String branch) {
        return branches.branchExists(branch);
    }

    public String ensureBranch(String branch) {
        return branches.ensureBranch(branch);
    }

    /** {@code null} clears every cached branch of this store's repository. */
    public void clearBranchCache(String branch) {
        branches.forget(branch);
    }

    public String commitSingleFile(String path, String content, String message, String branch) {
        return commitSingleFile(path, content, message, branch, true);
    }

    public String commitSingleFile(String path, String content, String message, String branch, boolean ensureBranchFirst) {
        return commits.commitSingleFile(path, content, message, branch, ensureBranchFirst);
    }

    public String commitMultipleFiles(List<FileChange> files, String message, String branch) {
        return commitMultipleFiles(files, message, branch, true);
    }

    public String commitMultipleFiles(List<FileChange> files, String message, String branch, boolean ensureBranchFirst) {
        return commits.commitMultipleFiles(files, message, branch, ensureBranchFirst);
    }

    /**
     * Merge conflicts come back as the remote's 409, untouched.
     */
    public Optional<String> mergeBranch(String from, String into) {
        return git.merge(from, into, "Publish changes from " + from);
    }

    public void deleteBranch(String branch) {
        git.deleteBranch(branch);
        branches.forget(branch);
    }

    public Optional<String> getFileText(String path, String ref) {
        return git.getFileText(path, ref);
    }

    /** The file parsed as JSON; empty when the file is absent or blank. */
    public Optional<JsonNode> getFileContent(String path, String ref) {
        Optional<String> text = git.getFileText(path, ref);
        if (text.isEmpty() || text.get().isBlank()) return Optional.empty();
        try {
            return Optional.of(om.readTree(text.get()));
        } catch (JsonProcessingException e) {
            throw new ApiException(502, "file " + path + " at " + ref + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public List<CommitSummary> listCommits(String branch, int page, int perPage) {
        return git.listCommits(branch, page, perPage);
    }

    public CommitDetail getCommitDetail(String sha) {
        return git.getCommit(sha);
    }

    public String repository() {
        return git.name();
    }
}
