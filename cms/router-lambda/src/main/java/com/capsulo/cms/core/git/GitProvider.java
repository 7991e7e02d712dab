package com.capsulo.cms.core.git;

import java.util.List;
import java.util.Optional;

import com.capsulo.cms.model.git.CommitDetail;
import com.capsulo.cms.model.git.CommitSummary;
import com.capsulo.cms.model.git.TreeEntry;

/**
 * One remote call per method. No caching and no retries happen at this level; see
 * {@code DraftStore} for the coordinated operations built on top.
 */
public interface GitProvider {

    String getAuthenticatedUser();

    String getDefaultBranch();

    /** Empty when the branch does not exist. */
    Optional<String> getBranchHeadSha(String branch);

    /** Empty when the path does not exist on {@code ref} (a branch name or a commit sha). */
    Optional<String> getFileSha(String path, String ref);

    Optional<String> getFileText(String path, String ref);

    List<CommitSummary> listCommits(String branch, int page, int perPage);

    CommitDetail getCommit(String sha);

    /** Identifies the repository, e.g. {@code github:owner/repo}. Scopes shared caches. */
    String name();

    // -------- writes --------

    /** Succeeds quietly when the ref already exists. */
    void createBranch(String newBranch, String fromSha);

    /**
     * Creates or overwrites one file with the contents API. {@code sha} is null when the file is new.
     * Returns the sha of the resulting commit.
     */
    String putFile(String path, String contentBase64, String message, String branch, String sha);

    String getCommitTreeSha(String commitSha);

    String createBlob(String contentUtf8);

    String createTree(String baseTreeSha, List<TreeEntry> entries);

    String createCommit(String message, String treeSha, String parentSha);

    /** Fast-forward only; a moved branch is rejected by the remote. */
    void updateRef(String branch, String commitSha);

    /** Returns the merge commit sha, or empty when {@code base} already contains {@code head}. */
    Optional<String> merge(String head, String base, String commitMessage);

    void deleteBranch(String branch);
}
