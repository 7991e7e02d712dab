package com.capsulo.cms.core.draft;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.capsulo.cms.core.codec.ContentCodec;
import com.capsulo.cms.core.git.GitProvider;
import com.capsulo.cms.core.git.github.GitHubApiException;
import com.capsulo.cms.model.git.CommitAuthor;
import com.capsulo.cms.model.git.CommitDetail;
import com.capsulo.cms.model.git.CommitSummary;
import com.capsulo.cms.model.git.TreeEntry;

/**
 * In-memory repository that records every call made against it, in order.
 */
public final class FakeGit implements GitProvider {

    public String defaultBranch = "main";
    public String login = "octocat";
    public String repository = "capsulo/site";

    final Map<String, String> branches = new HashMap<>();      // name -> head sha
    final Map<String, String> files = new HashMap<>();         // branch:path -> content
    final Map<String, String> fileShas = new HashMap<>();      // branch:path -> blob sha
    final Map<String, String> blobs = new HashMap<>();         // blob sha -> content
    final Map<String, List<TreeEntry>> trees = new HashMap<>();
    final Map<String, String[]> commits = new HashMap<>();     // sha -> {message, tree, parent}

    public final List<String> calls = new ArrayList<>();
    public final List<String> sentShas = new ArrayList<>();    // sha argument of every putFile

    // scripted failures, consumed front to back
    public final Deque<GitHubApiException> putFailures = new ArrayDeque<>();
    public final Deque<GitHubApiException> updateRefFailures = new ArrayDeque<>();
    public RuntimeException createBranchFailure;
    public CountDownLatch createBranchGate;
    public Runnable beforeUpdateRefFailure;
    public Runnable beforePutFailure;

    public final AtomicInteger createBranchCalls = new AtomicInteger();
    private final AtomicInteger seq = new AtomicInteger();

    public FakeGit inRepository(String ownerAndRepo) {
        repository = ownerAndRepo;
        return this;
    }

    public FakeGit withBranch(String name, String sha) {
        branches.put(name, sha);
        commits.putIfAbsent(sha, new String[]{"initial", "tree-" + sha, null});
        return this;
    }

    public FakeGit withFile(String branch, String path, String content) {
        files.put(branch + ":" + path, content);
        fileShas.put(branch + ":" + path, nextSha("blob"));
        return this;
    }

    public synchronized String file(String branch, String path) {
        return files.get(branch + ":" + path);
    }

    public synchronized String headOf(String branch) {
        return branches.get(branch);
    }

    public synchronized long count(String op) {
        return calls.stream().filter(op::equals).count();
    }

    public synchronized void reset() {
        calls.clear();
        sentShas.clear();
    }

    @Override
    public String name() {
        return "fake:" + repository;
    }

    @Override
    public synchronized String getAuthenticatedUser() {
        calls.add("getAuthenticatedUser");
        return login;
    }

    @Override
    public synchronized String getDefaultBranch() {
        calls.add("getDefaultBranch");
        return defaultBranch;
    }

    @Override
    public synchronized Optional<String> getBranchHeadSha(String branch) {
        calls.add("getBranchHeadSha");
        return Optional.ofNullable(branches.get(branch));
    }

    @Override
    public synchronized Optional<String> getFileSha(String path, String ref) {
        calls.add("getFileSha");
        return Optional.ofNullable(fileShas.get(ref + ":" + path));
    }

    @Override
    public synchronized Optional<String> getFileText(String path, String ref) {
        calls.add("getFileText");
        return Optional.ofNullable(files.get(ref + ":" + path));
    }

    @Override
    public synchronized List<CommitSummary> listCommits(String branch, int page, int perPage) {
        calls.add("listCommits");
        String sha = branches.get(branch);
        if (sha == null) return List.of();
        String[] c = commits.get(sha);
        return List.of(new CommitSummary(sha, sha.substring(0, Math.min(7, sha.length())),
                c == null ? "" : c[0], "The Octocat", login, "", "2026-01-01T00:00:00Z"));
    }

    @Override
    public synchronized CommitDetail getCommit(String sha) {
        calls.add("getCommit");
        String[] c = commits.get(sha);
        if (c == null) throw new GitHubApiException(404, "GET", "/commits/" + sha, "{\"message\":\"Not Found\"}");
        return new CommitDetail(sha, c[0], new CommitAuthor("The Octocat", login, ""), "2026-01-01T00:00:00Z", c[2], List.of());
    }

    @Override
    public void createBranch(String newBranch, String fromSha) {
        synchronized (this) {
            calls.add("createBranch");
        }
        createBranchCalls.incrementAndGet();
        if (createBranchGate != null) {
            try {
                if (!createBranchGate.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("gate never opened");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        if (createBranchFailure != null) throw createBranchFailure;
        synchronized (this) {
            branches.putIfAbsent(newBranch, fromSha);
        }
    }

    @Override
    public synchronized String putFile(String path, String contentBase64, String message, String branch, String sha) {
        calls.add("putFile");
        sentShas.add(sha);
        if (!putFailures.isEmpty()) {
            if (beforePutFailure != null) beforePutFailure.run();
            throw putFailures.poll();
        }
        String key = branch + ":" + path;
        String current = fileShas.get(key);
        if (current != null && !current.equals(sha)) {
            throw new GitHubApiException(409, "PUT", "/contents/" + path, "{\"message\":\"does not match\"}");
        }
        files.put(key, ContentCodec.decode(contentBase64));
        fileShas.put(key, nextSha("blob"));
        String commit = nextSha("commit");
        commits.put(commit, new String[]{message, nextSha("tree"), branches.get(branch)});
        branches.put(branch, commit);
        return commit;
    }

    @Override
    public synchronized String getCommitTreeSha(String commitSha) {
        calls.add("getCommitTreeSha");
        String[] c = commits.get(commitSha);
        return c == null ? "tree-" + commitSha : c[1];
    }

    @Override
    public synchronized String createBlob(String contentUtf8) {
        calls.add("createBlob");
        String sha = nextSha("blob");
        blobs.put(sha, contentUtf8);
        return sha;
    }

    @Override
    public synchronized String createTree(String baseTreeSha, List<TreeEntry> entries) {
        calls.add("createTree");
        String sha = nextSha("tree");
        trees.put(sha, List.copyOf(entries));
        return sha;
    }

    @Override
    public synchronized String createCommit(String message, String treeSha, String parentSha) {
        calls.add("createCommit");
        String sha = nextSha("commit");
        commits.put(sha, new String[]{message, treeSha, parentSha});
        return sha;
    }

    @Override
    public synchronized void updateRef(String branch, String commitSha) {
        calls.add("updateRef");
        if (!updateRefFailures.isEmpty()) {
            if (beforeUpdateRefFailure != null) beforeUpdateRefFailure.run();
            throw updateRefFailures.poll();
        }
        String[] c = commits.get(commitSha);
        if (c == null || !Objects.equals(c[2], branches.get(branch))) {
            throw new GitHubApiException(422, "PATCH", "/git/refs/heads/" + branch, "{\"message\":\"Update is not a fast forward\"}");
        }
        for (TreeEntry e : trees.getOrDefault(c[1], List.of())) {
            files.put(branch + ":" + e.path(), blobs.get(e.blobSha()));
            fileShas.put(branch + ":" + e.path(), e.blobSha());
        }
        branches.put(branch, commitSha);
    }

    @Override
    public synchronized Optional<String> merge(String head, String base, String commitMessage) {
        calls.add("merge");
        String sha = nextSha("merge");
        commits.put(sha, new String[]{commitMessage, "tree-" + sha, branches.get(base)});
        branches.put(base, sha);
        return Optional.of(sha);
    }

    @Override
    public synchronized void deleteBranch(String branch) {
        calls.add("deleteBranch");
        branches.remove(branch);
    }

    synchronized String nextSha(String kind) {
        return kind + "-" + String.format("%04d", seq.incrementAndGet()) + "00000000";
    }

    static GitHubApiException conflict() {
        return new GitHubApiException(409, "PUT", "/contents/x", "{\"message\":\"is at abc but expected def\"}");
    }
}
