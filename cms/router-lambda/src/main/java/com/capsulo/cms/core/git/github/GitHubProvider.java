package com.capsulo.cms.core.git.github;

import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.capsulo.cms.core.codec.ContentCodec;
import com.capsulo.cms.core.git.GitProvider;
import com.capsulo.cms.model.git.CommitAuthor;
import com.capsulo.cms.model.git.CommitDetail;
import com.capsulo.cms.model.git.CommitFile;
import com.capsulo.cms.model.git.CommitSummary;
import com.capsulo.cms.model.git.TreeEntry;
import com.capsulo.cms.util.ApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class GitHubProvider implements GitProvider {
    private static final Logger log = LoggerFactory.getLogger(GitHubProvider.class);

    private final String owner;
    private final String repo;
    private final ObjectMapper om;
    private final GitHubHttp gh;

    public GitHubProvider(HttpClient http, String token, String owner, String repo, ObjectMapper om) {
        this(http, token, "https://api.github.com", Duration.ofSeconds(15), owner, repo, om);
    }

    public GitHubProvider(HttpClient http, String token, String apiUrl, Duration timeout,
                          String owner, String repo, ObjectMapper om) {
        this(new GitHubHttp(Objects.requireNonNull(http, "http"), Objects.requireNonNull(token, "token"), apiUrl, timeout),
                owner, repo, om);
    }

    GitHubProvider(GitHubHttp gh, String owner, String repo, ObjectMapper om) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.repo = Objects.requireNonNull(repo, "repo");
        this.om = Objects.requireNonNull(om, "om");
        this.gh = Objects.requireNonNull(gh, "gh");
    }

    @Override
    public String name() {
        return "github:" + owner + "/" + repo;
    }

    @Override
    public String getAuthenticatedUser() {
        JsonNode user = read(gh.getJson("/user"), "user");
        String login = user.path("login").asText("");
        if (login.isBlank()) throw new ApiException(502, "GitHub user response has no login");
        return login;
    }

    @Override
    public String getDefaultBranch() {
        JsonNode meta = read(gh.getJson(repoPath("")), "repository");
        String branch = meta.path("default_branch").asText("");
        if (branch.isBlank()) throw new ApiException(502, "repository " + name() + " reports no default branch");
        return branch;
    }

    @Override
    public Optional<String> getBranchHeadSha(String branch) {
        requireText(branch, "branch");
        try {
            JsonNode node = read(gh.getJson(repoPath("/git/ref/heads/" + encodePath(branch))), "ref");
            String sha = node.path("object").path("sha").asText("");
            if (sha.isBlank()) throw new ApiException(502, "could not read branch sha for " + branch);
            return Optional.of(sha);
        } catch (GitHubApiException e) {
            if (e.isNotFound()) return Optional.empty();
            throw e;
        }
    }

    @Override
    public void createBranch(String newBranch, String fromSha) {
        requireText(newBranch, "newBranch");
        requireText(fromSha, "fromSha");

        ObjectNode body = om.createObjectNode()
                .put("ref", "refs/heads/" + newBranch)
                .put("sha", fromSha);
        try {
            gh.postJson(repoPath("/git/refs"), write(body));
            log.info("created branch {} at {} in {}", newBranch, fromSha, name());
        } catch (GitHubApiException e) {
            if (isAlreadyExists(e)) {
                log.info("branch {} already exists in {}, treating create as done", newBranch, name());
                return;
            }
            throw e;
        }
    }

    @Override
    public Optional<String> getFileSha(String path, String ref) {
        return readContents(path, ref).map(node -> node.path("sha").asText(""))
                .filter(sha -> !sha.isBlank());
    }

    @Override
    public Optional<String> getFileText(String path, String ref) {
        Optional<JsonNode> node = readContents(path, ref);
        if (node.isEmpty()) return Optional.empty();

        String contentB64 = node.get().path("content").asText(null);
        if (contentB64 == null) return Optional.empty();
        try {
            return Optional.of(ContentCodec.decode(contentB64));
        } catch (IllegalArgumentException e) {
            throw new ApiException(502, "GitHub returned malformed base64 for " + path, e);
        }
    }

    @Override
    public String putFile(String path, String contentBase64, String message, String branch, String sha) {
        requireText(path, "path");
        requireText(branch, "branch");
        if (message == null || message.isBlank()) message = "update " + path;

        ObjectNode body = om.createObjectNode()
                .put("message", message)
                .put("content", contentBase64)
                .put("branch", branch);
        if (sha != null && !sha.isBlank()) body.put("sha", sha);

        JsonNode out = read(gh.putJson(repoPath("/contents/" + encodePath(path)), write(body)), "contents");
        return out.path("commit").path("sha").asText("");
    }

    @Override
    public String getCommitTreeSha(String commitSha) {
        requireText(commitSha, "commitSha");
        JsonNode commit = read(gh.getJson(repoPath("/git/commits/" + commitSha)), "git commit");
        return requiredSha(commit.path("tree"), "tree of commit " + commitSha);
    }

    @Override
    public String createBlob(String contentUtf8) {
        ObjectNode body = om.createObjectNode()
                .put("content", ContentCodec.encode(contentUtf8))
                .put("encoding", "base64");
        return requiredSha(read(gh.postJson(repoPath("/git/blobs"), write(body)), "blob"), "new blob");
    }

    @Override
    public String createTree(String baseTreeSha, List<TreeEntry> entries) {
        requireText(baseTreeSha, "baseTreeSha");
        ObjectNode body = om.createObjectNode().put("base_tree", baseTreeSha);
        ArrayNode tree = body.putArray("tree");
        for (TreeEntry e : entries) {
            tree.addObject()
                    .put("path", e.path())
                    .put("mode", TreeEntry.MODE_REGULAR_FILE)
                    .put("type", "blob")
                    .put("sha", e.blobSha());
        }
        return requiredSha(read(gh.postJson(repoPath("/git/trees"), write(body)), "tree"), "new tree");
    }

    @Override
    public String createCommit(String message, String treeSha, String parentSha) {
        requireText(treeSha, "treeSha");
        requireText(parentSha, "parentSha");
        ObjectNode body = om.createObjectNode()
                .put("message", message == null ? "" : message)
                .put("tree", treeSha);
        body.putArray("parents").add(parentSha);
        return requiredSha(read(gh.postJson(repoPath("/git/commits"), write(body)), "commit"), "new commit");
    }

    @Override
    public void updateRef(String branch, String commitSha) {
        requireText(branch, "branch");
        requireText(commitSha, "commitSha");
        ObjectNode body = om.createObjectNode()
                .put("sha", commitSha)
                .put("force", false);
        gh.patchJson(repoPath("/git/refs/heads/" + encodePath(branch)), write(body));
    }

    @Override
    public Optional<String> merge(String head, String base, String commitMessage) {
        requireText(head, "head");
        requireText(base, "base");
        ObjectNode body = om.createObjectNode()
                .put("base", base)
                .put("head", head)
                .put("commit_message", commitMessage == null ? "Merge " + head + " into " + base : commitMessage);

        String json = gh.postJson(repoPath("/merges"), write(body));
        // 204 No Content: base already contains head
        if (json.isBlank()) return Optional.empty();
        return Optional.of(read(json, "merge").path("sha").asText("")).filter(s -> !s.isBlank());
    }

    @Override
    public void deleteBranch(String branch) {
        requireText(branch, "branch");
        gh.delete(repoPath("/git/refs/heads/" + encodePath(branch)));
        log.info("deleted branch {} in {}", branch, name());
    }

    @Override
    public List<CommitSummary> listCommits(String branch, int page, int perPage) {
        requireText(branch, "branch");
        String url = repoPath("/commits?sha=%s&page=%d&per_page=%d".formatted(
                URLEncoder.encode(branch, StandardCharsets.UTF_8), Math.max(1, page), Math.max(1, perPage)));

        JsonNode arr;
        try {
            arr = read(gh.getJson(url), "commit list");
        } catch (GitHubApiException e) {
            if (e.isNotFound()) return List.of();
            throw e;
        }
        if (!arr.isArray()) throw new ApiException(502, "GitHub commit list did not return an array");

        List<CommitSummary> out = new ArrayList<>();
        for (JsonNode c : arr) {
            String sha = c.path("sha").asText("");
            JsonNode commit = c.path("commit");
            out.add(new CommitSummary(
                    sha,
                    sha.length() > 7 ? sha.substring(0, 7) : sha,
                    commit.path("message").asText(""),
                    commit.path("author").path("name").asText(""),
                    c.path("author").path("login").asText(""),
                    c.path("author").path("avatar_url").asText(""),
                    commit.path("author").path("date").asText("")
            ));
        }
        return out;
    }

    @Override
    public CommitDetail getCommit(String sha) {
        requireText(sha, "sha");
        JsonNode c = read(gh.getJson(repoPath("/commits/" + sha)), "commit detail");
        JsonNode commit = c.path("commit");

        JsonNode parents = c.path("parents");
        String parentSha = parents.isArray() && parents.size() > 0
                ? parents.get(0).path("sha").asText(null)
                : null;

        List<CommitFile> files = new ArrayList<>();
        for (JsonNode f : c.path("files")) {
            files.add(new CommitFile(
                    f.path("filename").asText(""),
                    f.path("status").asText(""),
                    f.path("additions").asInt(0),
                    f.path("deletions").asInt(0),
                    f.path("patch").asText(null)
            ));
        }

        return new CommitDetail(
                c.path("sha").asText(sha),
                commit.path("message").asText(""),
                new CommitAuthor(
                        commit.path("author").path("name").asText(""),
                        c.path("author").path("login").asText(""),
                        c.path("author").path("avatar_url").asText("")),
                commit.path("author").path("date").asText(""),
                parentSha,
                files
        );
    }

    private Optional<JsonNode> readContents(String path, String ref) {
        requireText(path, "path");
        requireText(ref, "ref");
        String url = repoPath("/contents/%s?ref=%s".formatted(
                encodePath(path), URLEncoder.encode(ref, StandardCharsets.UTF_8)));
        try {
            return Optional.of(read(gh.getJson(url), "contents"));
        } catch (GitHubApiException e) {
            // 404 => path (or ref) doesn't exist
            if (e.isNotFound()) return Optional.empty();
            throw e;
        }
    }

    private static boolean isAlreadyExists(GitHubApiException e) {
        if (e.isConflict()) return true;
        return e.isUnprocessable() && e.bodyMentions("already exists");
    }

    private String repoPath(String suffix) {
        return "/repos/%s/%s%s".formatted(owner, repo, suffix);
    }

    private JsonNode read(String json, String what) {
        try {
            return om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ApiException(502, "Failed to parse GitHub " + what + " response: " + e.getOriginalMessage(), e);
        }
    }

    private String write(ObjectNode body) {
        try {
            return om.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ApiException(500, "Failed to serialize GitHub request: " + e.getOriginalMessage(), e);
        }
    }

    private static String requiredSha(JsonNode node, String what) {
        String sha = node.path("sha").asText("");
        if (sha.isBlank()) throw new ApiException(502, "GitHub response has no sha for " + what);
        return sha;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException(field + " is required");
    }

    private static String encodePath(String path) {
        String[] parts = path.split("/");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append("/");
            sb.append(URLEncoder.encode(parts[i], StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return sb.toString();
    }
}
