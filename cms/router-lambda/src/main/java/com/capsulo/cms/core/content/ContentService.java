package com.capsulo.cms.core.content;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.capsulo.cms.core.draft.DraftStore;
import com.capsulo.cms.model.cms.CommitShaResponse;
import com.capsulo.cms.model.cms.DraftStatusResponse;
import com.capsulo.cms.model.cms.LoadResponse;
import com.capsulo.cms.model.cms.PageChange;
import com.capsulo.cms.model.cms.PublishResponse;
import com.capsulo.cms.model.cms.SaveResponse;
import com.capsulo.cms.model.git.CommitDetail;
import com.capsulo.cms.model.git.CommitSummary;
import com.capsulo.cms.model.git.FileChange;
import com.capsulo.cms.util.ApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Page and global-variable documents on top of the draft store. Every editor writes to the same
 * draft branch; publishing merges it into the default branch and removes it.
 */
public final class ContentService {
    private static final Logger log = LoggerFactory.getLogger(ContentService.class);

    private final DraftStore store;
    private final ObjectMapper om;
    private final String draftBranch;
    private final Clock clock;

    public ContentService(DraftStore store, ObjectMapper om, String draftBranch, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.om = Objects.requireNonNull(om, "om");
        this.draftBranch = (draftBranch == null || draftBranch.isBlank()) ? "cms-draft" : draftBranch.trim();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String draftBranch() {
        return draftBranch;
    }

    public SaveResponse savePage(String pageName, JsonNode data, String commitMessage) {
        String path = ContentPaths.pagePath(pageName);
        requireData(data);
        String message = orDefault(commitMessage, "Update " + pageName + " via CMS");

        String sha = store.commitSingleFile(path, serialize(data), message, draftBranch);
        return new SaveResponse(true, draftBranch, 1, sha);
    }

    public SaveResponse saveGlobals(JsonNode data, String commitMessage) {
        requireData(data);
        String message = orDefault(commitMessage, "Update global variables via CMS");

        String sha = store.commitSingleFile(ContentPaths.GLOBALS_PATH, serialize(data), message, draftBranch);
        return new SaveResponse(true, draftBranch, 1, sha);
    }

    /**
     * All pages plus the globals file in one commit on the draft branch.
     */
    public SaveResponse batchCommit(List<PageChange> pages, JsonNode globals, String commitMessage) {
        if (pages == null) throw new ApiException(400, "Missing or invalid pages array");
        if (commitMessage == null || commitMessage.isBlank()) throw new ApiException(400, "Missing commitMessage");

        List<FileChange> files = new ArrayList<>();
        for (PageChange p : pages) {
            if (p == null) continue;
            requireData(p.data());
            files.add(new FileChange(ContentPaths.pagePath(p.pageName()), serialize(p.data())));
        }
        if (globals != null && !globals.isNull()) {
            files.add(new FileChange(ContentPaths.GLOBALS_PATH, serialize(globals)));
        }

        if (files.isEmpty()) return new SaveResponse(false, draftBranch, 0, null);

        log.info("batch commit of {} files to {}", files.size(), draftBranch);
        String sha = store.commitMultipleFiles(files, commitMessage, draftBranch);
        return new SaveResponse(true, draftBranch, files.size(), sha);
    }

    public PublishResponse publish() {
        if (!store.branchExists(draftBranch)) throw new ApiException(409, "No draft branch to publish");

        String mainBranch = store.getDefaultBranch();
        Optional<String> merge = store.mergeBranch(draftBranch, mainBranch);
        store.deleteBranch(draftBranch);

        log.info("published {} into {} ({})", draftBranch, mainBranch, merge.orElse("already up to date"));
        return new PublishResponse(draftBranch, mainBranch, merge.orElse(null));
    }

    public DraftStatusResponse draftStatus() {
        return new DraftStatusResponse(store.branchExists(draftBranch), draftBranch);
    }

    public Optional<String> currentDraftBranch() {
        return store.branchExists(draftBranch) ? Optional.of(draftBranch) : Optional.empty();
    }

    public LoadResponse loadPage(String pageName, ContentSource source) {
        return load(ContentPaths.pagePath(pageName), pageName, source);
    }

    public LoadResponse loadGlobals(ContentSource source) {
        return load(ContentPaths.GLOBALS_PATH, "globals", source);
    }

    public CommitShaResponse latestCommitSha() {
        String mainBranch = store.getDefaultBranch();
        List<CommitSummary> commits = store.listCommits(mainBranch, 1, 1);
        if (commits.isEmpty()) throw new ApiException(404, "No commits found on " + mainBranch + " branch");
        return new CommitShaResponse(commits.get(0).sha(), mainBranch, clock.instant().toString());
    }

    public List<CommitSummary> history(int page, int perPage) {
        return store.listCommits(draftBranch, page, perPage);
    }

    public CommitDetail commitDetail(String sha) {
        if (sha == null || sha.isBlank()) throw new ApiException(400, "sha is required");
        return store.getCommitDetail(sha.trim());
    }

    private LoadResponse load(String path, String page, ContentSource source) {
        String branch;
        if (source == ContentSource.DRAFT) {
            if (!store.branchExists(draftBranch)) {
                return new LoadResponse(null, draftBranch, page, "Draft branch does not exist yet");
            }
            branch = draftBranch;
        } else {
            branch = store.getDefaultBranch();
        }
        JsonNode data = store.getFileContent(path, branch).orElse(null);
        return new LoadResponse(data, branch, page, null);
    }

    private String serialize(JsonNode data) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(data) + "\n";
        } catch (JsonProcessingException e) {
            throw new ApiException(400, "content is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static void requireData(JsonNode data) {
        if (data == null || data.isNull()) throw new ApiException(400, "data is required");
    }

    private static String orDefault(String s, String def) {
        return (s == null || s.isBlank()) ? def : s;
    }
}
