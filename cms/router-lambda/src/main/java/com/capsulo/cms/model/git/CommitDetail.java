package com.capsulo.cms.model.git;

import java.util.List;

public record CommitDetail(
        String sha,
        String message,
        CommitAuthor author,
        String date,
        String parentSha,  // null for a root commit
        List<CommitFile> files
) {}
