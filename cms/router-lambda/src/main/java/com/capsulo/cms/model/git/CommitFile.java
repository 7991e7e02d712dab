package com.capsulo.cms.model.git;

public record CommitFile(
        String filename,
        String status,
        int additions,
        int deletions,
        String patch      // null for binary files or very large diffs
) {}
