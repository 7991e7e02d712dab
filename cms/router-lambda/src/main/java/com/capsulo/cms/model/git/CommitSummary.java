package com.capsulo.cms.model.git;

public record CommitSummary(
        String sha,
        String shortSha,
        String message,
        String authorName,
        String authorLogin,
        String avatarUrl,
        String date
) {}
