package com.capsulo.cms.model.cms;

public record CommitShaResponse(String sha, String branch, String timestamp) {}
