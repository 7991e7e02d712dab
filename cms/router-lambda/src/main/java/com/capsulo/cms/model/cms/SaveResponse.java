package com.capsulo.cms.model.cms;

public record SaveResponse(boolean githubSynced, String draftBranch, int files, String commitSha) {}
