package com.capsulo.cms.model.cms;

public record PublishResponse(String draftBranch, String mergedInto, String mergeSha) {}
