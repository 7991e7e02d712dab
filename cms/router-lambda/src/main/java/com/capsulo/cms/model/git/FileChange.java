package com.capsulo.cms.model.git;

public record FileChange(String path, String content) {}
