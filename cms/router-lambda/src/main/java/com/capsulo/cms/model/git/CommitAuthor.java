package com.capsulo.cms.model.git;

public record CommitAuthor(String name, String login, String avatarUrl) {}
