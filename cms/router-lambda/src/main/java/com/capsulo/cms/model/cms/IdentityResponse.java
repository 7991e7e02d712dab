package com.capsulo.cms.model.cms;

public record IdentityResponse(String login) {}
