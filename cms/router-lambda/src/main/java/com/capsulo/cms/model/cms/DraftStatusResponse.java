package com.capsulo.cms.model.cms;

public record DraftStatusResponse(boolean exists, String branch) {}
