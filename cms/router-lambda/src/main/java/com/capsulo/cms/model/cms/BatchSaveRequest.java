package com.capsulo.cms.model.cms;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

public record BatchSaveRequest(
        List<PageChange> pages,
        JsonNode globals,          // optional
        String commitMessage
) {}
