package com.capsulo.cms.model.cms;

import com.fasterxml.jackson.databind.JsonNode;

public record LoadResponse(
        JsonNode data,       // null when the file or the draft branch is absent
        String branch,
        String page,
        String message
) {}
