package com.capsulo.cms.model.cms;

import com.fasterxml.jackson.databind.JsonNode;

public record SavePageRequest(String pageName, JsonNode data, String commitMessage) {}
