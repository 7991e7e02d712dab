package com.capsulo.cms.model.cms;

import com.fasterxml.jackson.databind.JsonNode;

public record SaveGlobalsRequest(JsonNode data, String commitMessage) {}
