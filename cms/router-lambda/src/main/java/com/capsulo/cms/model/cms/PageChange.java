package com.capsulo.cms.model.cms;

import com.fasterxml.jackson.databind.JsonNode;

public record PageChange(String pageName, JsonNode data) {}
