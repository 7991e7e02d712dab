package com.capsulo.cms.routing;

import java.util.Map;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.capsulo.cms.util.ApiException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * One routed call: the raw event plus the GitHub token it is acting with.
 */
public record CmsRequest(APIGatewayV2HTTPEvent event, Context ctx, String token, ObjectMapper om) {

    public <T> T body(Class<T> cls) throws Exception {
        String body = event.getBody();
        if (body == null || body.isBlank()) throw new ApiException(400, "Request body is empty");
        return om.readValue(body, cls);
    }

    public String query(String name) {
        Map<String, String> q = event.getQueryStringParameters();
        if (q == null) return null;
        String v = q.get(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    public int queryInt(String name, int def) {
        String v = query(name);
        if (v == null) return def;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new ApiException(400, name + " must be a number");
        }
    }

    public String requireToken() {
        if (token == null || token.isBlank()) throw new ApiException(401, "Not authenticated: GitHub token not provided");
        return token;
    }
}
