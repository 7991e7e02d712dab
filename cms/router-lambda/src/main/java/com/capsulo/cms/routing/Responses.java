package com.capsulo.cms.routing;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class Responses {
    private static final Logger log = LoggerFactory.getLogger(Responses.class);

    private static final String SERIALIZE_ERROR =
            "{\"error\":{\"code\":\"SERIALIZE_ERROR\",\"message\":\"failed to serialize response\",\"details\":[]}}";

    private Responses() {}

    public static APIGatewayV2HTTPResponse json(ObjectMapper om, int status, Object body) {
        return json(om, status, body, Map.of());
    }

    /** {@code extraHeaders} are added to the response; content-type is always JSON. */
    public static APIGatewayV2HTTPResponse json(ObjectMapper om, int status, Object body, Map<String, String> extraHeaders) {
        Map<String, String> headers = new HashMap<>(extraHeaders);
        headers.put("content-type", "application/json");

        String s;
        try {
            s = om.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.error("could not serialize {} response body", body == null ? "null" : body.getClass().getSimpleName(), e);
            status = 500;
            s = SERIALIZE_ERROR;
            headers = Map.of("content-type", "application/json");
        }
        return APIGatewayV2HTTPResponse.builder()
                .withStatusCode(status)
                .withHeaders(headers)
                .withBody(s)
                .build();
    }

    public static APIGatewayV2HTTPResponse error(ObjectMapper om, int status, ApiError err) {
        return error(om, status, err, Map.of());
    }

    public static APIGatewayV2HTTPResponse error(ObjectMapper om, int status, ApiError err, Map<String, String> extraHeaders) {
        return json(om, status, Map.of("error", err), extraHeaders);
    }
}
