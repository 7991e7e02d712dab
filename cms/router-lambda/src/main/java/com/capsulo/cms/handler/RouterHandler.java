package com.capsulo.cms.handler;

import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import com.capsulo.cms.app.App;
import com.capsulo.cms.routing.ApiError;
import com.capsulo.cms.routing.CmsRequest;
import com.capsulo.cms.routing.Responses;
import com.capsulo.cms.routing.WithHeaders;
import com.capsulo.cms.util.ApiException;
import com.capsulo.cms.util.BearerAuth;
import com.fasterxml.jackson.core.JsonProcessingException;

public class RouterHandler implements RequestHandler<APIGatewayV2HTTPEvent, APIGatewayV2HTTPResponse> {
    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private final App app;

    public RouterHandler() {
        this(null);
    }

    // tests pass their own App; Lambda uses the process-wide one
    public RouterHandler(App app) {
        this.app = app;
    }

    @Override
    public APIGatewayV2HTTPResponse handleRequest(APIGatewayV2HTTPEvent event, Context context) {
        var app = this.app != null ? this.app : App.get();
        try {
            var route = app.router.match(event);
            if (route == null) {
                Set<String> allowed = app.router.allowed(event);
                if (!allowed.isEmpty()) {
                    return Responses.error(app.om, 405,
                            ApiError.of("METHOD_NOT_ALLOWED", "use " + String.join(", ", allowed) + " for " + event.getRawPath()),
                            Map.of("allow", String.join(", ", allowed)));
                }
                return Responses.error(app.om, 404, ApiError.of("NOT_FOUND", "no route for this method/path"));
            }

            // Bearer token from the editor wins; GITHUB_TOKEN is the server-side fallback.
            String token = BearerAuth.token(event.getHeaders());
            if (token == null && !app.config.githubToken().isBlank()) token = app.config.githubToken();

            Object out = route.handle(new CmsRequest(event, context, token, app.om));
            if (out instanceof WithHeaders wh) return Responses.json(app.om, 200, wh.body(), wh.headers());
            return Responses.json(app.om, 200, out);

        } catch (ApiException e) {
            // preserve intended status codes like 400, 401, 404, 409
            int code = e.status();
            String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "error" : e.getMessage();
            if (code >= 500) log.warn("{} {} failed: {}", method(event), event.getRawPath(), msg);
            return Responses.error(app.om, code, ApiError.of(ApiError.codeFor(code), msg));

        } catch (JsonProcessingException e) {
            return Responses.error(app.om, 400, ApiError.of("BAD_REQUEST", "Invalid JSON in request body"));

        } catch (IllegalArgumentException e) {
            return Responses.error(app.om, 400, ApiError.of("BAD_REQUEST", e.getMessage()));

        } catch (Exception e) {
            log.error("{} {} failed unexpectedly", method(event), event.getRawPath(), e);
            return Responses.error(app.om, 500, ApiError.of("INTERNAL_ERROR", "unexpected error"));
        }
    }

    private static String method(APIGatewayV2HTTPEvent event) {
        return event.getRequestContext() != null && event.getRequestContext().getHttp() != null
                ? event.getRequestContext().getHttp().getMethod()
                : "?";
    }
}
