package com.enrichreview.engine.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayV2HTTPResponse;
import com.enrichreview.engine.app.App;
import com.enrichreview.engine.core.pipeline.UpstreamFetchException;
import com.enrichreview.engine.core.session.ExportNotReadyException;
import com.enrichreview.engine.routing.ApiError;
import com.enrichreview.engine.routing.Responses;
import com.enrichreview.engine.util.ApiException;
import com.enrichreview.engine.util.InternalAuth;
import com.fasterxml.jackson.core.JsonProcessingException;

public class RouterHandler implements RequestHandler<APIGatewayV2HTTPEvent, APIGatewayV2HTTPResponse> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    @Override
    public APIGatewayV2HTTPResponse handleRequest(APIGatewayV2HTTPEvent event, Context context) {
        var app = App.get();
        String path = event.getRawPath();
        try {
            // Auth gate: healthz is public; everything else requires X-Internal-Token once a token is configured
            if (!"/healthz".equals(path)) {
                String expected = app.config.internalToken();
                if (expected != null && !expected.isBlank()
                        && !InternalAuth.isAuthorized(event.getHeaders(), InternalAuth.HEADER, expected)) {
                    return Responses.error(app.om, 401, ApiError.of("UNAUTHORIZED", "missing/invalid X-Internal-Token"));
                }
            }

            var route = app.router.match(event);
            if (route == null) {
                if (path != null && app.router.hasPath(path)) {
                    return Responses.error(app.om, 405, ApiError.of("METHOD_NOT_ALLOWED", "method not allowed for " + path));
                }
                return Responses.error(app.om, 404, ApiError.of("NOT_FOUND", "no route for this method/path"));
            }

            Object out = route.handle(event, context);
            return Responses.json(app.om, 200, out);

        } catch (ApiException e) {
            int code = e.status();
            String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "error" : e.getMessage();
            return Responses.error(app.om, code, ApiError.of(Responses.codeFor(code), msg));

        } catch (ExportNotReadyException e) {
            return Responses.error(app.om, 409, ApiError.of("EXPORT_NOT_READY", e.getMessage(), e.pendingFields()));

        } catch (UpstreamFetchException e) {
            log.warn("{}: upstream fetch failed (status {}): {}", path, e.upstreamStatus(), e.getMessage());
            return Responses.error(app.om, 502, ApiError.of("BAD_GATEWAY", e.getMessage()));

        } catch (JsonProcessingException e) {
            return Responses.error(app.om, 400, ApiError.of("BAD_REQUEST", "malformed JSON body: " + e.getOriginalMessage()));

        } catch (IllegalArgumentException e) {
            return Responses.error(app.om, 400, ApiError.of("BAD_REQUEST", e.getMessage()));

        } catch (Exception e) {
            log.error("{}: unexpected error", path, e);
            return Responses.error(app.om, 500, ApiError.of("INTERNAL_ERROR", "unexpected error"));
        }
    }
}
