package opsqueue.jobs.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import opsqueue.jobs.util.Json;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Read the request body as a DTO. An empty body yields {@code fallback}.
     *
     * @throws IllegalArgumentException if the body is not valid JSON for the type
     */
    static <T> T readBody(FullHttpRequest req, Class<T> type, T fallback) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            return fallback;
        }
        try {
            return Json.mapper().readValue(body, type);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalArgumentException("invalid JSON body: " + e.getMessage(), e);
        }
    }

    /**
     * First value of a query parameter, or null.
     */
    static String queryParam(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        /** Serialize {@code value} with the shared mapper */
        public static ControllerResponse json(HttpResponseStatus status, Object value) {
            try {
                return json(status, Json.mapper().writeValueAsString(value));
            } catch (Exception e) {
                throw new IllegalStateException("Failed to serialize response", e);
            }
        }

        public static ControllerResponse ok(Object value) {
            return json(HttpResponseStatus.OK, value);
        }

        public static ControllerResponse notFound(String message) {
            return errorResponse(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return errorResponse(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return errorResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }

        public static ControllerResponse forbidden(String message) {
            return errorResponse(HttpResponseStatus.FORBIDDEN, message);
        }

        public static ControllerResponse conflict(String message) {
            return errorResponse(HttpResponseStatus.CONFLICT, message);
        }

        public static ControllerResponse errorResponse(HttpResponseStatus status, String message) {
            return new ControllerResponse(status, "application/json",
                    Json.write(Map.of("error", message != null ? message : status.reasonPhrase())));
        }
    }
}
