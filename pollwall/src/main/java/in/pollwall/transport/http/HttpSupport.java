package in.pollwall.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.pollwall.domain.error.DomainException;
import in.pollwall.domain.error.InvalidRequestException;
import in.pollwall.domain.error.RateLimitExceededException;
import in.pollwall.domain.error.TransientStoreException;
import in.pollwall.util.Json;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Deque;
import java.util.Map;

/**
 * Request parsing, JSON responses and exception to status mapping shared by the
 * HTTP handlers. Handlers run on worker threads behind a {@code BlockingHandler}.
 */
final class HttpSupport {
    private static final Logger log = LoggerFactory.getLogger(HttpSupport.class);

    private static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";

    @FunctionalInterface
    interface Action {
        void run() throws IOException;
    }

    /**
     * Run the action and translate any failure into an error response.
     */
    static void respond(HttpServerExchange exchange, Action action) {
        try {
            action.run();
        } catch (RateLimitExceededException e) {
            exchange.getResponseHeaders().put(Headers.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
            sendError(exchange, e.httpStatus(), e.getMessage());
        } catch (DomainException e) {
            if (e.httpStatus() == StatusCodes.UNAUTHORIZED) {
                exchange.getResponseHeaders().put(Headers.WWW_AUTHENTICATE, "Bearer");
            }
            sendError(exchange, e.httpStatus(), e.getMessage());
        } catch (TransientStoreException e) {
            sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, "Service temporarily unavailable, retry later");
        } catch (Exception e) {
            log.error("[HTTP] {} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Internal server error");
        }
    }

    static <T> T readBody(HttpServerExchange exchange, Class<T> type) throws IOException {
        byte[] body = exchange.getInputStream().readAllBytes();
        if (body.length == 0) {
            throw new InvalidRequestException("request body is required");
        }
        try {
            T value = Json.MAPPER.readValue(body, type);
            if (value == null) {
                throw new InvalidRequestException("request body is required");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("malformed JSON body: " + e.getOriginalMessage());
        }
    }

    /**
     * Like {@link #readBody} but an empty body yields {@code fallback}.
     */
    static <T> T readBodyOrDefault(HttpServerExchange exchange, Class<T> type, T fallback) throws IOException {
        byte[] body = exchange.getInputStream().readAllBytes();
        if (body.length == 0) {
            return fallback;
        }
        try {
            T value = Json.MAPPER.readValue(body, type);
            return value != null ? value : fallback;
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("malformed JSON body: " + e.getOriginalMessage());
        }
    }

    static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.getFirst().isBlank()) {
            throw new InvalidRequestException(name + " is required");
        }
        return values.getFirst();
    }

    static String authorization(HttpServerExchange exchange) {
        return exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
    }

    static String clientKey(HttpServerExchange exchange) {
        String forwarded = exchange.getRequestHeaders().getFirst(Headers.X_FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return exchange.getSourceAddress() != null ? exchange.getSourceAddress().getHostString() : "unknown";
    }

    static void sendJson(HttpServerExchange exchange, int status, Object body) throws JsonProcessingException {
        String json = Json.MAPPER.writeValueAsString(body);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON_CONTENT_TYPE);
        exchange.getResponseSender().send(json);
    }

    static void sendNoContent(HttpServerExchange exchange) {
        exchange.setStatusCode(StatusCodes.NO_CONTENT);
        exchange.endExchange();
    }

    static void sendError(HttpServerExchange exchange, int status, String message) {
        if (exchange.isResponseStarted()) {
            log.warn("[HTTP] Response already started, dropping error {}: {}", status, message);
            return;
        }
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON_CONTENT_TYPE);
        try {
            exchange.getResponseSender().send(Json.MAPPER.writeValueAsString(Map.of("detail", message != null ? message : "error")));
        } catch (JsonProcessingException e) {
            exchange.getResponseSender().send("{\"detail\":\"error\"}");
        }
    }

    private HttpSupport() {}
}
