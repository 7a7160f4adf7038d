package in.pollwall.transport.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.pollwall.auth.AuthService;
import in.pollwall.auth.LoginRateLimiter;
import in.pollwall.domain.error.InvalidRequestException;
import in.pollwall.domain.error.RateLimitExceededException;
import in.pollwall.domain.user.User;
import in.pollwall.infrastructure.metrics.PollMetrics;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.form.FormData;
import io.undertow.server.handlers.form.FormDataParser;
import io.undertow.server.handlers.form.FormParserFactory;
import io.undertow.util.StatusCodes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static in.pollwall.transport.http.HttpSupport.authorization;
import static in.pollwall.transport.http.HttpSupport.clientKey;
import static in.pollwall.transport.http.HttpSupport.readBody;
import static in.pollwall.transport.http.HttpSupport.respond;
import static in.pollwall.transport.http.HttpSupport.sendJson;

/**
 * HTTP handlers for /api/users.
 */
public final class UserHandlers {

    private final AuthService authService;
    private final LoginRateLimiter loginRateLimiter;
    private final PollMetrics metrics;

    public UserHandlers(AuthService authService, LoginRateLimiter loginRateLimiter, PollMetrics metrics) {
        this.authService = authService;
        this.loginRateLimiter = loginRateLimiter;
        this.metrics = metrics;
    }

    /**
     * POST /api/users
     */
    public void register(HttpServerExchange exchange) {
        respond(exchange, () -> {
            RegisterRequest request = readBody(exchange, RegisterRequest.class);
            User user = authService.register(request.email(), request.password(), request.fullName());
            sendJson(exchange, StatusCodes.CREATED, user);
        });
    }

    /**
     * POST /api/users/login - rate limited per client address
     */
    public void login(HttpServerExchange exchange) {
        respond(exchange, () -> {
            acquireLoginSlot(exchange);
            LoginRequest request = readBody(exchange, LoginRequest.class);
            sendJson(exchange, StatusCodes.OK, authService.login(request.email(), request.password()));
        });
    }

    /**
     * POST /api/users/login/oauth2 - form-encoded {@code username}/{@code password} login
     */
    public void loginForm(HttpServerExchange exchange) {
        respond(exchange, () -> {
            acquireLoginSlot(exchange);
            String username;
            String password;
            try (FormDataParser parser = FormParserFactory.builder().build().createParser(exchange)) {
                if (parser == null) {
                    throw new InvalidRequestException("form-encoded body is required");
                }
                FormData form = parser.parseBlocking();
                username = formValue(form, "username");
                password = formValue(form, "password");
            }
            AuthService.LoginResult result = authService.login(username, password);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("access_token", result.accessToken());
            body.put("token_type", result.tokenType());
            body.put("expires_in", result.expiresIn());
            body.put("user_id", result.user().id());
            body.put("user_email", result.user().email());
            sendJson(exchange, StatusCodes.OK, body);
        });
    }

    /**
     * GET /api/users/me
     */
    public void me(HttpServerExchange exchange) {
        respond(exchange, () -> sendJson(exchange, StatusCodes.OK, authService.authenticate(authorization(exchange))));
    }

    /**
     * GET /api/users/admin/me - 403 unless the caller is an admin
     */
    public void adminMe(HttpServerExchange exchange) {
        respond(exchange, () -> sendJson(exchange, StatusCodes.OK, authService.authenticateAdmin(authorization(exchange))));
    }

    /**
     * POST /api/users/refresh
     */
    public void refresh(HttpServerExchange exchange) {
        respond(exchange, () -> {
            User user = authService.authenticate(authorization(exchange));
            sendJson(exchange, StatusCodes.OK, authService.refresh(user));
        });
    }

    /**
     * GET /api/users/validate-token
     */
    public void validateToken(HttpServerExchange exchange) {
        respond(exchange, () -> {
            User user = authService.authenticate(authorization(exchange));
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("valid", true);
            body.put("user", user);
            sendJson(exchange, StatusCodes.OK, body);
        });
    }

    /**
     * POST /api/users/logout - blacklists the presented token
     */
    public void logout(HttpServerExchange exchange) {
        respond(exchange, () -> {
            String header = authorization(exchange);
            authService.authenticate(header);
            authService.logout(header);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message", "Successfully logged out");
            body.put("logout_time", Instant.now());
            sendJson(exchange, StatusCodes.OK, body);
        });
    }

    private void acquireLoginSlot(HttpServerExchange exchange) {
        try {
            loginRateLimiter.acquire(clientKey(exchange));
        } catch (RateLimitExceededException e) {
            metrics.recordRateLimited("login");
            throw e;
        }
    }

    private static String formValue(FormData form, String name) {
        FormData.FormValue value = form.getFirst(name);
        if (value == null || value.isFileItem() || value.getValue().isBlank()) {
            throw new InvalidRequestException(name + " is required");
        }
        return value.getValue();
    }

    record RegisterRequest(
        String email,
        String password,
        @JsonProperty("full_name") String fullName
    ) {}

    record LoginRequest(String email, String password) {}
}
