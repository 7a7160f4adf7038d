package in.pollwall.bootstrap;

import com.fasterxml.jackson.databind.JsonNode;
import in.pollwall.auth.AuthService;
import in.pollwall.auth.LoginRateLimiter;
import in.pollwall.domain.error.AdminRequiredException;
import in.pollwall.domain.error.AuthenticationException;
import in.pollwall.domain.error.PollNotFoundException;
import in.pollwall.domain.error.TransientStoreException;
import in.pollwall.domain.error.VoteValidationException;
import in.pollwall.domain.poll.NewPoll;
import in.pollwall.domain.poll.Poll;
import in.pollwall.domain.poll.PollOption;
import in.pollwall.domain.user.User;
import in.pollwall.infrastructure.metrics.PrometheusMetricsHandler;
import in.pollwall.infrastructure.metrics.PrometheusPollMetrics;
import in.pollwall.service.PollAggregateService;
import in.pollwall.service.event.PollEventBus;
import in.pollwall.transport.http.PollHandlers;
import in.pollwall.transport.http.UserHandlers;
import in.pollwall.transport.http.VoteHandlers;
import in.pollwall.transport.sse.PollStreamHandler;
import in.pollwall.util.Json;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Route table, status mapping and CORS over a live Undertow listener.
 */
@ExtendWith(MockitoExtension.class)
class ApiRoutesTest {

    private static final int TEST_PORT = 19093;
    private static final String BASE = "http://localhost:" + TEST_PORT;
    private static final String TOKEN = "Bearer good-token";
    private static final User ALICE = new User("U1", "alice@example.com", "Alice", false,
        Instant.parse("2024-05-01T09:00:00Z"));

    @Mock
    private PollAggregateService pollService;

    @Mock
    private AuthService authService;

    private PollStreamHandler stream;
    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        CollectorRegistry registry = new CollectorRegistry();
        PrometheusPollMetrics metrics = new PrometheusPollMetrics(registry);
        PollEventBus bus = new PollEventBus(10, metrics);
        stream = new PollStreamHandler(bus, Duration.ofSeconds(15));

        RoutingHandler routes = App.buildRoutes(
            new PollHandlers(pollService, authService),
            new VoteHandlers(pollService, authService),
            new UserHandlers(authService, new LoginRateLimiter(1, Duration.ofMinutes(5)), metrics),
            stream, bus, new PrometheusMetricsHandler(registry), TEST_PORT);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(App.cors(routes))
            .build();
        server.start();
        httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() {
        stream.shutdown();
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void createWithoutToken_isUnauthorized() throws Exception {
        when(authService.authenticate(null)).thenThrow(new AuthenticationException("Not authenticated"));

        HttpResponse<String> response = post("/api/polls", null, "{\"title\":\"x\"}");

        assertEquals(401, response.statusCode());
        assertEquals("Bearer", response.headers().firstValue("WWW-Authenticate").orElse(null));
        assertEquals("Not authenticated", detail(response));
        verifyNoInteractions(pollService);
    }

    @Test
    void createPoll_returnsCreatedSnapshot() throws Exception {
        when(authService.authenticate(TOKEN)).thenReturn(ALICE);
        when(pollService.createPoll(eq("U1"), any(NewPoll.class))).thenReturn(poll("P1"));

        HttpResponse<String> response = post("/api/polls", TOKEN,
            "{\"title\":\" Lunch? \",\"options\":[{\"text\":\"Pizza\"},{\"text\":\"Sushi\"}]}");

        assertEquals(201, response.statusCode());
        JsonNode body = Json.MAPPER.readTree(response.body());
        assertEquals("P1", body.get("id").asText());
        assertEquals(2, body.get("options").size());
        assertTrue(body.has("my_vote_option_id"), "Viewer field is always present on responses");
        assertTrue(body.get("my_vote_option_id").isNull(), "Fresh poll has no viewer vote");

        ArgumentCaptor<NewPoll> captor = ArgumentCaptor.forClass(NewPoll.class);
        verify(pollService).createPoll(eq("U1"), captor.capture());
        assertEquals("Lunch?", captor.getValue().title());
        assertEquals(List.of("Pizza", "Sushi"), captor.getValue().optionTexts());
    }

    @Test
    void malformedBody_isUnprocessable() throws Exception {
        when(authService.authenticate(TOKEN)).thenReturn(ALICE);

        HttpResponse<String> response = post("/api/polls", TOKEN, "{not json");

        assertEquals(422, response.statusCode());
        verifyNoInteractions(pollService);
    }

    @Test
    void unknownPoll_isNotFound() throws Exception {
        when(authService.authenticateOptional(null)).thenReturn(Optional.empty());
        when(pollService.getPoll("PX", null)).thenThrow(new PollNotFoundException("PX"));

        HttpResponse<String> response = get("/api/polls/PX");

        assertEquals(404, response.statusCode());
        assertTrue(detail(response).contains("PX"));
    }

    @Test
    void voteForForeignOption_isBadRequest() throws Exception {
        when(authService.authenticate(TOKEN)).thenReturn(ALICE);
        when(pollService.castVote("U1", "P1", "OX")).thenThrow(new VoteValidationException("P1", "OX"));

        HttpResponse<String> response = post("/api/votes", TOKEN, "{\"poll_id\":\"P1\",\"option_id\":\"OX\"}");

        assertEquals(400, response.statusCode());
    }

    @Test
    void voteReturnsViewerOption() throws Exception {
        when(authService.authenticate(TOKEN)).thenReturn(ALICE);
        when(pollService.castVote("U1", "P1", "OA")).thenReturn(poll("P1").withViewerVote("OA"));

        HttpResponse<String> response = post("/api/votes", TOKEN, "{\"poll_id\":\"P1\",\"option_id\":\"OA\"}");

        assertEquals(201, response.statusCode());
        assertEquals("OA", Json.MAPPER.readTree(response.body()).get("my_vote_option_id").asText());
    }

    @Test
    void transientStoreFailure_isServiceUnavailable() throws Exception {
        when(authService.authenticate(TOKEN)).thenReturn(ALICE);
        when(pollService.likePoll("P1", "U1"))
            .thenThrow(new TransientStoreException("like_poll exhausted retries", "40P01", null));

        HttpResponse<String> response = post("/api/polls/P1/like", TOKEN, "");

        assertEquals(503, response.statusCode());
    }

    @Test
    void deletePoll_returnsNoContent() throws Exception {
        when(authService.authenticate(TOKEN)).thenReturn(ALICE);

        HttpRequest request = HttpRequest.newBuilder(URI.create(BASE + "/api/polls/P1"))
            .header("Authorization", TOKEN)
            .DELETE()
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(204, response.statusCode());
        verify(pollService).deletePoll("P1", "U1", false);
    }

    @Test
    void secondLoginInWindow_isRateLimited() throws Exception {
        when(authService.login("alice@example.com", "secret1"))
            .thenReturn(new AuthService.LoginResult("tok", "bearer", 1800, ALICE));
        String body = "{\"email\":\"alice@example.com\",\"password\":\"secret1\"}";

        assertEquals(200, post("/api/users/login", null, body).statusCode());
        HttpResponse<String> limited = post("/api/users/login", null, body);

        assertEquals(429, limited.statusCode());
        assertTrue(limited.headers().firstValue("Retry-After").isPresent());
        verify(authService, times(1)).login(any(), any());
    }

    @Test
    void adminMe_rejectsNonAdmin() throws Exception {
        when(authService.authenticateAdmin(TOKEN)).thenThrow(new AdminRequiredException("U1"));

        HttpRequest request = HttpRequest.newBuilder(URI.create(BASE + "/api/users/admin/me"))
            .header("Authorization", TOKEN)
            .GET()
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(403, response.statusCode());
        assertEquals("The user doesn't have enough privileges", detail(response));
    }

    @Test
    void formLogin_returnsTokenWithUserIdentity() throws Exception {
        when(authService.login("alice@example.com", "secret1"))
            .thenReturn(new AuthService.LoginResult("tok", "bearer", 1800, ALICE));

        HttpRequest request = HttpRequest.newBuilder(URI.create(BASE + "/api/users/login/oauth2"))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString("username=alice%40example.com&password=secret1"))
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        JsonNode body = Json.MAPPER.readTree(response.body());
        assertEquals("tok", body.get("access_token").asText());
        assertEquals("bearer", body.get("token_type").asText());
        assertEquals(1800, body.get("expires_in").asLong());
        assertEquals("U1", body.get("user_id").asText());
        assertEquals("alice@example.com", body.get("user_email").asText());
    }

    @Test
    void formLogin_withoutPassword_isUnprocessable() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(BASE + "/api/users/login/oauth2"))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString("username=alice%40example.com"))
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(422, response.statusCode());
        verifyNoInteractions(authService);
    }

    @Test
    void health_reportsSubscribers() throws Exception {
        HttpResponse<String> response = get("/api/health");

        assertEquals(200, response.statusCode());
        JsonNode body = Json.MAPPER.readTree(response.body());
        assertEquals("UP", body.get("status").asText());
        assertEquals(0, body.get("subscribers").asInt());
    }

    @Test
    void preflight_isAnsweredWithCorsHeaders() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(BASE + "/api/polls"))
            .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
        verifyNoInteractions(authService, pollService);
    }

    @Test
    void unknownRoute_fallsBackTo404() throws Exception {
        HttpResponse<String> response = get("/nope");

        assertEquals(404, response.statusCode());
        assertTrue(response.body().contains("/api/polls/stream"));
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(BASE + path)).GET().build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String authorization, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(BASE + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static String detail(HttpResponse<String> response) throws Exception {
        return Json.MAPPER.readTree(response.body()).get("detail").asText();
    }

    private static Poll poll(String id) {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        return new Poll(id, "Lunch?", null, null, 0, 0, now, now, "U1", ALICE,
            List.of(new PollOption("OA", "Pizza", 0), new PollOption("OB", "Sushi", 0)),
            List.of(), List.of(), null);
    }
}
