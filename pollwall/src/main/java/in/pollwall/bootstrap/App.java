package in.pollwall.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.pollwall.auth.AuthService;
import in.pollwall.auth.JwtService;
import in.pollwall.auth.LoginRateLimiter;
import in.pollwall.domain.repository.Transactor;
import in.pollwall.infrastructure.metrics.PrometheusMetricsHandler;
import in.pollwall.infrastructure.metrics.PrometheusPollMetrics;
import in.pollwall.infrastructure.persistence.JdbcTransactor;
import in.pollwall.migration.SchemaMigration;
import in.pollwall.service.CounterSync;
import in.pollwall.service.PollAggregateService;
import in.pollwall.service.event.PollEventBus;
import in.pollwall.transport.http.PollHandlers;
import in.pollwall.transport.http.UserHandlers;
import in.pollwall.transport.http.VoteHandlers;
import in.pollwall.transport.sse.PollStreamHandler;
import in.pollwall.util.Json;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * PollWall server entry point. Builds every long-lived component once and wires them
 * by constructor.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== PollWall Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        AppConfig config = AppConfig.fromEnv();

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);
        new SchemaMigration(dataSource).migrate();

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusPollMetrics metrics = new PrometheusPollMetrics(CollectorRegistry.defaultRegistry);

        // ═══════════════════════════════════════════════════════════════
        // Core services
        // ═══════════════════════════════════════════════════════════════
        Transactor transactor = new JdbcTransactor(dataSource, metrics, config.txMaxAttempts(),
            config.lockTimeout(), Duration.ofMillis(25));
        PollEventBus eventBus = new PollEventBus(config.eventQueueSize(), metrics);
        PollAggregateService pollService = new PollAggregateService(transactor, new CounterSync(), eventBus, metrics);

        JwtService jwtService = new JwtService(config.jwtSecret(), config.jwtExpiration());
        AuthService authService = new AuthService(transactor, jwtService);
        LoginRateLimiter loginRateLimiter = new LoginRateLimiter(config.loginRateLimit(), config.loginRateWindow());

        ScheduledExecutorService housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "auth-housekeeping");
            t.setDaemon(true);
            return t;
        });
        housekeeping.scheduleAtFixedRate(() -> {
            int removed = jwtService.cleanupBlacklist();
            loginRateLimiter.evictIdle();
            if (removed > 0) {
                log.debug("[Auth] Removed {} expired blacklist entries", removed);
            }
        }, 5, 5, TimeUnit.MINUTES);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        PollHandlers polls = new PollHandlers(pollService, authService);
        VoteHandlers votes = new VoteHandlers(pollService, authService);
        UserHandlers users = new UserHandlers(authService, loginRateLimiter, metrics);
        PollStreamHandler stream = new PollStreamHandler(eventBus, config.sseKeepAlive());

        RoutingHandler routes = buildRoutes(polls, votes, users, stream, eventBus,
            new PrometheusMetricsHandler(metrics.getRegistry()), config.port());

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(cors(routes))
            .build();
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[Shutdown] Stopping PollWall");
            server.stop();
            stream.shutdown();
            housekeeping.shutdownNow();
            dataSource.close();
        }, "shutdown-hook"));

        log.info("✓ PollWall started on http://localhost:{}/ (event queue size {})",
            config.port(), config.eventQueueSize());
    }

    static RoutingHandler buildRoutes(PollHandlers polls, VoteHandlers votes, UserHandlers users,
                                      PollStreamHandler stream, PollEventBus eventBus,
                                      HttpHandler metricsHandler, int port) {
        return Handlers.routing()
            // Users
            .post("/api/users", blocking(users::register))
            .post("/api/users/login", blocking(users::login))
            .post("/api/users/login/oauth2", blocking(users::loginForm))
            .get("/api/users/me", blocking(users::me))
            .get("/api/users/admin/me", blocking(users::adminMe))
            .post("/api/users/refresh", blocking(users::refresh))
            .get("/api/users/validate-token", blocking(users::validateToken))
            .post("/api/users/logout", blocking(users::logout))
            // Polls
            .get("/api/polls/stream", stream.handler())
            .post("/api/polls", blocking(polls::create))
            .post("/api/polls/list", blocking(polls::list))
            .post("/api/polls/mine", blocking(polls::mine))
            .get("/api/polls/{pollId}", blocking(polls::get))
            .post("/api/polls/{pollId}/like", blocking(polls::like))
            .post("/api/polls/{pollId}/dislike", blocking(polls::dislike))
            .delete("/api/polls/{pollId}", blocking(polls::delete))
            // Votes
            .post("/api/votes", blocking(votes::cast))
            // Ops
            .get("/api/health", exchange -> {
                Map<String, Object> health = new LinkedHashMap<>();
                health.put("status", "UP");
                health.put("subscribers", eventBus.subscriberCount());
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
                exchange.getResponseSender().send(Json.MAPPER.writeValueAsString(health));
            })
            .get("/metrics", metricsHandler)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "PollWall\n\n" +
                    "Users:  POST /api/users, /api/users/login, /api/users/refresh, /api/users/logout\n" +
                    "Polls:  POST /api/polls, /api/polls/list, /api/polls/mine, /api/polls/{id}/like|dislike\n" +
                    "Votes:  POST /api/votes\n" +
                    "Stream: GET http://localhost:" + port + "/api/polls/stream (text/event-stream)\n"
                );
            });
    }

    static HttpHandler cors(HttpHandler next) {
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (Methods.OPTIONS.equals(exchange.getRequestMethod())) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                next.handleRequest(exchange);
            }
        };
    }

    private static HttpHandler blocking(HttpHandler handler) {
        return new BlockingHandler(handler);
    }

    private static HikariDataSource createDataSource(AppConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(2);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("pollwall-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private App() {}
}
