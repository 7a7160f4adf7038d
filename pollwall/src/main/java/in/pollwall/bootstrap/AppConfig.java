package in.pollwall.bootstrap;

import in.pollwall.util.Env;

import java.time.Duration;

/**
 * Process configuration, resolved once at startup.
 */
public record AppConfig(
    int port,
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,
    Duration lockTimeout,
    int txMaxAttempts,
    String jwtSecret,
    Duration jwtExpiration,
    int eventQueueSize,
    Duration sseKeepAlive,
    int loginRateLimit,
    Duration loginRateWindow
) {
    public AppConfig {
        if (eventQueueSize < 1) {
            throw new IllegalStateException("EVENT_QUEUE_SIZE must be positive, got " + eventQueueSize);
        }
        if (txMaxAttempts < 1) {
            throw new IllegalStateException("DB_TX_MAX_ATTEMPTS must be positive, got " + txMaxAttempts);
        }
    }

    public static AppConfig fromEnv() {
        return new AppConfig(
            Env.getInt("PORT", 8000),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/pollwall"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 10),
            Duration.ofMillis(Env.getLong("DB_LOCK_TIMEOUT_MS", 5000)),
            Env.getInt("DB_TX_MAX_ATTEMPTS", 3),
            Env.get("JWT_SECRET", "pollwall-secret-key-change-in-production"),
            Duration.ofMinutes(Env.getLong("JWT_EXPIRATION_MINUTES", 30)),
            Env.getInt("EVENT_QUEUE_SIZE", 100),
            Duration.ofMillis(Env.getLong("SSE_KEEPALIVE_MS", 15000)),
            Env.getInt("LOGIN_RATE_LIMIT", 5),
            Duration.ofSeconds(Env.getLong("LOGIN_RATE_WINDOW_SECONDS", 300))
        );
    }
}
