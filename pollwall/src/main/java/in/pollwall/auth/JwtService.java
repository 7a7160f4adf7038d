package in.pollwall.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.pollwall.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HS256 JWT issue and validation.
 *
 * Claims: {@code sub} (user id), {@code email}, {@code role} (USER or ADMIN),
 * {@code iat}, {@code exp} in epoch seconds. Logged-out tokens are kept in a
 * blacklist until they would have expired anyway.
 */
public final class JwtService {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);
    private static final String HMAC = "HmacSHA256";
    private static final String HEADER = encode("{\"alg\":\"HS256\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));
    private static final String BEARER = "Bearer ";

    private final byte[] secret;
    private final Duration expiration;
    private final Clock clock;

    // token -> its own expiry
    private final Map<String, Instant> blacklist = new ConcurrentHashMap<>();

    public JwtService(String secret, Duration expiration) {
        this(secret, expiration, Clock.systemUTC());
    }

    public JwtService(String secret, Duration expiration, Clock clock) {
        if (secret == null || secret.length() < 16) {
            throw new IllegalArgumentException("JWT secret must be at least 16 characters");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.expiration = expiration;
        this.clock = clock;
    }

    public Duration expiration() {
        return expiration;
    }

    public String generateToken(String userId, String email, boolean admin) {
        long now = clock.instant().getEpochSecond();
        ObjectNode claims = Json.MAPPER.createObjectNode()
            .put("sub", userId)
            .put("email", email)
            .put("role", admin ? "ADMIN" : "USER")
            .put("iat", now)
            .put("exp", now + expiration.toSeconds());

        String payload = encode(claims.toString().getBytes(StandardCharsets.UTF_8));
        return HEADER + "." + payload + "." + sign(HEADER + "." + payload);
    }

    /**
     * Verify signature, expiry and blacklist. Accepts a raw token or an
     * {@code Authorization} header value.
     */
    public Optional<TokenClaims> validate(String token) {
        String raw = stripBearer(token);
        if (raw == null) {
            return Optional.empty();
        }

        String[] parts = raw.split("\\.");
        if (parts.length != 3) {
            log.debug("[JWT] Malformed token");
            return Optional.empty();
        }

        byte[] expected = sign(parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, parts[2].getBytes(StandardCharsets.US_ASCII))) {
            log.debug("[JWT] Bad signature");
            return Optional.empty();
        }

        TokenClaims claims;
        try {
            JsonNode node = Json.MAPPER.readTree(Base64.getUrlDecoder().decode(parts[1]));
            claims = new TokenClaims(
                node.path("sub").asText(null),
                node.path("email").asText(null),
                node.path("role").asText("USER"),
                Instant.ofEpochSecond(node.path("iat").asLong()),
                Instant.ofEpochSecond(node.path("exp").asLong())
            );
        } catch (Exception e) {
            log.debug("[JWT] Unreadable claims: {}", e.getMessage());
            return Optional.empty();
        }

        if (claims.userId() == null) {
            log.debug("[JWT] Missing subject");
            return Optional.empty();
        }
        if (!clock.instant().isBefore(claims.expiresAt())) {
            log.debug("[JWT] Token for {} expired at {}", claims.userId(), claims.expiresAt());
            return Optional.empty();
        }
        if (blacklist.containsKey(raw)) {
            log.debug("[JWT] Token for {} is blacklisted", claims.userId());
            return Optional.empty();
        }
        return Optional.of(claims);
    }

    public void blacklistToken(String token) {
        String raw = stripBearer(token);
        if (raw == null) {
            return;
        }
        Instant expiresAt = validate(raw).map(TokenClaims::expiresAt)
            .orElse(clock.instant().plus(expiration));
        blacklist.put(raw, expiresAt);
    }

    /**
     * Forget blacklisted tokens that have expired on their own.
     *
     * @return number of entries removed
     */
    public int cleanupBlacklist() {
        Instant now = clock.instant();
        int before = blacklist.size();
        blacklist.values().removeIf(expiresAt -> !now.isBefore(expiresAt));
        return before - blacklist.size();
    }

    private static String stripBearer(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        String trimmed = token.trim();
        return trimmed.startsWith(BEARER) ? trimmed.substring(BEARER.length()).trim() : trimmed;
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(secret, HMAC));
            return encode(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }

    private static String encode(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Validated token claims.
     */
    public record TokenClaims(
        String userId,
        String email,
        String role,
        Instant issuedAt,
        Instant expiresAt
    ) {
        public boolean isAdmin() {
            return "ADMIN".equals(role);
        }
    }
}
