package in.pollwall.domain.user;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Public user profile. Never carries credentials.
 */
public record User(
    String id,
    String email,
    String fullName,
    @JsonProperty("is_admin") boolean isAdmin,
    Instant createdAt
) {}
