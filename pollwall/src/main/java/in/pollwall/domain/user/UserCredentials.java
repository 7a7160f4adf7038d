package in.pollwall.domain.user;

/**
 * A user together with the stored password hash ({@code salt$hash}).
 */
public record UserCredentials(User user, String hashedPassword) {}
