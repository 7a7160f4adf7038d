package in.pollwall.auth;

import in.pollwall.domain.error.AdminRequiredException;
import in.pollwall.domain.error.AuthenticationException;
import in.pollwall.domain.error.DuplicateEmailException;
import in.pollwall.domain.error.InvalidRequestException;
import in.pollwall.domain.repository.Transactor;
import in.pollwall.domain.user.User;
import in.pollwall.domain.user.UserCredentials;
import in.pollwall.service.ServiceErrorLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;

import static in.pollwall.service.ServiceErrorLogger.context;

/**
 * Registration, login and bearer-token resolution.
 *
 * The first account ever registered becomes admin. Registrations take a transaction
 * scoped advisory lock before counting users, so two concurrent first sign-ups cannot
 * both be promoted.
 */
public final class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int MIN_PASSWORD_LENGTH = 6;

    private final Transactor transactor;
    private final JwtService jwtService;

    public AuthService(Transactor transactor, JwtService jwtService) {
        this.transactor = transactor;
        this.jwtService = jwtService;
    }

    public User register(String email, String password, String fullName) {
        return ServiceErrorLogger.call("register_user", context("email", email, "password", password), () -> {
            String normalized = normalizeEmail(email);
            if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
                throw new InvalidRequestException("password must be at least " + MIN_PASSWORD_LENGTH + " characters");
            }
            String hash = hashPassword(password);

            User user = transactor.inTransaction("register_user", uow -> {
                uow.users().lockRegistrations();
                if (uow.users().emailExists(normalized)) {
                    throw new DuplicateEmailException(normalized);
                }
                boolean first = uow.users().countUsers() == 0;
                return uow.users().insertUser(normalized, hash, blankToNull(fullName), first);
            });
            log.info("[Auth] Registered {} ({}){}", user.email(), user.id(), user.isAdmin() ? " as admin" : "");
            return user;
        });
    }

    /**
     * Check credentials and issue a token.
     *
     * @throws AuthenticationException on unknown email or wrong password
     */
    public LoginResult login(String email, String password) {
        return ServiceErrorLogger.call("login", context("email", email, "password", password), () -> {
            if (email == null || password == null) {
                throw new AuthenticationException("Email and password required");
            }
            String normalized = email.trim().toLowerCase(Locale.ROOT);
            Optional<UserCredentials> credentials = transactor.inTransaction("find_credentials",
                uow -> uow.users().findCredentialsByEmail(normalized));

            if (credentials.isEmpty() || !verifyPassword(password, credentials.get().hashedPassword())) {
                throw new AuthenticationException("Invalid email or password");
            }
            User user = credentials.get().user();
            log.info("[Auth] Login {} ({})", user.email(), user.id());
            return issue(user);
        });
    }

    /**
     * Fresh token for an already authenticated user.
     */
    public LoginResult refresh(User user) {
        return issue(user);
    }

    /**
     * Resolve an {@code Authorization} header to its user.
     *
     * @throws AuthenticationException if the header is missing, invalid, expired,
     *         blacklisted, or names a user that no longer exists
     */
    public User authenticate(String authorizationHeader) {
        JwtService.TokenClaims claims = jwtService.validate(authorizationHeader)
            .orElseThrow(() -> new AuthenticationException("Not authenticated"));
        return transactor.inTransaction("find_user", uow -> uow.users().findById(claims.userId()))
            .orElseThrow(() -> new AuthenticationException("User no longer exists"));
    }

    /**
     * Like {@link #authenticate} but the user must also be an admin.
     *
     * @throws AdminRequiredException for a valid token of a non-admin user
     */
    public User authenticateAdmin(String authorizationHeader) {
        User user = authenticate(authorizationHeader);
        if (!user.isAdmin()) {
            throw new AdminRequiredException(user.id());
        }
        return user;
    }

    /**
     * Like {@link #authenticate} but anonymous callers resolve to empty. A present but
     * invalid token is still rejected.
     */
    public Optional<User> authenticateOptional(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(authenticate(authorizationHeader));
    }

    public void logout(String authorizationHeader) {
        jwtService.blacklistToken(authorizationHeader);
    }

    private LoginResult issue(User user) {
        String token = jwtService.generateToken(user.id(), user.email(), user.isAdmin());
        return new LoginResult(token, "bearer", jwtService.expiration().toSeconds(), user);
    }

    private static String normalizeEmail(String email) {
        if (email == null) {
            throw new InvalidRequestException("email is required");
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        int at = normalized.indexOf('@');
        if (at < 1 || normalized.indexOf('.', at) < 0 || normalized.endsWith(".")) {
            throw new InvalidRequestException("invalid email: " + email);
        }
        return normalized;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static String hashPassword(String password) {
        byte[] salt = new byte[16];
        RANDOM.nextBytes(salt);
        byte[] hash = digest(salt, password);
        return Base64.getEncoder().encodeToString(salt) + "$" + Base64.getEncoder().encodeToString(hash);
    }

    static boolean verifyPassword(String password, String storedHash) {
        if (storedHash == null) {
            return false;
        }
        String[] parts = storedHash.split("\\$");
        if (parts.length != 2) {
            return false;
        }
        try {
            byte[] salt = Base64.getDecoder().decode(parts[0]);
            byte[] expected = Base64.getDecoder().decode(parts[1]);
            return MessageDigest.isEqual(expected, digest(salt, password));
        } catch (IllegalArgumentException e) {
            log.warn("[Auth] Stored password hash is not valid Base64");
            return false;
        }
    }

    private static byte[] digest(byte[] salt, String password) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update(salt);
            return md.digest(password.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /**
     * Token response for login and refresh.
     */
    public record LoginResult(
        String accessToken,
        String tokenType,
        long expiresIn,
        User user
    ) {}
}
