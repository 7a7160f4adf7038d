package in.pollwall.infrastructure.persistence;

import in.pollwall.domain.repository.UserRepository;
import in.pollwall.domain.user.User;
import in.pollwall.domain.user.UserCredentials;
import in.pollwall.util.Ids;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * PostgreSQL implementation of UserRepository.
 */
public final class PostgresUserRepository implements UserRepository {

    // Arbitrary constant key for pg_advisory_xact_lock, shared by all registrations
    private static final long REGISTRATION_LOCK_KEY = 0x504F4C4C57414C4CL;

    private final Connection conn;

    public PostgresUserRepository(Connection conn) {
        this.conn = conn;
    }

    @Override
    public void lockRegistrations() throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT pg_advisory_xact_lock(?)")) {
            ps.setLong(1, REGISTRATION_LOCK_KEY);
            ps.execute();
        }
    }

    @Override
    public long countUsers() throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM users");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    @Override
    public boolean emailExists(String email) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM users WHERE email = ?")) {
            ps.setString(1, email);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public User insertUser(String email, String hashedPassword, String fullName, boolean isAdmin) throws SQLException {
        String sql = """
            INSERT INTO users (id, email, hashed_password, full_name, is_admin, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, NOW(), NOW())
            RETURNING id, email, full_name, is_admin, created_at
            """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, Ids.user());
            ps.setString(2, email);
            ps.setString(3, hashedPassword);
            ps.setString(4, fullName);
            ps.setBoolean(5, isAdmin);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("INSERT ... RETURNING produced no row for " + email);
                }
                return mapUser(rs);
            }
        }
    }

    @Override
    public Optional<UserCredentials> findCredentialsByEmail(String email) throws SQLException {
        String sql = "SELECT id, email, full_name, is_admin, created_at, hashed_password FROM users WHERE email = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, email);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new UserCredentials(mapUser(rs), rs.getString("hashed_password")));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<User> findById(String userId) throws SQLException {
        String sql = "SELECT id, email, full_name, is_admin, created_at FROM users WHERE id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapUser(rs));
                }
            }
        }
        return Optional.empty();
    }

    static User mapUser(ResultSet rs) throws SQLException {
        return new User(
            rs.getString("id"),
            rs.getString("email"),
            rs.getString("full_name"),
            rs.getBoolean("is_admin"),
            PostgresPollRepository.toInstant(rs.getTimestamp("created_at"))
        );
    }
}
