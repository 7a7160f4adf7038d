package in.pollwall.domain.repository;

import in.pollwall.domain.user.User;
import in.pollwall.domain.user.UserCredentials;

import java.sql.SQLException;
import java.util.Optional;

public interface UserRepository {

    /**
     * Serialize registrations for the rest of the transaction.
     */
    void lockRegistrations() throws SQLException;

    long countUsers() throws SQLException;

    boolean emailExists(String email) throws SQLException;

    User insertUser(String email, String hashedPassword, String fullName, boolean isAdmin) throws SQLException;

    Optional<UserCredentials> findCredentialsByEmail(String email) throws SQLException;

    Optional<User> findById(String userId) throws SQLException;
}
