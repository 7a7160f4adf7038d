package in.pollwall.infrastructure.persistence;

import in.pollwall.domain.poll.Reaction;
import in.pollwall.domain.repository.ReactionRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * PostgreSQL implementation of ReactionRepository over {@code poll_likes} and
 * {@code poll_dislikes}.
 */
public final class PostgresReactionRepository implements ReactionRepository {

    private final Connection conn;

    public PostgresReactionRepository(Connection conn) {
        this.conn = conn;
    }

    @Override
    public void remove(Reaction reaction, String pollId, String userId) throws SQLException {
        String sql = "DELETE FROM " + table(reaction) + " WHERE poll_id = ? AND user_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, pollId);
            ps.setString(2, userId);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean addIfAbsent(Reaction reaction, String pollId, String userId) throws SQLException {
        String sql = "INSERT INTO " + table(reaction) + " (user_id, poll_id, created_at)"
            + " VALUES (?, ?, NOW()) ON CONFLICT (user_id, poll_id) DO NOTHING";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setString(2, pollId);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public int count(Reaction reaction, String pollId) throws SQLException {
        String sql = "SELECT COUNT(*) FROM " + table(reaction) + " WHERE poll_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, pollId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private static String table(Reaction reaction) {
        return switch (reaction) {
            case LIKE -> "poll_likes";
            case DISLIKE -> "poll_dislikes";
        };
    }
}
