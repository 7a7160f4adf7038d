package in.pollwall.infrastructure.persistence;

import in.pollwall.domain.poll.Vote;
import in.pollwall.domain.repository.VoteRepository;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL implementation of VoteRepository.
 */
public final class PostgresVoteRepository implements VoteRepository {

    private final Connection conn;

    public PostgresVoteRepository(Connection conn) {
        this.conn = conn;
    }

    @Override
    public boolean optionBelongsToPoll(String optionId, String pollId) throws SQLException {
        String sql = "SELECT 1 FROM poll_options WHERE id = ? AND poll_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, optionId);
            ps.setString(2, pollId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public Optional<Vote> findByUserAndPoll(String userId, String pollId) throws SQLException {
        String sql = """
            SELECT id, user_id, poll_id, option_id, created_at
            FROM poll_votes
            WHERE user_id = ? AND poll_id = ?
            """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setString(2, pollId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Vote(
                        rs.getString("id"),
                        rs.getString("user_id"),
                        rs.getString("poll_id"),
                        rs.getString("option_id"),
                        PostgresPollRepository.toInstant(rs.getTimestamp("created_at"))
                    ));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean insertIfAbsent(Vote vote) throws SQLException {
        String sql = """
            INSERT INTO poll_votes (id, user_id, poll_id, option_id, created_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (user_id, poll_id) DO NOTHING
            """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, vote.id());
            ps.setString(2, vote.userId());
            ps.setString(3, vote.pollId());
            ps.setString(4, vote.optionId());
            ps.setTimestamp(5, Timestamp.from(vote.createdAt()));
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public void updateOption(String voteId, String optionId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("UPDATE poll_votes SET option_id = ? WHERE id = ?")) {
            ps.setString(1, optionId);
            ps.setString(2, voteId);
            ps.executeUpdate();
        }
    }

    @Override
    public int countForOption(String optionId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM poll_votes WHERE option_id = ?")) {
            ps.setString(1, optionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    @Override
    public void updateOptionVotes(String optionId, int votes) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("UPDATE poll_options SET votes = ? WHERE id = ?")) {
            ps.setInt(1, votes);
            ps.setString(2, optionId);
            ps.executeUpdate();
        }
    }

    @Override
    public Map<String, String> findOptionIdsByUser(String userId, Collection<String> pollIds) throws SQLException {
        Map<String, String> result = new HashMap<>();
        if (pollIds.isEmpty()) {
            return result;
        }
        String sql = "SELECT poll_id, option_id FROM poll_votes WHERE user_id = ? AND poll_id = ANY(?)";
        Array idArray = conn.createArrayOf("varchar", pollIds.toArray());
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setArray(2, idArray);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.put(rs.getString("poll_id"), rs.getString("option_id"));
                }
            }
        } finally {
            idArray.free();
        }
        return result;
    }
}
