package in.pollwall.infrastructure.persistence;

import in.pollwall.domain.poll.NewPoll;
import in.pollwall.domain.poll.PageRequest;
import in.pollwall.domain.poll.Poll;
import in.pollwall.domain.poll.PollOption;
import in.pollwall.domain.poll.PollSort;
import in.pollwall.domain.repository.PollRepository;
import in.pollwall.domain.user.User;
import in.pollwall.util.Ids;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL implementation of PollRepository.
 *
 * Snapshots are assembled from the poll row, its options in insertion order and the
 * like/dislike relations joined to user profiles. Listings load children in batches
 * with {@code = ANY(?)}.
 */
public final class PostgresPollRepository implements PollRepository {

    private static final String POLL_COLUMNS = """
        p.id, p.title, p.description, p.poll_expires_at, p.likes, p.dislikes,
        p.created_at, p.updated_at, p.created_by,
        u.email AS creator_email, u.full_name AS creator_full_name,
        u.is_admin AS creator_is_admin, u.created_at AS creator_created_at
        """;

    private final Connection conn;

    public PostgresPollRepository(Connection conn) {
        this.conn = conn;
    }

    @Override
    public boolean lockPoll(String pollId) throws SQLException {
        String sql = "SELECT id FROM polls WHERE id = ? FOR UPDATE";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, pollId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public String insertPoll(String createdBy, NewPoll newPoll) throws SQLException {
        String pollId = Ids.poll();
        String pollSql = """
            INSERT INTO polls (id, title, description, poll_expires_at, likes, dislikes,
                               created_at, updated_at, created_by)
            VALUES (?, ?, ?, ?, 0, 0, NOW(), NOW(), ?)
            """;
        try (PreparedStatement ps = conn.prepareStatement(pollSql)) {
            ps.setString(1, pollId);
            ps.setString(2, newPoll.title());
            ps.setString(3, newPoll.description());
            ps.setTimestamp(4, newPoll.pollExpiresAt() != null ? Timestamp.from(newPoll.pollExpiresAt()) : null);
            ps.setString(5, createdBy);
            ps.executeUpdate();
        }

        String optionSql = "INSERT INTO poll_options (id, poll_id, text, votes, position) VALUES (?, ?, ?, 0, ?)";
        try (PreparedStatement ps = conn.prepareStatement(optionSql)) {
            int position = 0;
            for (String text : newPoll.optionTexts()) {
                ps.setString(1, Ids.option());
                ps.setString(2, pollId);
                ps.setString(3, text);
                ps.setInt(4, position++);
                ps.addBatch();
            }
            ps.executeBatch();
        }
        return pollId;
    }

    @Override
    public Optional<Poll> findSnapshot(String pollId) throws SQLException {
        String sql = "SELECT " + POLL_COLUMNS + " FROM polls p LEFT JOIN users u ON u.id = p.created_by WHERE p.id = ?";
        List<PollRow> rows = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, pollId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapPollRow(rs));
                }
            }
        }
        List<Poll> polls = assemble(rows);
        return polls.isEmpty() ? Optional.empty() : Optional.of(polls.get(0));
    }

    @Override
    public List<Poll> listSnapshots(PageRequest page, String createdBy) throws SQLException {
        String where = createdBy != null ? " WHERE p.created_by = ?" : "";
        String sql = "SELECT " + POLL_COLUMNS
            + " FROM polls p LEFT JOIN users u ON u.id = p.created_by"
            + where
            + " ORDER BY " + orderBy(page.sort())
            + " LIMIT ? OFFSET ?";

        List<PollRow> rows = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            if (createdBy != null) {
                ps.setString(i++, createdBy);
            }
            ps.setInt(i++, page.limit());
            ps.setInt(i, page.offset());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapPollRow(rs));
                }
            }
        }
        return assemble(rows);
    }

    @Override
    public void updateReactionCounts(String pollId, int likes, int dislikes) throws SQLException {
        String sql = "UPDATE polls SET likes = ?, dislikes = ?, updated_at = NOW() WHERE id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, likes);
            ps.setInt(2, dislikes);
            ps.setString(3, pollId);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean deletePoll(String pollId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM polls WHERE id = ?")) {
            ps.setString(1, pollId);
            return ps.executeUpdate() > 0;
        }
    }

    private static String orderBy(PollSort sort) {
        return switch (sort) {
            case LIKES -> "p.likes DESC, p.created_at DESC, p.id DESC";
            case CREATED_AT -> "p.created_at DESC, p.id DESC";
        };
    }

    private List<Poll> assemble(List<PollRow> rows) throws SQLException {
        if (rows.isEmpty()) {
            return List.of();
        }
        List<String> ids = rows.stream().map(PollRow::id).toList();
        Map<String, List<PollOption>> options = loadOptions(ids);
        Map<String, List<User>> likedBy = loadReactors("poll_likes", ids);
        Map<String, List<User>> dislikedBy = loadReactors("poll_dislikes", ids);

        List<Poll> polls = new ArrayList<>(rows.size());
        for (PollRow row : rows) {
            polls.add(new Poll(
                row.id(), row.title(), row.description(), row.pollExpiresAt(),
                row.likes(), row.dislikes(), row.createdAt(), row.updatedAt(),
                row.createdBy(), row.creator(),
                options.getOrDefault(row.id(), List.of()),
                likedBy.getOrDefault(row.id(), List.of()),
                dislikedBy.getOrDefault(row.id(), List.of()),
                null
            ));
        }
        return polls;
    }

    private Map<String, List<PollOption>> loadOptions(Collection<String> pollIds) throws SQLException {
        String sql = """
            SELECT poll_id, id, text, votes
            FROM poll_options
            WHERE poll_id = ANY(?)
            ORDER BY poll_id, position
            """;
        Map<String, List<PollOption>> result = new HashMap<>();
        Array idArray = conn.createArrayOf("varchar", pollIds.toArray());
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setArray(1, idArray);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.computeIfAbsent(rs.getString("poll_id"), k -> new ArrayList<>())
                        .add(new PollOption(rs.getString("id"), rs.getString("text"), rs.getInt("votes")));
                }
            }
        } finally {
            idArray.free();
        }
        return result;
    }

    // table is one of the two fixed relation tables, never caller input
    private Map<String, List<User>> loadReactors(String table, Collection<String> pollIds) throws SQLException {
        String sql = "SELECT r.poll_id, u.id, u.email, u.full_name, u.is_admin, u.created_at"
            + " FROM " + table + " r JOIN users u ON u.id = r.user_id"
            + " WHERE r.poll_id = ANY(?)"
            + " ORDER BY r.poll_id, r.created_at, u.id";
        Map<String, List<User>> result = new LinkedHashMap<>();
        Array idArray = conn.createArrayOf("varchar", pollIds.toArray());
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setArray(1, idArray);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.computeIfAbsent(rs.getString("poll_id"), k -> new ArrayList<>())
                        .add(PostgresUserRepository.mapUser(rs));
                }
            }
        } finally {
            idArray.free();
        }
        return result;
    }

    private static PollRow mapPollRow(ResultSet rs) throws SQLException {
        String createdBy = rs.getString("created_by");
        User creator = null;
        if (createdBy != null && rs.getString("creator_email") != null) {
            creator = new User(
                createdBy,
                rs.getString("creator_email"),
                rs.getString("creator_full_name"),
                rs.getBoolean("creator_is_admin"),
                toInstant(rs.getTimestamp("creator_created_at"))
            );
        }
        return new PollRow(
            rs.getString("id"),
            rs.getString("title"),
            rs.getString("description"),
            toInstant(rs.getTimestamp("poll_expires_at")),
            rs.getInt("likes"),
            rs.getInt("dislikes"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")),
            createdBy,
            creator
        );
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private record PollRow(
        String id,
        String title,
        String description,
        Instant pollExpiresAt,
        int likes,
        int dislikes,
        Instant createdAt,
        Instant updatedAt,
        String createdBy,
        User creator
    ) {}
}
