package in.pollwall.infrastructure.persistence;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.pollwall.auth.AuthService;
import in.pollwall.auth.JwtService;
import in.pollwall.domain.event.PollEvent;
import in.pollwall.domain.event.PollEventType;
import in.pollwall.domain.poll.NewPoll;
import in.pollwall.domain.poll.PageRequest;
import in.pollwall.domain.poll.Poll;
import in.pollwall.domain.poll.PollSort;
import in.pollwall.domain.user.User;
import in.pollwall.infrastructure.metrics.PrometheusPollMetrics;
import in.pollwall.migration.SchemaMigration;
import in.pollwall.service.CounterSync;
import in.pollwall.service.PollAggregateService;
import in.pollwall.service.event.PollEventBus;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Counter consistency against a real Postgres: row locks, unique constraints and
 * cascades behave as the services expect.
 */
@Testcontainers(disabledWithoutDocker = true)
class CounterSyncPostgresTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES =
        new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
            .withDatabaseName("pollwall")
            .withUsername("test")
            .withPassword("test");

    private static HikariDataSource dataSource;

    private PollEventBus bus;
    private PollAggregateService pollService;
    private AuthService authService;

    @BeforeAll
    static void startPool() {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(POSTGRES.getJdbcUrl());
        hikari.setUsername(POSTGRES.getUsername());
        hikari.setPassword(POSTGRES.getPassword());
        hikari.setMaximumPoolSize(16);
        hikari.setPoolName("pollwall-test");
        dataSource = new HikariDataSource(hikari);
        new SchemaMigration(dataSource).migrate();
    }

    @AfterAll
    static void closePool() {
        if (dataSource != null) {
            dataSource.close();
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("TRUNCATE poll_votes, poll_likes, poll_dislikes, poll_options, polls, users CASCADE");
        }
        PrometheusPollMetrics metrics = new PrometheusPollMetrics(new CollectorRegistry());
        JdbcTransactor transactor = new JdbcTransactor(dataSource, metrics, 5,
            Duration.ofSeconds(5), Duration.ofMillis(10));
        bus = new PollEventBus(1000, metrics);
        pollService = new PollAggregateService(transactor, new CounterSync(), bus, metrics);
        authService = new AuthService(transactor,
            new JwtService("integration-test-secret-0123456789", Duration.ofMinutes(30)));
    }

    @Test
    void firstRegisteredUserIsAdmin() {
        User first = authService.register("First@Example.com", "secret1", "First");
        User second = authService.register("second@example.com", "secret2", null);

        assertTrue(first.isAdmin(), "First account should be admin");
        assertFalse(second.isAdmin(), "Later accounts should not be admin");
        assertEquals("first@example.com", first.email(), "Email should be normalized");
    }

    @Test
    void voteLikeDislikeScenario() {
        User alice = authService.register("alice@example.com", "secret1", "Alice");
        User bob = authService.register("bob@example.com", "secret2", "Bob");
        Poll poll = pollService.createPoll(alice.id(),
            new NewPoll("Lunch?", null, null, List.of("A", "B")));
        String a = poll.options().get(0).id();
        String b = poll.options().get(1).id();

        pollService.castVote(alice.id(), poll.id(), a);
        Poll afterTwo = pollService.castVote(bob.id(), poll.id(), a);
        assertEquals(2, afterTwo.option(a).orElseThrow().votes());
        assertEquals(0, afterTwo.option(b).orElseThrow().votes());

        Poll afterRevote = pollService.castVote(bob.id(), poll.id(), b);
        assertEquals(1, afterRevote.option(a).orElseThrow().votes());
        assertEquals(1, afterRevote.option(b).orElseThrow().votes());
        assertEquals(b, afterRevote.myVoteOptionId());

        Poll liked = pollService.likePoll(poll.id(), alice.id());
        assertEquals(1, liked.likes());
        assertEquals(List.of(alice.id()), liked.likedBy().stream().map(User::id).toList());

        Poll disliked = pollService.dislikePoll(poll.id(), alice.id());
        assertEquals(0, disliked.likes());
        assertEquals(1, disliked.dislikes());
        assertTrue(disliked.likedBy().isEmpty(), "User must not be in both relations");

        assertEquals(a, pollService.getPoll(poll.id(), alice.id()).myVoteOptionId());
        assertNull(pollService.getPoll(poll.id(), null).myVoteOptionId());
    }

    @Test
    void sameOptionRevoteKeepsOneFactRow() throws Exception {
        User alice = authService.register("alice@example.com", "secret1", "Alice");
        Poll poll = pollService.createPoll(alice.id(),
            new NewPoll("Color?", null, null, List.of("Red", "Blue")));
        String red = poll.options().get(0).id();

        pollService.castVote(alice.id(), poll.id(), red);
        Poll again = pollService.castVote(alice.id(), poll.id(), red);

        assertEquals(1, again.option(red).orElseThrow().votes());
        assertEquals(1, countRows("SELECT COUNT(*) FROM poll_votes WHERE poll_id = ?", poll.id()));
    }

    @Test
    void concurrentReactionsDoNotDrift() throws Exception {
        User owner = authService.register("owner@example.com", "secret0", "Owner");
        Poll poll = pollService.createPoll(owner.id(),
            new NewPoll("Tabs or spaces?", null, null, List.of("Tabs", "Spaces")));

        int users = 12;
        List<User> voters = new ArrayList<>();
        for (int i = 0; i < users; i++) {
            voters.add(authService.register("user" + i + "@example.com", "secret" + i, null));
        }

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < users; i++) {
            User voter = voters.get(i);
            boolean likeLast = i % 2 == 0;
            futures.add(pool.submit(() -> {
                start.await();
                // Flip twice so the final state depends on ordering within one user only
                pollService.likePoll(poll.id(), voter.id());
                pollService.dislikePoll(poll.id(), voter.id());
                if (likeLast) {
                    pollService.likePoll(poll.id(), voter.id());
                }
                pollService.castVote(voter.id(), poll.id(), poll.options().get(likeLast ? 0 : 1).id());
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        Poll finalState = pollService.getPoll(poll.id(), null);
        assertEquals(users / 2, finalState.likes());
        assertEquals(users / 2, finalState.dislikes());
        assertEquals(countRows("SELECT COUNT(*) FROM poll_likes WHERE poll_id = ?", poll.id()), finalState.likes());
        assertEquals(countRows("SELECT COUNT(*) FROM poll_dislikes WHERE poll_id = ?", poll.id()), finalState.dislikes());
        assertEquals(0, countRows("""
            SELECT COUNT(*) FROM poll_likes l
            JOIN poll_dislikes d ON d.user_id = l.user_id AND d.poll_id = l.poll_id
            WHERE l.poll_id = ?
            """, poll.id()));
        assertEquals(users / 2, finalState.options().get(0).votes());
        assertEquals(users / 2, finalState.options().get(1).votes());
    }

    @Test
    void listOrdersByLikesAndDeleteCascades() throws Exception {
        User alice = authService.register("alice@example.com", "secret1", "Alice");
        User bob = authService.register("bob@example.com", "secret2", "Bob");
        Poll quiet = pollService.createPoll(alice.id(), new NewPoll("Quiet", null, null, List.of("x", "y")));
        Poll popular = pollService.createPoll(bob.id(), new NewPoll("Popular", null, null, List.of("x", "y")));
        pollService.likePoll(popular.id(), alice.id());

        List<Poll> byLikes = pollService.listPolls(new PageRequest(PollSort.LIKES, 10, 0), null);
        assertEquals(List.of(popular.id(), quiet.id()), byLikes.stream().map(Poll::id).toList());
        assertEquals(List.of(quiet.id()),
            pollService.listPollsByUser(alice.id(), PageRequest.firstPage()).stream().map(Poll::id).toList());

        PollEventBus.Subscription subscription = bus.subscribe();
        pollService.deletePoll(popular.id(), alice.id(), true);

        PollEvent event = subscription.poll(Duration.ofSeconds(1));
        assertNotNull(event);
        assertEquals(PollEventType.POLL_DELETED, event.type());
        assertEquals(0, countRows("SELECT COUNT(*) FROM poll_likes WHERE poll_id = ?", popular.id()));
        assertEquals(0, countRows("SELECT COUNT(*) FROM poll_options WHERE poll_id = ?", popular.id()));
        subscription.close();
    }

    private static int countRows(String sql, String pollId) throws Exception {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, pollId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }
}
