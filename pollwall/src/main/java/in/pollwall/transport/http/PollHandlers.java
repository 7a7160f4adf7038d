package in.pollwall.transport.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.pollwall.auth.AuthService;
import in.pollwall.domain.error.InvalidRequestException;
import in.pollwall.domain.poll.NewPoll;
import in.pollwall.domain.poll.PageRequest;
import in.pollwall.domain.poll.Poll;
import in.pollwall.domain.poll.PollSort;
import in.pollwall.domain.user.User;
import in.pollwall.service.PollAggregateService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;

import java.time.Instant;
import java.util.List;

import static in.pollwall.transport.http.HttpSupport.authorization;
import static in.pollwall.transport.http.HttpSupport.pathParam;
import static in.pollwall.transport.http.HttpSupport.readBody;
import static in.pollwall.transport.http.HttpSupport.readBodyOrDefault;
import static in.pollwall.transport.http.HttpSupport.respond;
import static in.pollwall.transport.http.HttpSupport.sendJson;
import static in.pollwall.transport.http.HttpSupport.sendNoContent;

/**
 * HTTP handlers for /api/polls.
 */
public final class PollHandlers {

    private final PollAggregateService pollService;
    private final AuthService authService;

    public PollHandlers(PollAggregateService pollService, AuthService authService) {
        this.pollService = pollService;
        this.authService = authService;
    }

    /**
     * POST /api/polls
     */
    public void create(HttpServerExchange exchange) {
        respond(exchange, () -> {
            User user = authService.authenticate(authorization(exchange));
            CreatePollRequest request = readBody(exchange, CreatePollRequest.class);
            Poll poll = pollService.createPoll(user.id(), request.toNewPoll());
            sendJson(exchange, StatusCodes.CREATED, poll);
        });
    }

    /**
     * GET /api/polls/{pollId}
     */
    public void get(HttpServerExchange exchange) {
        respond(exchange, () -> {
            String viewerId = authService.authenticateOptional(authorization(exchange)).map(User::id).orElse(null);
            sendJson(exchange, StatusCodes.OK, pollService.getPoll(pathParam(exchange, "pollId"), viewerId));
        });
    }

    /**
     * POST /api/polls/list - all polls, enriched with the caller's vote when authenticated
     */
    public void list(HttpServerExchange exchange) {
        respond(exchange, () -> {
            String viewerId = authService.authenticateOptional(authorization(exchange)).map(User::id).orElse(null);
            ListPollsRequest request = readBodyOrDefault(exchange, ListPollsRequest.class, ListPollsRequest.DEFAULT);
            sendJson(exchange, StatusCodes.OK, pollService.listPolls(request.toPage(), viewerId));
        });
    }

    /**
     * POST /api/polls/mine - polls created by the caller
     */
    public void mine(HttpServerExchange exchange) {
        respond(exchange, () -> {
            User user = authService.authenticate(authorization(exchange));
            ListPollsRequest request = readBodyOrDefault(exchange, ListPollsRequest.class, ListPollsRequest.DEFAULT);
            sendJson(exchange, StatusCodes.OK, pollService.listPollsByUser(user.id(), request.toPage()));
        });
    }

    /**
     * POST /api/polls/{pollId}/like
     */
    public void like(HttpServerExchange exchange) {
        respond(exchange, () -> {
            User user = authService.authenticate(authorization(exchange));
            sendJson(exchange, StatusCodes.OK, pollService.likePoll(pathParam(exchange, "pollId"), user.id()));
        });
    }

    /**
     * POST /api/polls/{pollId}/dislike
     */
    public void dislike(HttpServerExchange exchange) {
        respond(exchange, () -> {
            User user = authService.authenticate(authorization(exchange));
            sendJson(exchange, StatusCodes.OK, pollService.dislikePoll(pathParam(exchange, "pollId"), user.id()));
        });
    }

    /**
     * DELETE /api/polls/{pollId} - creator or admin only
     */
    public void delete(HttpServerExchange exchange) {
        respond(exchange, () -> {
            User user = authService.authenticate(authorization(exchange));
            pollService.deletePoll(pathParam(exchange, "pollId"), user.id(), user.isAdmin());
            sendNoContent(exchange);
        });
    }

    record OptionInput(String text) {}

    record CreatePollRequest(
        String title,
        String description,
        @JsonProperty("poll_expires_at") Instant pollExpiresAt,
        List<OptionInput> options
    ) {
        NewPoll toNewPoll() {
            if (options == null) {
                throw new InvalidRequestException("options are required");
            }
            return new NewPoll(title, description, pollExpiresAt, options.stream()
                .map(o -> o == null ? null : o.text())
                .toList());
        }
    }

    record ListPollsRequest(
        @JsonProperty("sort_by") String sortBy,
        Integer limit,
        Integer offset
    ) {
        static final ListPollsRequest DEFAULT = new ListPollsRequest(null, null, null);

        PageRequest toPage() {
            return new PageRequest(
                PollSort.fromWire(sortBy),
                limit != null ? limit : PageRequest.DEFAULT_LIMIT,
                offset != null ? offset : 0
            );
        }
    }
}
