package in.pollwall.transport.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.pollwall.auth.AuthService;
import in.pollwall.domain.error.InvalidRequestException;
import in.pollwall.domain.user.User;
import in.pollwall.service.PollAggregateService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;

import static in.pollwall.transport.http.HttpSupport.authorization;
import static in.pollwall.transport.http.HttpSupport.readBody;
import static in.pollwall.transport.http.HttpSupport.respond;
import static in.pollwall.transport.http.HttpSupport.sendJson;

/**
 * HTTP handler for /api/votes.
 */
public final class VoteHandlers {

    private final PollAggregateService pollService;
    private final AuthService authService;

    public VoteHandlers(PollAggregateService pollService, AuthService authService) {
        this.pollService = pollService;
        this.authService = authService;
    }

    /**
     * POST /api/votes - cast or move the caller's vote; answers with the updated poll
     */
    public void cast(HttpServerExchange exchange) {
        respond(exchange, () -> {
            User user = authService.authenticate(authorization(exchange));
            VoteRequest request = readBody(exchange, VoteRequest.class);
            if (request.pollId() == null || request.pollId().isBlank()) {
                throw new InvalidRequestException("poll_id is required");
            }
            sendJson(exchange, StatusCodes.CREATED,
                pollService.castVote(user.id(), request.pollId(), request.optionId()));
        });
    }

    record VoteRequest(
        @JsonProperty("poll_id") String pollId,
        @JsonProperty("option_id") String optionId
    ) {}
}
