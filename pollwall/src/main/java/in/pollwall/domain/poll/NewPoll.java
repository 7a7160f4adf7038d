package in.pollwall.domain.poll;

import in.pollwall.domain.error.InvalidRequestException;

import java.time.Instant;
import java.util.List;

/**
 * Input for poll creation.
 */
public record NewPoll(
    String title,
    String description,
    Instant pollExpiresAt,
    List<String> optionTexts
) {
    public static final int MIN_OPTIONS = 2;

    public NewPoll {
        if (title == null || title.isBlank()) {
            throw new InvalidRequestException("title is required");
        }
        if (optionTexts == null || optionTexts.size() < MIN_OPTIONS) {
            throw new InvalidRequestException("a poll needs at least " + MIN_OPTIONS + " options");
        }
        for (String text : optionTexts) {
            if (text == null || text.isBlank()) {
                throw new InvalidRequestException("option text must not be blank");
            }
        }
        title = title.trim();
        optionTexts = optionTexts.stream().map(String::trim).toList();
    }
}
