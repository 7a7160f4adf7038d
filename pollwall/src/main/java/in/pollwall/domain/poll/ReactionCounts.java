package in.pollwall.domain.poll;

/**
 * Like and dislike totals recomputed from the relation tables.
 */
public record ReactionCounts(int likes, int dislikes) {}
