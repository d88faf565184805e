package in.vouchguard.domain.defense;

/**
 * Suggested counter-review: the score bucket actually used and one of its messages.
 */
public record DefenseSuggestion(int score, String comment) {}
