package in.vouchguard.application.defense;

import in.vouchguard.domain.defense.DefenseSuggestion;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Canned counter-review messages grouped by score bucket.
 */
public final class DefenseTemplates {
    public static final int DEFAULT_SCORE = 3;

    private static final Map<Integer, List<String>> BUCKETS = new TreeMap<>(Map.of(
        3, List.of(
            "Trusted and reliable community member. I vouch for their credibility.",
            "Known for integrity and positive contributions to the ecosystem.",
            "Solid reputation backed by consistent positive interactions.",
            "A valued member of the community with proven trustworthiness."
        ),
        2, List.of(
            "Positive experience with this community member.",
            "Reliable and trustworthy in my interactions.",
            "Good standing member of the community."
        )
    ));

    private final Random random;

    public DefenseTemplates() {
        this(new Random());
    }

    public DefenseTemplates(Random random) {
        this.random = random;
    }

    /**
     * Pick a message from the requested bucket, or from the nearest one.
     * Equidistant buckets resolve to the default bucket.
     */
    public DefenseSuggestion suggestDefense(int requestedScore) {
        int bucket = resolveBucket(requestedScore);
        List<String> messages = BUCKETS.get(bucket);
        return new DefenseSuggestion(bucket, messages.get(random.nextInt(messages.size())));
    }

    static int resolveBucket(int requested) {
        if (BUCKETS.containsKey(requested)) {
            return requested;
        }
        int best = DEFAULT_SCORE;
        int bestDistance = Math.abs(requested - DEFAULT_SCORE);
        for (int bucket : BUCKETS.keySet()) {
            int distance = Math.abs(requested - bucket);
            if (distance < bestDistance) {
                best = bucket;
                bestDistance = distance;
            }
        }
        return best;
    }

    public static List<String> messagesFor(int bucket) {
        return BUCKETS.getOrDefault(bucket, List.of());
    }
}
