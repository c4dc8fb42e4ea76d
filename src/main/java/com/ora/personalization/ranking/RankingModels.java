package com.ora.personalization.ranking;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RankingModels {
    public record InterestScore(String interestId, double confidence) {}

    /** A candidate post as the feed layer hands it over, classifications attached. */
    public record RankablePost(String id,
                               Instant createdAt,
                               long likeCount,
                               long commentCount,
                               long saveCount,
                               long shareCount,
                               long viewCount,
                               String username,
                               String profilePhotoUrl,
                               List<InterestScore> classifications) {
        public RankablePost {
            classifications = classifications == null ? List.of() : List.copyOf(classifications);
        }

        /** Highest-confidence interest; ties go to the smaller interest id. */
        public String primaryInterestId() {
            return classifications.stream()
                    .max(Comparator.comparingDouble(InterestScore::confidence)
                            .thenComparing(InterestScore::interestId, Comparator.reverseOrder()))
                    .map(InterestScore::interestId)
                    .orElse(null);
        }
    }

    public record ScoreBreakdown(double interestRelevance,
                                 double contentQuality,
                                 double creatorQuality,
                                 double freshness,
                                 double composite) {}

    public record ScoredPost(RankablePost post, ScoreBreakdown score) {}

    public enum FallbackReason { NO_USER, NO_CANDIDATES, TASTE_GRAPH_UNAVAILABLE, CLASSIFICATIONS_UNAVAILABLE }

    /**
     * Ordered feed. {@code scores} is keyed by post id and empty when the feed fell back
     * to recency order.
     */
    public record RankedFeed(List<RankablePost> posts,
                             Map<String, ScoreBreakdown> scores,
                             boolean personalized,
                             FallbackReason fallbackReason) {
        public RankedFeed {
            posts = List.copyOf(posts);
            scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        }

        public List<String> postIds() {
            return posts.stream().map(RankablePost::id).toList();
        }

        public static RankedFeed recency(List<RankablePost> posts, FallbackReason reason) {
            return new RankedFeed(posts, Map.of(), false, reason);
        }
    }

    public record RankRequest(String userId, List<RankablePost> posts, Instant asOf) {}

    public record RankStoredRequest(String userId, List<String> postIds, Long timeoutMs) {}
}
