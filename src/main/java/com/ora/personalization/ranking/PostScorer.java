package com.ora.personalization.ranking;

import com.ora.personalization.config.PersonalizationProperties.RankingSettings;
import com.ora.personalization.ranking.RankingModels.InterestScore;
import com.ora.personalization.ranking.RankingModels.RankablePost;
import com.ora.personalization.ranking.RankingModels.ScoreBreakdown;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The four per-post sub-scores and their weighted blend. Stateless and thread-safe.
 */
public class PostScorer {
    private static final double CREATOR_BASELINE = 0.5;
    private static final double CREATOR_BOOST = 0.1;
    private static final double MEAN_FLOOR = 0.8;

    private final RankingSettings settings;

    public PostScorer(RankingSettings settings) {
        this.settings = settings;
    }

    public ScoreBreakdown score(RankablePost post, Map<String, Double> affinities, Instant asOf) {
        double interest = interestRelevance(post.classifications(), affinities);
        double content = contentQuality(post);
        double creator = creatorQuality(post);
        double fresh = freshness(post.createdAt(), asOf);
        double composite = settings.interestWeight() * interest
                + settings.contentWeight() * content
                + settings.creatorWeight() * creator
                + settings.freshnessWeight() * fresh;
        return new ScoreBreakdown(interest, content, creator, fresh, clamp(composite));
    }

    /** {@code max(best, 0.8 * mean)} over affinity × confidence for interests the user likes. */
    public double interestRelevance(List<InterestScore> classifications, Map<String, Double> affinities) {
        double best = 0.0;
        double sum = 0.0;
        int matches = 0;
        for (InterestScore c : classifications) {
            Double affinity = affinities.get(c.interestId());
            if (affinity == null) continue;
            double v = affinity * c.confidence();
            best = Math.max(best, v);
            sum += v;
            matches++;
        }
        if (matches == 0) return 0.0;
        return clamp(Math.max(best, MEAN_FLOOR * (sum / matches)));
    }

    public double contentQuality(RankablePost post) {
        double weighted = post.likeCount() + 2.0 * post.commentCount() + 3.0 * post.saveCount() + 3.0 * post.shareCount();
        double rate = weighted / Math.max(1, post.viewCount());
        return clamp(Math.min(rate, settings.maxEngagementRate()) / settings.maxEngagementRate());
    }

    public double creatorQuality(RankablePost post) {
        double score = CREATOR_BASELINE;
        if (post.profilePhotoUrl() != null && !post.profilePhotoUrl().isBlank()) score += CREATOR_BOOST;
        if (post.username() != null && post.username().trim().length() > 2) score += CREATOR_BOOST;
        return clamp(score);
    }

    public double freshness(Instant createdAt, Instant asOf) {
        if (createdAt == null) return 0.0;
        double ageHours = Math.max(0.0, Duration.between(createdAt, asOf).getSeconds() / 3_600.0);
        return clamp(Math.exp(-settings.freshnessDecayPerHour() * ageHours));
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
