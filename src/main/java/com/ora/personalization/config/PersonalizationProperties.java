package com.ora.personalization.config;

import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for the personalization core. Every record falls back to its documented
 * default when a property is absent, so the records can also be built directly.
 */
@Configuration
@EnableConfigurationProperties({
        PersonalizationProperties.TaxonomySettings.class,
        PersonalizationProperties.TasteGraphSettings.class,
        PersonalizationProperties.ClassificationSettings.class,
        PersonalizationProperties.RankingSettings.class
})
public class PersonalizationProperties {

    @ConfigurationProperties("personalization.taxonomy")
    public record TaxonomySettings(Integer maxDepth, Duration cacheRefresh) {
        public TaxonomySettings {
            maxDepth = maxDepth == null ? 8 : maxDepth;
            cacheRefresh = cacheRefresh == null ? Duration.ofMinutes(10) : cacheRefresh;
        }

        public static TaxonomySettings defaults() {
            return new TaxonomySettings(null, null);
        }
    }

    @ConfigurationProperties("personalization.taste-graph")
    public record TasteGraphSettings(Integer topInterestCount,
                                     Double initialScoreFactor,
                                     Double reinforcementRate,
                                     Double followDecayFactor,
                                     Double inferredDecayFactor) {
        public TasteGraphSettings {
            topInterestCount = topInterestCount == null ? 20 : topInterestCount;
            initialScoreFactor = initialScoreFactor == null ? 0.5 : initialScoreFactor;
            reinforcementRate = reinforcementRate == null ? 0.1 : reinforcementRate;
            followDecayFactor = followDecayFactor == null ? 0.005 : followDecayFactor;
            inferredDecayFactor = inferredDecayFactor == null ? 0.01 : inferredDecayFactor;
        }

        public static TasteGraphSettings defaults() {
            return new TasteGraphSettings(null, null, null, null, null);
        }
    }

    @ConfigurationProperties("personalization.classification")
    public record ClassificationSettings(String version,
                                         Double minConfidence,
                                         Integer maxClassifications,
                                         Integer maxCandidates,
                                         Double levelBoost,
                                         Double similarPostThreshold,
                                         Integer similarPostSample,
                                         Integer minBehaviorUsers,
                                         List<String> metadataTextKeys,
                                         Map<ClassificationSignal, Double> signalWeights) {
        public ClassificationSettings {
            version = version == null || version.isBlank() ? "1.0" : version;
            minConfidence = minConfidence == null ? 0.4 : minConfidence;
            maxClassifications = maxClassifications == null ? 5 : maxClassifications;
            maxCandidates = maxCandidates == null ? 50 : maxCandidates;
            levelBoost = levelBoost == null ? 0.02 : levelBoost;
            similarPostThreshold = similarPostThreshold == null ? 0.3 : similarPostThreshold;
            similarPostSample = similarPostSample == null ? 200 : similarPostSample;
            minBehaviorUsers = minBehaviorUsers == null ? 3 : minBehaviorUsers;
            metadataTextKeys = metadataTextKeys == null ? List.of("location", "altText") : List.copyOf(metadataTextKeys);
            Map<ClassificationSignal, Double> weights = new EnumMap<>(ClassificationSignal.class);
            for (ClassificationSignal signal : ClassificationSignal.values()) {
                weights.put(signal, signal.defaultWeight());
            }
            if (signalWeights != null) weights.putAll(signalWeights);
            signalWeights = Map.copyOf(weights);
        }

        public double weightOf(ClassificationSignal signal) {
            return signalWeights.getOrDefault(signal, signal.defaultWeight());
        }

        public static ClassificationSettings defaults() {
            return new ClassificationSettings(null, null, null, null, null, null, null, null, null, null);
        }
    }

    @ConfigurationProperties("personalization.ranking")
    public record RankingSettings(Double interestWeight,
                                  Double contentWeight,
                                  Double creatorWeight,
                                  Double freshnessWeight,
                                  Double maxEngagementRate,
                                  Double freshnessDecayPerHour,
                                  Integer diversityWindow,
                                  Integer parallelThreshold,
                                  Integer chunkSize,
                                  Duration tasteGraphTimeout) {
        public RankingSettings {
            interestWeight = interestWeight == null ? 0.40 : interestWeight;
            contentWeight = contentWeight == null ? 0.30 : contentWeight;
            creatorWeight = creatorWeight == null ? 0.15 : creatorWeight;
            freshnessWeight = freshnessWeight == null ? 0.15 : freshnessWeight;
            maxEngagementRate = maxEngagementRate == null ? 0.1 : maxEngagementRate;
            freshnessDecayPerHour = freshnessDecayPerHour == null ? 0.03 : freshnessDecayPerHour;
            diversityWindow = diversityWindow == null ? 3 : diversityWindow;
            parallelThreshold = parallelThreshold == null ? 64 : parallelThreshold;
            chunkSize = chunkSize == null ? 32 : chunkSize;
            tasteGraphTimeout = tasteGraphTimeout == null ? Duration.ofMillis(500) : tasteGraphTimeout;

            double sum = interestWeight + contentWeight + creatorWeight + freshnessWeight;
            if (Math.abs(sum - 1.0) > 1e-6) {
                throw new IllegalStateException("Ranking weights must sum to 1.0 but sum to " + sum);
            }
            if (maxEngagementRate <= 0) {
                throw new IllegalStateException("max-engagement-rate must be positive");
            }
        }

        public static RankingSettings defaults() {
            return new RankingSettings(null, null, null, null, null, null, null, null, null, null);
        }
    }
}
