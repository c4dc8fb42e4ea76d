package com.ora.personalization.classification;

import com.ora.personalization.classification.ClassificationModels.Classification;
import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import com.ora.personalization.classification.ClassificationModels.InterestCandidate;
import com.ora.personalization.config.PersonalizationProperties.ClassificationSettings;
import com.ora.personalization.taxonomy.TaxonomyModels.Interest;
import com.ora.personalization.taxonomy.TaxonomyModels.TaxonomySnapshot;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Merges candidates per interest with a noisy-or: {@code 1 - Π(1 - matchScore * signalWeight)},
 * keeping only the strongest candidate of each signal, then adds {@code levelBoost * level}
 * so specific interests edge out their ancestors.
 */
@Component
public class ConfidenceAggregator {
    private final ClassificationSettings settings;

    public ConfidenceAggregator(ClassificationSettings settings) {
        this.settings = settings;
    }

    public List<Classification> aggregate(List<InterestCandidate> candidates, TaxonomySnapshot taxonomy) {
        Map<String, Map<ClassificationSignal, Double>> strongest = new HashMap<>();
        for (InterestCandidate c : candidates) {
            if (taxonomy.get(c.interestId()) == null) continue;
            strongest.computeIfAbsent(c.interestId(), k -> new EnumMap<>(ClassificationSignal.class))
                    .merge(c.signal(), clamp(c.matchScore()), Math::max);
        }

        List<String> considered = strongest.entrySet().stream()
                .sorted(Comparator.comparingDouble((Map.Entry<String, Map<ClassificationSignal, Double>> e) -> bestEvidence(e.getValue())).reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(settings.maxCandidates())
                .map(Map.Entry::getKey)
                .toList();

        return considered.stream()
                .map(interestId -> toClassification(taxonomy.get(interestId), strongest.get(interestId)))
                .filter(c -> c.confidence() >= settings.minConfidence())
                .sorted(Comparator.comparingDouble(Classification::confidence).reversed().thenComparing(Classification::interestId))
                .limit(settings.maxClassifications())
                .toList();
    }

    double confidence(Map<ClassificationSignal, Double> scores, int level) {
        double miss = 1.0;
        for (Map.Entry<ClassificationSignal, Double> e : scores.entrySet()) {
            miss *= 1.0 - clamp(e.getValue() * settings.weightOf(e.getKey()));
        }
        return clamp(1.0 - miss + settings.levelBoost() * level);
    }

    private Classification toClassification(Interest interest, Map<ClassificationSignal, Double> scores) {
        return new Classification(interest.id(), interest.name(), interest.level(),
                confidence(scores, interest.level()), scores.keySet().stream().collect(Collectors.toList()));
    }

    private double bestEvidence(Map<ClassificationSignal, Double> scores) {
        return scores.entrySet().stream().mapToDouble(e -> e.getValue() * settings.weightOf(e.getKey())).max().orElse(0.0);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
