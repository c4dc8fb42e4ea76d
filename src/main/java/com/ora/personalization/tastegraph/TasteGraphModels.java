package com.ora.personalization.tastegraph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class TasteGraphModels {
    public static final int SCHEMA_VERSION = 1;

    public enum AffinitySource {
        EXPLICIT_FOLLOW("explicitFollow"),
        INFERRED_FROM_SAVES("inferredFromSaves"),
        INFERRED_FROM_VIEWS("inferredFromViews"),
        INFERRED_FROM_SEARCH("inferredFromSearch"),
        INFERRED_FROM_CREATES("inferredFromCreates");

        private final String wireName;

        AffinitySource(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        public boolean explicit() {
            return this == EXPLICIT_FOLLOW;
        }

        @JsonCreator
        public static AffinitySource fromWire(String value) {
            return Arrays.stream(values())
                    .filter(s -> s.wireName.equals(value) || s.name().equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown affinity source: " + value));
        }
    }

    public record InterestAffinity(String interestId,
                                   double score,
                                   AffinitySource source,
                                   int engagementCount,
                                   Instant firstEngagement,
                                   Instant lastEngagement,
                                   double decayFactor) {
        public InterestAffinity {
            score = clamp(score);
        }

        /** {@code score * exp(-decayFactor * days)}; engagements in the future count as zero days old. */
        public double decayedScore(Instant asOf) {
            double days = Math.max(0.0, elapsedSeconds(lastEngagement, asOf) / 86_400.0);
            return clamp(score * Math.exp(-decayFactor * days));
        }
    }

    /** One affinity per interest, kept in interest id order. */
    public record TasteGraph(String userId, List<InterestAffinity> interests, Instant lastUpdated, int version) {
        public TasteGraph {
            interests = interests == null ? List.of() : interests.stream()
                    .sorted(Comparator.comparing(InterestAffinity::interestId))
                    .toList();
        }

        public static TasteGraph empty(String userId) {
            return new TasteGraph(userId, List.of(), null, SCHEMA_VERSION);
        }

        public static TasteGraph of(String userId, List<InterestAffinity> affinities, Instant lastUpdated, int version) {
            return new TasteGraph(userId, affinities, lastUpdated, version);
        }

        @JsonIgnore
        public boolean isEmpty() {
            return interests.isEmpty();
        }

        public Optional<InterestAffinity> affinity(String interestId) {
            return interests.stream().filter(a -> a.interestId().equals(interestId)).findFirst();
        }

        public List<ScoredAffinity> topInterests(int count, Instant asOf) {
            return interests.stream()
                    .map(a -> new ScoredAffinity(a, a.decayedScore(asOf)))
                    .sorted(Comparator.comparingDouble(ScoredAffinity::decayedScore).reversed()
                            .thenComparing(s -> s.affinity().interestId()))
                    .limit(Math.max(0, count))
                    .toList();
        }
    }

    /** An affinity paired with its decayed score at a given instant. */
    public record ScoredAffinity(InterestAffinity affinity, double decayedScore) {
        public String interestId() {
            return affinity.interestId();
        }
    }

    public record EngagementRequest(String interestId, AffinitySource source, Double weight) {}

    public record InterestSuggestion(String interestId, String displayName, double score, String reason) {}

    /** Seconds from {@code from} to {@code to}; never overflows for far-apart instants. */
    public static double elapsedSeconds(Instant from, Instant to) {
        Duration gap = Duration.between(from, to);
        return gap.getSeconds() + gap.getNano() / 1_000_000_000.0;
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
