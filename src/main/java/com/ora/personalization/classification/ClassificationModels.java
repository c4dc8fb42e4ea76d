package com.ora.personalization.classification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ora.personalization.domain.DomainModels.MetadataValue;
import com.ora.personalization.domain.DomainModels.PostRecord;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ClassificationModels {
    public enum ClassificationSignal {
        USER_TAGGED("userTagged", 1.0, true),
        CAPTION_MATCH("captionMatch", 0.75, true),
        TAG_MATCH("tagMatch", 0.9, true),
        BOARD_NAME("boardName", 0.7, true),
        SIMILAR_POSTS("similarPosts", 0.6, true),
        USER_BEHAVIOR("userBehavior", 0.5, true),
        VISUAL_SIMILARITY("visualSimilarity", 0.5, false),
        TF_IDF("tfIdf", 0.5, false);

        private final String wireName;
        private final double defaultWeight;
        private final boolean implemented;

        ClassificationSignal(String wireName, double defaultWeight, boolean implemented) {
            this.wireName = wireName;
            this.defaultWeight = defaultWeight;
            this.implemented = implemented;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        public double defaultWeight() {
            return defaultWeight;
        }

        public boolean implemented() {
            return implemented;
        }

        @JsonCreator
        public static ClassificationSignal fromWire(String value) {
            return Arrays.stream(values())
                    .filter(s -> s.wireName.equals(value) || s.name().equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown classification signal: " + value));
        }
    }

    /** One piece of evidence that a post belongs to an interest. */
    public record InterestCandidate(String interestId, ClassificationSignal signal, double matchScore, String evidence) {}

    public record Classification(String interestId,
                                 String interestName,
                                 int interestLevel,
                                 double confidence,
                                 List<ClassificationSignal> signals) {
        public Classification {
            signals = signals == null ? List.of() : signals.stream().distinct().sorted().toList();
        }
    }

    public record PostInterestClassification(String postId,
                                             List<Classification> classifications,
                                             Instant classifiedAt,
                                             String version) {
        public PostInterestClassification {
            classifications = classifications == null ? List.of() : List.copyOf(classifications);
        }

        public Optional<Classification> primary() {
            return classifications.stream()
                    .max(Comparator.comparingDouble(Classification::confidence)
                            .thenComparing(Classification::interestId, Comparator.reverseOrder()));
        }
    }

    /** Raw inputs the signal generators look at. {@code postId} is null for ad-hoc suggestions. */
    public record PostSignals(String postId,
                              String authorId,
                              String caption,
                              List<String> tags,
                              List<String> boardNames,
                              List<String> selectedInterestIds,
                              Map<String, MetadataValue> metadata) {
        public PostSignals {
            tags = tags == null ? List.of() : List.copyOf(tags);
            boardNames = boardNames == null ? List.of() : List.copyOf(boardNames);
            selectedInterestIds = selectedInterestIds == null ? List.of() : List.copyOf(selectedInterestIds);
            metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        }

        public static PostSignals of(PostRecord post) {
            return new PostSignals(post.id(), post.userId(), post.caption(), post.tags(), post.boardNames(),
                    post.selectedInterestIds(), post.metadata());
        }
    }

    /** A signal generator that threw; the remaining signals still classify the post. */
    public record ClassificationPartialFailure(ClassificationSignal signal, String message) {}

    public record ClassificationOutcome(PostInterestClassification classification, List<ClassificationPartialFailure> failures) {
        public ClassificationOutcome {
            failures = failures == null ? List.of() : List.copyOf(failures);
        }

        public boolean partial() {
            return !failures.isEmpty();
        }
    }

    public enum BatchFilter { UNCLASSIFIED_ONLY, ALL }

    public record BatchRequest(Integer limit, BatchFilter filter, String afterPostId) {}

    public record BatchResult(int processed, int classified, int failed, List<String> failedPostIds, String nextCursor) {}

    public record SuggestRequest(String caption, List<String> tags, String boardName) {}
}
