package com.ora.personalization.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Records owned by the surrounding content pipeline. The personalization core reads
 * them but never decides their lifecycle.
 */
public class DomainModels {
    public record PostRecord(String id,
                             String userId,
                             String caption,
                             List<String> tags,
                             List<String> boardNames,
                             List<String> selectedInterestIds,
                             Map<String, MetadataValue> metadata,
                             String username,
                             String profilePhotoUrl,
                             Instant createdAt,
                             long likeCount,
                             long commentCount,
                             long saveCount,
                             long shareCount,
                             long viewCount) {
        public PostRecord {
            tags = tags == null ? List.of() : List.copyOf(tags);
            boardNames = boardNames == null ? List.of() : List.copyOf(boardNames);
            selectedInterestIds = selectedInterestIds == null ? List.of() : List.copyOf(selectedInterestIds);
            metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        }
    }

    public record PostEngagement(String postId, String userId, String kind, Instant ts) {}

    public enum MetadataKind { STRING, NUMBER, BOOLEAN }

    /**
     * One scalar of free-form post metadata. Exactly one of {@code text}, {@code number},
     * {@code flag} is set, matching {@code kind}.
     */
    public record MetadataValue(MetadataKind kind, String text, Double number, Boolean flag) {
        public MetadataValue {
            if (kind == null) throw new IllegalArgumentException("Metadata kind is required");
            boolean consistent = switch (kind) {
                case STRING -> text != null && number == null && flag == null;
                case NUMBER -> number != null && text == null && flag == null;
                case BOOLEAN -> flag != null && text == null && number == null;
            };
            if (!consistent) throw new IllegalArgumentException("Metadata value does not match kind " + kind);
        }

        public static MetadataValue ofText(String text) {
            return new MetadataValue(MetadataKind.STRING, text, null, null);
        }

        public static MetadataValue ofNumber(double number) {
            return new MetadataValue(MetadataKind.NUMBER, null, number, null);
        }

        public static MetadataValue ofFlag(boolean flag) {
            return new MetadataValue(MetadataKind.BOOLEAN, null, null, flag);
        }

        public String asText() {
            return switch (kind) {
                case STRING -> text;
                case NUMBER -> String.valueOf(number);
                case BOOLEAN -> String.valueOf(flag);
            };
        }
    }
}
