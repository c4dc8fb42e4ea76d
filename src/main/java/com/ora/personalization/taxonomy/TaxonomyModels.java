package com.ora.personalization.taxonomy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

public class TaxonomyModels {
    public record Interest(String id,
                           String name,
                           String displayName,
                           String parentId,
                           int level,
                           List<String> path,
                           String description,
                           boolean active,
                           int postCount,
                           int followerCount,
                           double weeklyGrowth,
                           double monthlyGrowth,
                           List<String> keywords,
                           List<String> synonyms,
                           List<String> relatedInterestIds,
                           Instant createdAt,
                           Instant updatedAt) {
        public Interest {
            path = path == null ? List.of() : List.copyOf(path);
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
            synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
            relatedInterestIds = relatedInterestIds == null ? List.of() : List.copyOf(relatedInterestIds);
        }

        public boolean isRoot() {
            return parentId == null;
        }

        public Interest withPlacement(String newName, String newParentId, int newLevel, List<String> newPath, Instant now) {
            return new Interest(id, newName, displayName, newParentId, newLevel, newPath, description, active,
                    postCount, followerCount, weeklyGrowth, monthlyGrowth, keywords, synonyms, relatedInterestIds, createdAt, now);
        }

        public Interest withActive(boolean newActive, Instant now) {
            return new Interest(id, name, displayName, parentId, level, path, description, newActive,
                    postCount, followerCount, weeklyGrowth, monthlyGrowth, keywords, synonyms, relatedInterestIds, createdAt, now);
        }

        public Interest withDetails(InterestUpdate update, Instant now) {
            return new Interest(id, name,
                    update.displayName() != null ? update.displayName() : displayName,
                    parentId, level, path,
                    update.description() != null ? update.description() : description,
                    update.active() != null ? update.active() : active,
                    postCount, followerCount, weeklyGrowth, monthlyGrowth,
                    update.keywords() != null ? update.keywords() : keywords,
                    update.synonyms() != null ? update.synonyms() : synonyms,
                    update.relatedInterestIds() != null ? update.relatedInterestIds() : relatedInterestIds,
                    createdAt, now);
        }
    }

    public record CreateInterestRequest(String id,
                                        String parentId,
                                        String name,
                                        String displayName,
                                        String description,
                                        List<String> keywords,
                                        List<String> synonyms,
                                        List<String> relatedInterestIds) {}

    /**
     * Partial update; {@code null} leaves a field unchanged. {@code moveToRoot} detaches the
     * interest from its parent, {@code parentId} moves it under another interest.
     */
    public record InterestUpdate(String name,
                                 String displayName,
                                 String description,
                                 List<String> keywords,
                                 List<String> synonyms,
                                 List<String> relatedInterestIds,
                                 Boolean active,
                                 String parentId,
                                 Boolean moveToRoot) {
        public static InterestUpdate moveUnder(String parentId) {
            return new InterestUpdate(null, null, null, null, null, null, null, parentId, null);
        }

        public static InterestUpdate moveToRootLevel() {
            return new InterestUpdate(null, null, null, null, null, null, null, null, true);
        }
    }

    public enum TreeScope { ROOTS, FULL }

    public record InterestTreeNode(Interest interest, List<InterestTreeNode> children) {}

    public record StatsRecount(String interestId,
                               int oldCount,
                               int newCount,
                               int followerCount,
                               double weeklyGrowth,
                               double monthlyGrowth) {}

    public record SeedResult(int created, int skipped) {}

    /** Immutable view of the active taxonomy, rebuilt by the taxonomy cache. */
    public record TaxonomySnapshot(Map<String, Interest> byId, Map<String, List<Interest>> childrenByParent) {
        private static final String ROOT = "";

        public static TaxonomySnapshot of(Collection<Interest> interests) {
            List<Interest> active = interests.stream().filter(Interest::active).toList();
            Map<String, Interest> byId = active.stream()
                    .collect(Collectors.toUnmodifiableMap(Interest::id, Function.identity()));
            Map<String, List<Interest>> children = active.stream()
                    .sorted(Comparator.comparing(Interest::name).thenComparing(Interest::id))
                    .collect(Collectors.groupingBy(i -> i.parentId() == null ? ROOT : i.parentId(),
                            Collectors.collectingAndThen(Collectors.toList(), List::copyOf)));
            return new TaxonomySnapshot(byId, Map.copyOf(children));
        }

        public List<Interest> roots() {
            return childrenByParent.getOrDefault(ROOT, List.of());
        }

        public List<Interest> childrenOf(String parentId) {
            return childrenByParent.getOrDefault(parentId == null ? ROOT : parentId, List.of());
        }

        public List<Interest> all() {
            List<Interest> out = new ArrayList<>(byId.values());
            out.sort(Comparator.comparing(Interest::id));
            return out;
        }

        public Interest get(String id) {
            return id == null ? null : byId.get(id);
        }
    }
}
