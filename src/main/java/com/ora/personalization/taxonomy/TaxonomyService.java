package com.ora.personalization.taxonomy;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.ora.personalization.config.PersonalizationProperties.TaxonomySettings;
import com.ora.personalization.error.InvalidParentException;
import com.ora.personalization.error.NotFoundException;
import com.ora.personalization.error.TaxonomyValidationException;
import com.ora.personalization.repository.InterestJdbcRepository;
import com.ora.personalization.support.KeyedLocks;
import com.ora.personalization.taxonomy.TaxonomyModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Service
public class TaxonomyService {
    private static final Logger log = LoggerFactory.getLogger(TaxonomyService.class);
    private static final String SNAPSHOT_KEY = "active";
    private static final String STRUCTURE_LOCK = "taxonomy:structure";
    private static final int MAX_ID_LENGTH = 64;
    private static final int MAX_NAME_LENGTH = 128;
    private static final int MAX_DISPLAY_NAME_LENGTH = 256;
    private static final int MAX_DESCRIPTION_LENGTH = 2000;

    private final InterestJdbcRepository repository;
    private final KeyedLocks locks;
    private final Clock clock;
    private final TaxonomySettings settings;
    private final LoadingCache<String, TaxonomySnapshot> cache;

    public TaxonomyService(InterestJdbcRepository repository, KeyedLocks locks, Clock clock, TaxonomySettings settings) {
        this.repository = repository;
        this.locks = locks;
        this.clock = clock;
        this.settings = settings;
        this.cache = Caffeine.newBuilder()
                .refreshAfterWrite(settings.cacheRefresh())
                .build(key -> TaxonomySnapshot.of(repository.findActive()));
    }

    // --- reads ---

    public TaxonomySnapshot snapshot() {
        return cache.get(SNAPSHOT_KEY);
    }

    public Interest getInterest(String id) {
        return repository.findById(id).orElseThrow(() -> new NotFoundException("interest", id));
    }

    public List<Interest> getChildren(String parentId) {
        getInterest(parentId);
        return snapshot().childrenOf(parentId);
    }

    public List<InterestTreeNode> getTree(TreeScope scope) {
        TaxonomySnapshot snapshot = snapshot();
        return snapshot.roots().stream()
                .map(root -> scope == TreeScope.FULL ? buildNode(root, snapshot, 0) : new InterestTreeNode(root, List.of()))
                .toList();
    }

    /** Breadcrumbs from the root down to {@code id}. */
    public List<Interest> getInterestPath(String id) {
        Map<String, Interest> byId = repository.findAll().stream().collect(Collectors.toMap(Interest::id, Function.identity()));
        Interest cursor = byId.get(id);
        if (cursor == null) throw new NotFoundException("interest", id);

        LinkedList<Interest> path = new LinkedList<>();
        int guard = 0;
        while (cursor != null && guard++ <= settings.maxDepth()) {
            path.addFirst(cursor);
            cursor = cursor.parentId() == null ? null : byId.get(cursor.parentId());
        }
        return List.copyOf(path);
    }

    public List<Interest> searchInterests(String query, int limit) {
        if (query == null || query.isBlank()) return List.of();
        String q = query.trim().toLowerCase(Locale.ROOT);
        return snapshot().all().stream()
                .filter(i -> i.name().contains(q)
                        || i.displayName().toLowerCase(Locale.ROOT).contains(q)
                        || i.keywords().stream().anyMatch(k -> k.toLowerCase(Locale.ROOT).contains(q))
                        || i.synonyms().stream().anyMatch(s -> s.toLowerCase(Locale.ROOT).contains(q)))
                .sorted(Comparator.comparing(Interest::name))
                .limit(Math.max(0, limit))
                .toList();
    }

    /** Explicitly related interests first, then active siblings. */
    public List<Interest> getRelatedInterests(String id, int limit) {
        Interest interest = getInterest(id);
        TaxonomySnapshot snapshot = snapshot();
        LinkedHashMap<String, Interest> related = new LinkedHashMap<>();
        for (String relatedId : interest.relatedInterestIds()) {
            Interest r = snapshot.get(relatedId);
            if (r != null && !r.id().equals(id)) related.putIfAbsent(r.id(), r);
        }
        for (Interest sibling : snapshot.childrenOf(interest.parentId())) {
            if (related.size() >= limit) break;
            if (!sibling.id().equals(id)) related.putIfAbsent(sibling.id(), sibling);
        }
        return related.values().stream().limit(Math.max(0, limit)).toList();
    }

    public Optional<Interest> findSibling(String parentId, String name) {
        String normalized = normalizeName(name);
        return repository.findSiblings(parentId).stream().filter(i -> i.name().equals(normalized)).findFirst();
    }

    // --- admin mutations ---

    /**
     * Create, reparent, rename and deactivate all hold the structure lock, so a node's path is
     * always derived from its parent's committed path. Detail-only edits take just the node lock.
     */
    public Interest createInterest(CreateInterestRequest request) {
        String name = normalizeName(request.name());
        String parentId = blankToNull(request.parentId());
        String id = request.id() == null || request.id().isBlank() ? UUID.randomUUID().toString() : request.id().trim();
        requireLength(id, MAX_ID_LENGTH, "id");
        requireLength(request.displayName(), MAX_DISPLAY_NAME_LENGTH, "displayName");
        requireLength(request.description(), MAX_DESCRIPTION_LENGTH, "description");

        return locks.withLock(STRUCTURE_LOCK, () -> {
            if (id.equals(parentId)) {
                throw new InvalidParentException(InvalidParentException.SELF_PARENT, "Interest cannot be its own parent: " + id);
            }
            if (repository.findById(id).isPresent()) {
                throw new TaxonomyValidationException("DUPLICATE_ID", "id", "Interest id already exists: " + id);
            }

            int level = 0;
            List<String> path = List.of(name);
            if (parentId != null) {
                Interest parent = repository.findById(parentId)
                        .orElseThrow(() -> new InvalidParentException(InvalidParentException.MISSING_PARENT, "Parent interest not found: " + parentId));
                if (!parent.active()) {
                    throw new InvalidParentException(InvalidParentException.INACTIVE_PARENT, "Parent interest is deactivated: " + parentId);
                }
                if (parent.level() + 1 >= settings.maxDepth()) {
                    throw new InvalidParentException(InvalidParentException.DEPTH, "Taxonomy depth limit " + settings.maxDepth() + " reached under " + parentId);
                }
                level = parent.level() + 1;
                path = append(parent.path(), name);
            }
            ensureUniqueAmongSiblings(repository.findSiblings(parentId), name, null);

            Instant now = clock.instant();
            String displayName = request.displayName() == null || request.displayName().isBlank() ? name : request.displayName().trim();
            Interest interest = new Interest(id, name, displayName, parentId, level, path, request.description(), true,
                    0, 0, 0.0, 0.0, request.keywords(), request.synonyms(), request.relatedInterestIds(), now, now);
            repository.insert(interest);
            cache.invalidateAll();
            log.info("Created interest {} at path {}", id, path);
            return interest;
        });
    }

    public Interest update(String id, InterestUpdate update) {
        requireLength(update.displayName(), MAX_DISPLAY_NAME_LENGTH, "displayName");
        requireLength(update.description(), MAX_DESCRIPTION_LENGTH, "description");
        boolean structural = update.name() != null || update.parentId() != null || Boolean.TRUE.equals(update.moveToRoot());
        if (!structural) {
            Supplier<Interest> apply = () -> locks.withLock(nodeLock(id), () -> {
                Interest updated = getInterest(id).withDetails(update, clock.instant());
                repository.update(updated);
                cache.invalidateAll();
                log.info("Updated interest {}", id);
                return updated;
            });
            // activation changes must not interleave with creates under this node
            return update.active() == null ? apply.get() : locks.withLock(STRUCTURE_LOCK, apply);
        }
        return locks.withLock(STRUCTURE_LOCK, () -> locks.withLock(nodeLock(id), () -> restructure(id, update)));
    }

    public void deactivate(String id) {
        locks.withLock(STRUCTURE_LOCK, () -> locks.withLock(nodeLock(id), () -> {
            Interest current = getInterest(id);
            if (!current.active()) return;
            repository.update(current.withActive(false, clock.instant()));
            cache.invalidateAll();
            log.info("Deactivated interest {}", id);
        }));
    }

    public StatsRecount recalculateStats(String id) {
        return locks.withLock("taxonomy:stats:" + id, () -> {
            Interest interest = getInterest(id);
            Instant now = clock.instant();
            List<Instant> classifiedAt = repository.loadClassificationTimes(id);
            int newCount = classifiedAt.size();
            int followers = repository.countExplicitFollowers(id);
            double weekly = growth(classifiedAt, now, Duration.ofDays(7));
            double monthly = growth(classifiedAt, now, Duration.ofDays(30));
            repository.updateStats(id, newCount, followers, weekly, monthly, now);
            cache.invalidateAll();
            if (interest.postCount() != newCount) {
                log.info("Interest {} post count {} -> {}", id, interest.postCount(), newCount);
            }
            return new StatsRecount(id, interest.postCount(), newCount, followers, weekly, monthly);
        });
    }

    public List<StatsRecount> recalculateAllStats() {
        List<StatsRecount> results = repository.findAllIds().stream().map(this::recalculateStats).toList();
        long changed = results.stream().filter(r -> r.oldCount() != r.newCount()).count();
        log.info("Recalculated stats for {} interests, {} changed", results.size(), changed);
        return results;
    }

    @Scheduled(fixedDelayString = "${personalization.taxonomy.stats-recompute-delay-ms:3600000}",
            initialDelayString = "${personalization.taxonomy.stats-recompute-delay-ms:3600000}")
    public void scheduledStatsRecalculation() {
        recalculateAllStats();
    }

    public void refreshCache() {
        cache.invalidateAll();
    }

    // --- internals ---

    private Interest restructure(String id, InterestUpdate update) {
        List<Interest> all = repository.findAll();
        Map<String, Interest> byId = all.stream().collect(Collectors.toMap(Interest::id, Function.identity()));
        Interest current = byId.get(id);
        if (current == null) throw new NotFoundException("interest", id);

        String targetParentId = current.parentId();
        if (Boolean.TRUE.equals(update.moveToRoot())) {
            targetParentId = null;
        } else if (update.parentId() != null) {
            targetParentId = blankToNull(update.parentId());
        }
        String targetName = update.name() != null ? normalizeName(update.name()) : current.name();

        Interest parent = null;
        if (targetParentId != null) {
            if (targetParentId.equals(id)) {
                throw new InvalidParentException(InvalidParentException.SELF_PARENT, "Interest cannot be its own parent: " + id);
            }
            String missing = targetParentId;
            parent = Optional.ofNullable(byId.get(targetParentId))
                    .orElseThrow(() -> new InvalidParentException(InvalidParentException.MISSING_PARENT, "Parent interest not found: " + missing));
            if (!parent.active() && !targetParentId.equals(current.parentId())) {
                throw new InvalidParentException(InvalidParentException.INACTIVE_PARENT, "Parent interest is deactivated: " + targetParentId);
            }
            assertNotAncestor(id, parent, byId);
        }

        String siblingScope = targetParentId;
        List<Interest> siblings = all.stream().filter(i -> Objects.equals(i.parentId(), siblingScope)).toList();
        ensureUniqueAmongSiblings(siblings, targetName, id);

        Map<String, List<Interest>> children = all.stream()
                .filter(i -> i.parentId() != null)
                .collect(Collectors.groupingBy(Interest::parentId));
        int newLevel = parent == null ? 0 : parent.level() + 1;
        if (newLevel + subtreeHeight(id, children) >= settings.maxDepth()) {
            throw new InvalidParentException(InvalidParentException.DEPTH, "Move would exceed taxonomy depth limit " + settings.maxDepth());
        }

        Instant now = clock.instant();
        List<String> newPath = parent == null ? List.of(targetName) : append(parent.path(), targetName);
        Interest moved = current.withDetails(update, now).withPlacement(targetName, targetParentId, newLevel, newPath, now);

        List<Interest> rewritten = new ArrayList<>();
        rewritten.add(moved);
        Deque<Interest> queue = new ArrayDeque<>(List.of(moved));
        while (!queue.isEmpty()) {
            Interest p = queue.poll();
            for (Interest child : children.getOrDefault(p.id(), List.of())) {
                Interest placed = child.withPlacement(child.name(), p.id(), p.level() + 1, append(p.path(), child.name()), now);
                rewritten.add(placed);
                queue.add(placed);
            }
        }
        repository.relocate(moved, rewritten.subList(1, rewritten.size()));
        cache.invalidateAll();
        log.info("Restructured interest {} under {} ({} nodes rewritten)", id, targetParentId == null ? "<root>" : targetParentId, rewritten.size());
        return moved;
    }

    private void assertNotAncestor(String nodeId, Interest newParent, Map<String, Interest> byId) {
        Interest cursor = newParent;
        int steps = 0;
        while (cursor != null) {
            if (cursor.id().equals(nodeId)) {
                throw new InvalidParentException(InvalidParentException.CYCLE,
                        "Moving " + nodeId + " under " + newParent.id() + " would make it its own ancestor");
            }
            if (++steps > settings.maxDepth()) {
                throw new InvalidParentException(InvalidParentException.CYCLE, "Ancestor chain of " + newParent.id() + " exceeds depth limit");
            }
            cursor = cursor.parentId() == null ? null : byId.get(cursor.parentId());
        }
    }

    private int subtreeHeight(String id, Map<String, List<Interest>> children) {
        int height = 0;
        for (Interest child : children.getOrDefault(id, List.of())) {
            height = Math.max(height, 1 + subtreeHeight(child.id(), children));
        }
        return height;
    }

    private void ensureUniqueAmongSiblings(List<Interest> siblings, String name, String selfId) {
        boolean taken = siblings.stream().anyMatch(s -> s.name().equals(name) && !s.id().equals(selfId));
        if (taken) {
            throw new TaxonomyValidationException("DUPLICATE_NAME", "name", "Interest name already used at this level: " + name);
        }
    }

    private InterestTreeNode buildNode(Interest interest, TaxonomySnapshot snapshot, int depth) {
        if (depth >= settings.maxDepth()) return new InterestTreeNode(interest, List.of());
        List<InterestTreeNode> children = snapshot.childrenOf(interest.id()).stream()
                .map(child -> buildNode(child, snapshot, depth + 1))
                .toList();
        return new InterestTreeNode(interest, children);
    }

    private double growth(List<Instant> classifiedAt, Instant now, Duration window) {
        Instant since = now.minus(window);
        long recent = classifiedAt.stream().filter(t -> !t.isBefore(since)).count();
        long older = classifiedAt.size() - recent;
        return (double) recent / Math.max(1, older);
    }

    static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new TaxonomyValidationException("REQUIRED", "name", "Interest name is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
        requireLength(normalized, MAX_NAME_LENGTH, "name");
        return normalized;
    }

    private static void requireLength(String value, int max, String field) {
        if (value != null && value.trim().length() > max) {
            throw new TaxonomyValidationException("TOO_LONG", field, field + " must be at most " + max + " characters");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static List<String> append(List<String> path, String name) {
        List<String> out = new ArrayList<>(path);
        out.add(name);
        return List.copyOf(out);
    }

    private static String nodeLock(String id) {
        return "taxonomy:node:" + id;
    }
}
