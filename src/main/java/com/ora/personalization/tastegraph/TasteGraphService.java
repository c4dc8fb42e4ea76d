package com.ora.personalization.tastegraph;

import com.ora.personalization.classification.ClassificationModels.Classification;
import com.ora.personalization.classification.ClassificationModels.PostInterestClassification;
import com.ora.personalization.config.PersonalizationProperties.TasteGraphSettings;
import com.ora.personalization.error.NotFoundException;
import com.ora.personalization.error.TasteGraphUnavailableException;
import com.ora.personalization.domain.DomainModels.PostEngagement;
import com.ora.personalization.repository.ClassificationJdbcRepository;
import com.ora.personalization.repository.PostJdbcRepository;
import com.ora.personalization.repository.TasteGraphJdbcRepository;
import com.ora.personalization.support.KeyedLocks;
import com.ora.personalization.tastegraph.TasteGraphModels.*;
import com.ora.personalization.taxonomy.TaxonomyModels.Interest;
import com.ora.personalization.taxonomy.TaxonomyModels.TaxonomySnapshot;
import com.ora.personalization.taxonomy.TaxonomyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Service
public class TasteGraphService {
    private static final Logger log = LoggerFactory.getLogger(TasteGraphService.class);
    private static final Duration MIN_VIEW = Duration.ofSeconds(3);
    private static final Duration FULL_VIEW = Duration.ofSeconds(30);

    private final TasteGraphJdbcRepository repository;
    private final ClassificationJdbcRepository classifications;
    private final PostJdbcRepository posts;
    private final TaxonomyService taxonomyService;
    private final KeyedLocks locks;
    private final Clock clock;
    private final TasteGraphSettings settings;
    private final Executor ioExecutor;

    public TasteGraphService(TasteGraphJdbcRepository repository,
                             ClassificationJdbcRepository classifications,
                             PostJdbcRepository posts,
                             TaxonomyService taxonomyService,
                             KeyedLocks locks,
                             Clock clock,
                             TasteGraphSettings settings,
                             @Qualifier("personalizationIoExecutor") Executor ioExecutor) {
        this.repository = repository;
        this.classifications = classifications;
        this.posts = posts;
        this.taxonomyService = taxonomyService;
        this.locks = locks;
        this.clock = clock;
        this.settings = settings;
        this.ioExecutor = ioExecutor;
    }

    public TasteGraph getTasteGraph(String userId) {
        return repository.load(userId).orElseGet(() -> TasteGraph.empty(userId));
    }

    public CompletableFuture<TasteGraph> fetchTasteGraphAsync(String userId) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return getTasteGraph(userId);
            } catch (RuntimeException e) {
                throw new TasteGraphUnavailableException(userId, e);
            }
        }, ioExecutor);
    }

    public List<ScoredAffinity> topInterests(String userId, int count, Instant asOf) {
        return getTasteGraph(userId).topInterests(count, asOf == null ? clock.instant() : asOf);
    }

    public List<ScoredAffinity> topInterests(String userId) {
        return topInterests(userId, settings.topInterestCount(), clock.instant());
    }

    /**
     * Creates or reinforces one affinity. A new affinity starts at {@code weight * initialScoreFactor};
     * an existing one moves toward 1 by {@code reinforcementRate * weight} of the remaining gap, so
     * repeated engagement never lowers the stored score.
     */
    public InterestAffinity recordEngagement(String userId, String interestId, AffinitySource source, double weight) {
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException("userId is required");
        if (interestId == null || interestId.isBlank()) throw new IllegalArgumentException("interestId is required");
        if (source == null) throw new IllegalArgumentException("source is required");
        if (taxonomyService.snapshot().get(interestId) == null) throw new NotFoundException("interest", interestId);
        double w = TasteGraphModels.clamp(weight);

        return locks.withLock("taste-graph:" + userId, () -> {
            Instant now = clock.instant();
            TasteGraph graph = getTasteGraph(userId);
            double sourceDecay = source.explicit() ? settings.followDecayFactor() : settings.inferredDecayFactor();

            InterestAffinity updated = graph.affinity(interestId)
                    .map(existing -> new InterestAffinity(
                            interestId,
                            existing.score() + settings.reinforcementRate() * w * (1.0 - existing.score()),
                            source,
                            existing.engagementCount() + 1,
                            existing.firstEngagement(),
                            now,
                            Math.min(existing.decayFactor(), sourceDecay)))
                    .orElseGet(() -> new InterestAffinity(interestId, w * settings.initialScoreFactor(), source, 1, now, now, sourceDecay));

            repository.upsert(userId, updated, TasteGraphModels.SCHEMA_VERSION, now);
            log.debug("Affinity {}:{} -> {} ({})", userId, interestId, updated.score(), source.wireName());
            return updated;
        });
    }

    public InterestAffinity recordFollow(String userId, String interestId) {
        return recordEngagement(userId, interestId, AffinitySource.EXPLICIT_FOLLOW, 1.0);
    }

    public InterestAffinity recordSearch(String userId, String interestId) {
        return recordEngagement(userId, interestId, AffinitySource.INFERRED_FROM_SEARCH, 0.6);
    }

    public int recordSave(String userId, String postId) {
        requirePost(postId);
        posts.saveEngagement(new PostEngagement(postId, userId, "save", clock.instant()));
        return recordFromClassification(userId, postId, AffinitySource.INFERRED_FROM_SAVES, 0.8);
    }

    public int recordCreate(String userId, String postId) {
        requirePost(postId);
        return recordFromClassification(userId, postId, AffinitySource.INFERRED_FROM_CREATES, 0.7);
    }

    /** Views of three seconds or less are ignored; thirty seconds or more count fully. */
    public int recordView(String userId, String postId, Duration viewed) {
        requirePost(postId);
        if (viewed == null || viewed.compareTo(MIN_VIEW) <= 0) return 0;
        posts.saveEngagement(new PostEngagement(postId, userId, "view", clock.instant()));
        double durationWeight = (double) Math.min(viewed.toMillis(), FULL_VIEW.toMillis()) / FULL_VIEW.toMillis();
        return recordFromClassification(userId, postId, AffinitySource.INFERRED_FROM_VIEWS, 0.4 * durationWeight);
    }

    /** The user's strongest interests, then interests related to the top five, de-duplicated. */
    public List<InterestSuggestion> suggestedInterests(String userId, int limit) {
        Instant now = clock.instant();
        List<ScoredAffinity> top = getTasteGraph(userId).topInterests(limit * 2, now);
        TaxonomySnapshot taxonomy = taxonomyService.snapshot();

        LinkedHashMap<String, InterestSuggestion> out = new LinkedHashMap<>();
        for (ScoredAffinity affinity : top) {
            Interest interest = taxonomy.get(affinity.interestId());
            if (interest != null) {
                out.putIfAbsent(interest.id(), new InterestSuggestion(interest.id(), interest.displayName(), affinity.decayedScore(), "affinity"));
            }
        }
        for (ScoredAffinity affinity : top.stream().limit(5).toList()) {
            if (taxonomy.get(affinity.interestId()) == null) continue;
            for (Interest related : taxonomyService.getRelatedInterests(affinity.interestId(), 3)) {
                out.putIfAbsent(related.id(), new InterestSuggestion(related.id(), related.displayName(), 0.0, "related:" + affinity.interestId()));
            }
        }
        return out.values().stream().limit(Math.max(0, limit)).toList();
    }

    private int recordFromClassification(String userId, String postId, AffinitySource source, double baseWeight) {
        Optional<PostInterestClassification> classification = classifications.find(postId);
        if (classification.isEmpty()) {
            log.debug("Post {} is not classified, no {} affinity recorded for {}", postId, source.wireName(), userId);
            return 0;
        }
        TaxonomySnapshot taxonomy = taxonomyService.snapshot();
        List<Classification> items = classification.get().classifications().stream()
                .filter(c -> taxonomy.get(c.interestId()) != null)
                .toList();
        items.forEach(c -> recordEngagement(userId, c.interestId(), source, baseWeight * c.confidence()));
        return items.size();
    }

    private void requirePost(String postId) {
        if (postId == null || posts.findById(postId).isEmpty()) throw new NotFoundException("post", postId);
    }
}
