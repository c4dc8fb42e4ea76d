package com.ora.personalization.classification;

import com.ora.personalization.classification.ClassificationModels.*;
import com.ora.personalization.classification.signal.SignalGenerator;
import com.ora.personalization.config.PersonalizationProperties.ClassificationSettings;
import com.ora.personalization.domain.DomainModels.PostRecord;
import com.ora.personalization.error.NotFoundException;
import com.ora.personalization.repository.ClassificationJdbcRepository;
import com.ora.personalization.repository.PostJdbcRepository;
import com.ora.personalization.support.KeyedLocks;
import com.ora.personalization.taxonomy.TaxonomyModels.TaxonomySnapshot;
import com.ora.personalization.taxonomy.TaxonomyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class PostClassificationService {
    private static final Logger log = LoggerFactory.getLogger(PostClassificationService.class);
    private static final int MAX_BATCH = 500;

    private final List<SignalGenerator> generators;
    private final ConfidenceAggregator aggregator;
    private final TaxonomyService taxonomyService;
    private final PostJdbcRepository posts;
    private final ClassificationJdbcRepository repository;
    private final KeyedLocks locks;
    private final Clock clock;
    private final ClassificationSettings settings;

    public PostClassificationService(List<SignalGenerator> generators,
                                     ConfidenceAggregator aggregator,
                                     TaxonomyService taxonomyService,
                                     PostJdbcRepository posts,
                                     ClassificationJdbcRepository repository,
                                     KeyedLocks locks,
                                     Clock clock,
                                     ClassificationSettings settings) {
        this.generators = generators.stream().sorted(Comparator.comparing(SignalGenerator::signal)).toList();
        this.aggregator = aggregator;
        this.taxonomyService = taxonomyService;
        this.posts = posts;
        this.repository = repository;
        this.locks = locks;
        this.clock = clock;
        this.settings = settings;
    }

    /** Runs every signal generator and aggregates; nothing is written. */
    public ClassificationOutcome classify(PostSignals post) {
        TaxonomySnapshot taxonomy = taxonomyService.snapshot();
        List<InterestCandidate> candidates = new ArrayList<>();
        List<ClassificationPartialFailure> failures = new ArrayList<>();
        for (SignalGenerator generator : generators) {
            try {
                candidates.addAll(generator.generate(post, taxonomy));
            } catch (RuntimeException e) {
                log.warn("Signal {} failed for post {}: {}", generator.signal().wireName(), post.postId(), e.getMessage());
                failures.add(new ClassificationPartialFailure(generator.signal(), e.getMessage()));
            }
        }
        List<Classification> classifications = aggregator.aggregate(candidates, taxonomy);
        PostInterestClassification result = new PostInterestClassification(post.postId(), classifications, clock.instant(), settings.version());
        return new ClassificationOutcome(result, failures);
    }

    public List<Classification> suggestInterests(String caption, List<String> tags, String boardName) {
        PostSignals signals = new PostSignals(null, null, caption, tags,
                boardName == null || boardName.isBlank() ? List.of() : List.of(boardName), List.of(), null);
        return classify(signals).classification().classifications();
    }

    /** Replaces the stored classification of one post. Calls for the same post are serialized. */
    public ClassificationOutcome reclassify(String postId) {
        return locks.withLock("classification:post:" + postId, () -> {
            PostRecord post = posts.findById(postId).orElseThrow(() -> new NotFoundException("post", postId));
            ClassificationOutcome outcome = classify(PostSignals.of(post));
            repository.replace(outcome.classification());
            log.debug("Classified post {} into {} interests", postId, outcome.classification().classifications().size());
            return outcome;
        });
    }

    public PostInterestClassification getClassification(String postId) {
        return repository.find(postId).orElseThrow(() -> new NotFoundException("classification", postId));
    }

    /**
     * Classifies up to {@code limit} posts in id order after {@code afterPostId}. Each post is
     * committed on its own, so a failed run resumes from {@link BatchResult#nextCursor()}.
     */
    public BatchResult classifyBatch(int limit, BatchFilter filter, String afterPostId) {
        int bounded = Math.max(1, Math.min(limit, MAX_BATCH));
        BatchFilter effective = filter == null ? BatchFilter.UNCLASSIFIED_ONLY : filter;
        List<String> ids = posts.findIdsForBatch(afterPostId, effective, bounded);

        int classified = 0;
        List<String> failed = new ArrayList<>();
        for (String postId : ids) {
            try {
                reclassify(postId);
                classified++;
            } catch (RuntimeException e) {
                log.warn("Batch classification failed for post {}", postId, e);
                failed.add(postId);
            }
        }
        String nextCursor = ids.size() < bounded ? null : ids.get(ids.size() - 1);
        log.info("Batch classification ({}): {} processed, {} classified, {} failed", effective, ids.size(), classified, failed.size());
        return new BatchResult(ids.size(), classified, failed.size(), failed, nextCursor);
    }

    public BatchResult classifyBatch(BatchRequest request) {
        int limit = request.limit() == null ? 100 : request.limit();
        return classifyBatch(limit, request.filter(), request.afterPostId());
    }
}
