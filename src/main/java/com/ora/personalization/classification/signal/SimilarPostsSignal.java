package com.ora.personalization.classification.signal;

import com.ora.personalization.classification.ClassificationModels.*;
import com.ora.personalization.config.PersonalizationProperties.ClassificationSettings;
import com.ora.personalization.domain.DomainModels.PostRecord;
import com.ora.personalization.repository.ClassificationJdbcRepository;
import com.ora.personalization.repository.PostJdbcRepository;
import com.ora.personalization.taxonomy.TaxonomyModels.TaxonomySnapshot;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Borrows classifications from recent classified posts whose tag and caption words overlap
 * (Jaccard) at least {@code similarPostThreshold}. Score is similarity times the borrowed confidence.
 */
@Component
public class SimilarPostsSignal implements SignalGenerator {
    private final PostJdbcRepository posts;
    private final ClassificationJdbcRepository classifications;
    private final ClassificationSettings settings;

    public SimilarPostsSignal(PostJdbcRepository posts, ClassificationJdbcRepository classifications, ClassificationSettings settings) {
        this.posts = posts;
        this.classifications = classifications;
        this.settings = settings;
    }

    @Override
    public ClassificationSignal signal() {
        return ClassificationSignal.SIMILAR_POSTS;
    }

    @Override
    public List<InterestCandidate> generate(PostSignals post, TaxonomySnapshot taxonomy) {
        Set<String> words = words(post.caption(), post.tags());
        if (words.isEmpty()) return List.of();

        Map<String, Double> similar = new LinkedHashMap<>();
        for (PostRecord other : posts.findRecentClassified(settings.similarPostSample(), post.postId())) {
            double similarity = TextMatching.jaccard(words, words(other.caption(), other.tags()));
            if (similarity >= settings.similarPostThreshold()) similar.put(other.id(), similarity);
        }
        if (similar.isEmpty()) return List.of();

        List<InterestCandidate> out = new ArrayList<>();
        classifications.findAll(similar.keySet()).forEach((postId, stored) -> {
            double similarity = similar.get(postId);
            for (Classification c : stored.classifications()) {
                if (taxonomy.get(c.interestId()) == null) continue;
                out.add(new InterestCandidate(c.interestId(), signal(), similarity * c.confidence(), "similar:" + postId));
            }
        });
        return out;
    }

    private static Set<String> words(String caption, List<String> tags) {
        Set<String> out = TextMatching.tokenSet(caption);
        tags.forEach(t -> out.addAll(TextMatching.tokens(t)));
        return out;
    }
}
