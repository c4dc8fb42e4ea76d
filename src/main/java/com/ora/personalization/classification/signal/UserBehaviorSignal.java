package com.ora.personalization.classification.signal;

import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import com.ora.personalization.classification.ClassificationModels.InterestCandidate;
import com.ora.personalization.classification.ClassificationModels.PostSignals;
import com.ora.personalization.config.PersonalizationProperties.ClassificationSettings;
import com.ora.personalization.repository.TasteGraphJdbcRepository;
import com.ora.personalization.tastegraph.TasteGraphModels.InterestAffinity;
import com.ora.personalization.tastegraph.TasteGraphModels.TasteGraph;
import com.ora.personalization.taxonomy.TaxonomyModels.TaxonomySnapshot;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Mean decayed affinity, across everyone who engaged with the post, for each interest.
 * Silent until at least {@code minBehaviorUsers} users have engaged.
 */
@Component
public class UserBehaviorSignal implements SignalGenerator {
    private final TasteGraphJdbcRepository tasteGraphs;
    private final ClassificationSettings settings;
    private final Clock clock;

    public UserBehaviorSignal(TasteGraphJdbcRepository tasteGraphs, ClassificationSettings settings, Clock clock) {
        this.tasteGraphs = tasteGraphs;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public ClassificationSignal signal() {
        return ClassificationSignal.USER_BEHAVIOR;
    }

    @Override
    public List<InterestCandidate> generate(PostSignals post, TaxonomySnapshot taxonomy) {
        if (post.postId() == null) return List.of();
        List<TasteGraph> engagers = tasteGraphs.loadEngagerGraphs(post.postId());
        if (engagers.size() < settings.minBehaviorUsers()) return List.of();

        Instant now = clock.instant();
        Map<String, Double> sums = new TreeMap<>();
        for (TasteGraph graph : engagers) {
            for (InterestAffinity affinity : graph.interests()) {
                if (taxonomy.get(affinity.interestId()) == null) continue;
                sums.merge(affinity.interestId(), affinity.decayedScore(now), Double::sum);
            }
        }
        List<InterestCandidate> out = new ArrayList<>();
        sums.forEach((interestId, sum) -> {
            double mean = sum / engagers.size();
            if (mean > 0) out.add(new InterestCandidate(interestId, signal(), mean, engagers.size() + " engagers"));
        });
        return out;
    }
}
