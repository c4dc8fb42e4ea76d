package com.ora.personalization.classification.signal;

import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import com.ora.personalization.classification.ClassificationModels.InterestCandidate;
import com.ora.personalization.classification.ClassificationModels.PostSignals;
import com.ora.personalization.taxonomy.TaxonomyModels.Interest;
import com.ora.personalization.taxonomy.TaxonomyModels.TaxonomySnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Exact tag hits: interest name 1.0, keyword 0.9, synonym 0.85. */
@Component
public class TagMatchSignal implements SignalGenerator {
    static final double NAME_SCORE = 1.0;
    static final double KEYWORD_SCORE = 0.9;
    static final double SYNONYM_SCORE = 0.85;

    @Override
    public ClassificationSignal signal() {
        return ClassificationSignal.TAG_MATCH;
    }

    @Override
    public List<InterestCandidate> generate(PostSignals post, TaxonomySnapshot taxonomy) {
        Set<String> tags = post.tags().stream().map(TextMatching::tag).filter(t -> !t.isEmpty()).collect(Collectors.toSet());
        if (tags.isEmpty()) return List.of();

        List<InterestCandidate> out = new ArrayList<>();
        for (Interest interest : taxonomy.all()) {
            if (tags.contains(interest.name())) {
                out.add(new InterestCandidate(interest.id(), signal(), NAME_SCORE, "tag=" + interest.name()));
                continue;
            }
            interest.keywords().stream().map(TextMatching::tag).filter(tags::contains).findFirst()
                    .ifPresentOrElse(
                            k -> out.add(new InterestCandidate(interest.id(), signal(), KEYWORD_SCORE, "tag keyword=" + k)),
                            () -> interest.synonyms().stream().map(TextMatching::tag).filter(tags::contains).findFirst()
                                    .ifPresent(s -> out.add(new InterestCandidate(interest.id(), signal(), SYNONYM_SCORE, "tag synonym=" + s))));
        }
        return out;
    }
}
