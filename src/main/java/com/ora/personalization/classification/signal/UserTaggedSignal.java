package com.ora.personalization.classification.signal;

import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import com.ora.personalization.classification.ClassificationModels.InterestCandidate;
import com.ora.personalization.classification.ClassificationModels.PostSignals;
import com.ora.personalization.taxonomy.TaxonomyModels.TaxonomySnapshot;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

@Component
public class UserTaggedSignal implements SignalGenerator {
    @Override
    public ClassificationSignal signal() {
        return ClassificationSignal.USER_TAGGED;
    }

    @Override
    public List<InterestCandidate> generate(PostSignals post, TaxonomySnapshot taxonomy) {
        return post.selectedInterestIds().stream()
                .map(taxonomy::get)
                .filter(Objects::nonNull)
                .map(i -> new InterestCandidate(i.id(), signal(), 1.0, "selected by author"))
                .toList();
    }
}
