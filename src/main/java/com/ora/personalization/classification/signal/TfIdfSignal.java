package com.ora.personalization.classification.signal;

import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import com.ora.personalization.classification.ClassificationModels.InterestCandidate;
import com.ora.personalization.classification.ClassificationModels.PostSignals;
import com.ora.personalization.taxonomy.TaxonomyModels.TaxonomySnapshot;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TfIdfSignal implements SignalGenerator {
    @Override
    public ClassificationSignal signal() {
        return ClassificationSignal.TF_IDF;
    }

    @Override
    public List<InterestCandidate> generate(PostSignals post, TaxonomySnapshot taxonomy) {
        return List.of();
    }
}
