package com.ora.personalization.classification.signal;

import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import com.ora.personalization.classification.ClassificationModels.InterestCandidate;
import com.ora.personalization.classification.ClassificationModels.PostSignals;
import com.ora.personalization.taxonomy.TaxonomyModels.TaxonomySnapshot;

import java.util.List;

/**
 * Produces interest candidates from one kind of evidence. Implementations only propose
 * active interests present in {@code taxonomy}.
 */
public interface SignalGenerator {
    ClassificationSignal signal();

    List<InterestCandidate> generate(PostSignals post, TaxonomySnapshot taxonomy);
}
