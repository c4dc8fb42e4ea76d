package com.ora.personalization.classification.signal;

import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import com.ora.personalization.classification.ClassificationModels.InterestCandidate;
import com.ora.personalization.classification.ClassificationModels.PostSignals;
import com.ora.personalization.config.PersonalizationProperties.ClassificationSettings;
import com.ora.personalization.domain.DomainModels.MetadataKind;
import com.ora.personalization.domain.DomainModels.MetadataValue;
import com.ora.personalization.taxonomy.TaxonomyModels.Interest;
import com.ora.personalization.taxonomy.TaxonomyModels.TaxonomySnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Caption text, plus string metadata under the configured keys. A whole word or phrase
 * hit scores 0.7, a shared prefix of at least four letters 0.5.
 */
@Component
public class CaptionMatchSignal implements SignalGenerator {
    static final double EXACT_SCORE = 0.7;
    static final double PREFIX_SCORE = 0.5;

    private final ClassificationSettings settings;

    public CaptionMatchSignal(ClassificationSettings settings) {
        this.settings = settings;
    }

    @Override
    public ClassificationSignal signal() {
        return ClassificationSignal.CAPTION_MATCH;
    }

    @Override
    public List<InterestCandidate> generate(PostSignals post, TaxonomySnapshot taxonomy) {
        String text = searchableText(post);
        Set<String> tokens = TextMatching.tokenSet(text);
        if (tokens.isEmpty()) return List.of();
        String phrase = String.join(" ", TextMatching.tokens(text));

        List<InterestCandidate> out = new ArrayList<>();
        for (Interest interest : taxonomy.all()) {
            double best = 0.0;
            String evidence = null;
            for (String term : TextMatching.terms(interest)) {
                if (term.contains(" ") ? TextMatching.containsPhrase(phrase, term) : tokens.contains(term)) {
                    best = EXACT_SCORE;
                    evidence = term;
                    break;
                }
                if (best < PREFIX_SCORE && !term.contains(" ")
                        && tokens.stream().anyMatch(t -> TextMatching.prefixOverlap(t, term))) {
                    best = PREFIX_SCORE;
                    evidence = term + "*";
                }
            }
            if (best > 0) out.add(new InterestCandidate(interest.id(), signal(), best, "caption:" + evidence));
        }
        return out;
    }

    private String searchableText(PostSignals post) {
        StringBuilder sb = new StringBuilder(post.caption() == null ? "" : post.caption());
        for (String key : settings.metadataTextKeys()) {
            MetadataValue value = post.metadata().get(key);
            if (value != null && value.kind() == MetadataKind.STRING) sb.append(' ').append(value.text());
        }
        return sb.toString();
    }
}
