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

@Component
public class BoardNameSignal implements SignalGenerator {
    static final double EXACT_SCORE = 0.8;
    static final double TOKEN_SCORE = 0.6;

    @Override
    public ClassificationSignal signal() {
        return ClassificationSignal.BOARD_NAME;
    }

    @Override
    public List<InterestCandidate> generate(PostSignals post, TaxonomySnapshot taxonomy) {
        if (post.boardNames().isEmpty()) return List.of();
        List<InterestCandidate> out = new ArrayList<>();
        for (Interest interest : taxonomy.all()) {
            List<String> terms = new ArrayList<>(TextMatching.terms(interest));
            terms.add(TextMatching.phrase(interest.displayName()));

            double best = 0.0;
            String matchedBoard = null;
            for (String board : post.boardNames()) {
                String boardPhrase = TextMatching.phrase(board);
                Set<String> boardTokens = TextMatching.tokenSet(board);
                if (terms.contains(boardPhrase)) {
                    best = EXACT_SCORE;
                    matchedBoard = board;
                    break;
                }
                if (best < TOKEN_SCORE && terms.stream().anyMatch(boardTokens::contains)) {
                    best = TOKEN_SCORE;
                    matchedBoard = board;
                }
            }
            if (best > 0) out.add(new InterestCandidate(interest.id(), signal(), best, "board:" + matchedBoard));
        }
        return out;
    }
}
