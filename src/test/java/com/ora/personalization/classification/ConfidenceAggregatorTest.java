package com.ora.personalization.classification;

import com.ora.personalization.classification.ClassificationModels.Classification;
import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import com.ora.personalization.classification.ClassificationModels.InterestCandidate;
import com.ora.personalization.config.PersonalizationProperties.ClassificationSettings;
import com.ora.personalization.taxonomy.TaxonomyModels.Interest;
import com.ora.personalization.taxonomy.TaxonomyModels.TaxonomySnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static com.ora.personalization.classification.ClassificationModels.ClassificationSignal.*;
import static org.junit.jupiter.api.Assertions.*;

class ConfidenceAggregatorTest {
    private final ConfidenceAggregator aggregator = new ConfidenceAggregator(ClassificationSettings.defaults());

    @Test
    void independentSignalsCombineWithoutExceedingOne() {
        TaxonomySnapshot taxonomy = TaxonomySnapshot.of(List.of(interest("food", null, 0)));
        List<Classification> result = aggregator.aggregate(List.of(
                new InterestCandidate("food", TAG_MATCH, 1.0, "tag"),
                new InterestCandidate("food", CAPTION_MATCH, 0.7, "caption"),
                new InterestCandidate("food", BOARD_NAME, 0.8, "board")), taxonomy);

        double expected = 1 - (1 - 0.9) * (1 - 0.7 * 0.75) * (1 - 0.8 * 0.7);
        assertEquals(1, result.size());
        assertEquals(expected, result.get(0).confidence(), 1e-9);
        assertEquals(List.of(CAPTION_MATCH, TAG_MATCH, BOARD_NAME), result.get(0).signals());
    }

    @Test
    void duplicateWeakSignalsCountOnce() {
        TaxonomySnapshot taxonomy = TaxonomySnapshot.of(List.of(interest("food", null, 0)));
        List<InterestCandidate> many = IntStream.range(0, 20)
                .mapToObj(i -> new InterestCandidate("food", CAPTION_MATCH, 0.5 + i * 0.01, "c" + i))
                .toList();

        List<Classification> result = aggregator.aggregate(many, taxonomy);

        assertEquals(1, result.size());
        assertEquals(0.69 * 0.75, result.get(0).confidence(), 1e-9);
    }

    @Test
    void belowMinimumConfidenceIsDropped() {
        TaxonomySnapshot taxonomy = TaxonomySnapshot.of(List.of(interest("pets", null, 0)));
        assertTrue(aggregator.aggregate(List.of(new InterestCandidate("pets", USER_BEHAVIOR, 0.5, "b")), taxonomy).isEmpty());
    }

    @Test
    void deeperInterestsGetSpecificityBoostAndTopFiveAreKept() {
        List<Interest> interests = List.of(
                interest("root", null, 0), interest("a", "root", 1), interest("b", "root", 1),
                interest("c", "root", 1), interest("d", "root", 1), interest("e", "root", 1), interest("f", "root", 1));
        TaxonomySnapshot taxonomy = TaxonomySnapshot.of(interests);
        List<InterestCandidate> candidates = interests.stream()
                .map(i -> new InterestCandidate(i.id(), TAG_MATCH, 0.9, "tag"))
                .toList();

        List<Classification> result = aggregator.aggregate(candidates, taxonomy);

        assertEquals(5, result.size());
        assertEquals(List.of("a", "b", "c", "d", "e"), result.stream().map(Classification::interestId).toList());
        assertEquals(0.81 + 0.02, result.get(0).confidence(), 1e-9);
    }

    @Test
    void candidatesForUnknownOrInactiveInterestsAreIgnored() {
        Interest inactive = interest("old", null, 0).withActive(false, Instant.EPOCH);
        TaxonomySnapshot taxonomy = TaxonomySnapshot.of(List.of(inactive));
        assertTrue(aggregator.aggregate(List.of(
                new InterestCandidate("old", USER_TAGGED, 1.0, "x"),
                new InterestCandidate("ghost", USER_TAGGED, 1.0, "x")), taxonomy).isEmpty());
    }

    @Test
    void signalWeightsAreConfigurable() {
        ClassificationSettings settings = new ClassificationSettings(null, null, null, null, null, null, null, null, null,
                Map.of(ClassificationSignal.CAPTION_MATCH, 1.0));
        ConfidenceAggregator custom = new ConfidenceAggregator(settings);
        TaxonomySnapshot taxonomy = TaxonomySnapshot.of(List.of(interest("food", null, 0)));

        List<Classification> result = custom.aggregate(List.of(new InterestCandidate("food", CAPTION_MATCH, 0.7, "c")), taxonomy);

        assertEquals(0.7, result.get(0).confidence(), 1e-9);
        assertEquals(0.9, settings.weightOf(TAG_MATCH), 1e-12);
    }

    private static Interest interest(String id, String parentId, int level) {
        List<String> path = parentId == null ? List.of(id) : List.of(parentId, id);
        return new Interest(id, id, id, parentId, level, path, null, true, 0, 0, 0, 0,
                List.of(), List.of(), List.of(), Instant.EPOCH, Instant.EPOCH);
    }
}
