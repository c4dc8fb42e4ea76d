package com.ora.personalization.config;

import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import com.ora.personalization.config.PersonalizationProperties.ClassificationSettings;
import com.ora.personalization.config.PersonalizationProperties.RankingSettings;
import com.ora.personalization.config.PersonalizationProperties.TaxonomySettings;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class PersonalizationPropertiesTest {
    @Autowired
    private ClassificationSettings classificationSettings;
    @Autowired
    private RankingSettings rankingSettings;
    @Autowired
    private TaxonomySettings taxonomySettings;

    @Test
    void applicationPropertiesBind() {
        assertEquals(0.75, classificationSettings.weightOf(ClassificationSignal.CAPTION_MATCH), 1e-12);
        assertEquals(0.5, classificationSettings.weightOf(ClassificationSignal.TF_IDF), 1e-12);
        assertEquals(List.of("location", "altText"), classificationSettings.metadataTextKeys());
        assertEquals(Duration.ofMillis(500), rankingSettings.tasteGraphTimeout());
        assertEquals(8, taxonomySettings.maxDepth());
        assertEquals(Duration.ofMinutes(10), taxonomySettings.cacheRefresh());
    }

    @Test
    void rankingWeightsMustSumToOne() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new RankingSettings(0.5, 0.3, 0.15, 0.15, null, null, null, null, null, null));
        assertTrue(ex.getMessage().contains("sum to 1.0"));
        assertDoesNotThrow(() -> new RankingSettings(0.25, 0.25, 0.25, 0.25, null, null, null, null, null, null));
    }

    @Test
    void engagementCapMustBePositive() {
        assertThrows(IllegalStateException.class,
                () -> new RankingSettings(null, null, null, null, 0.0, null, null, null, null, null));
    }
}
