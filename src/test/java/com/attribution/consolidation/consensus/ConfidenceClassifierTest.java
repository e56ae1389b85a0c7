package com.attribution.consolidation.consensus;

import com.attribution.consolidation.core.model.ConfidenceLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfidenceClassifier Tests")
class ConfidenceClassifierTest {

    private final ConfidenceClassifier classifier = new ConfidenceClassifier();

    @Test
    @DisplayName("Should add source and evidence boosts")
    void addsBoosts() {
        assertEquals(0.5 + 0.10 + 0.04, classifier.boostedScore(0.5, 2, 2), 1e-9);
    }

    @Test
    @DisplayName("Should cap source boost at 0.20 and evidence boost at 0.10")
    void capsBoosts() {
        assertEquals(0.3 + 0.20 + 0.10, classifier.boostedScore(0.3, 10, 50), 1e-9);
    }

    @Test
    @DisplayName("Should clamp to 1.0")
    void clamps() {
        assertEquals(1.0, classifier.boostedScore(0.95, 4, 5), 1e-9);
        assertEquals(ConfidenceLevel.DEFINITIVE, classifier.classify(0.95, 4, 5));
    }

    @Test
    @DisplayName("A lone source with no evidence only gets the single-source boost")
    void loneSource() {
        assertEquals(ConfidenceLevel.LOW, classifier.classify(0.26, 1, 0));
        assertEquals(ConfidenceLevel.VERY_LOW, classifier.classify(0.24, 1, 0));
    }

    @Test
    @DisplayName("Should be non-decreasing in score for fixed counts")
    void monotonic() {
        ConfidenceLevel previous = ConfidenceLevel.VERY_LOW;
        for (int i = 0; i <= 100; i++) {
            ConfidenceLevel current = classifier.classify(i / 100.0, 2, 1);
            assertTrue(current.isAtLeast(previous));
            previous = current;
        }
    }

    @Test
    @DisplayName("Should reject negative counts")
    void rejectsNegativeCounts() {
        assertThrows(IllegalArgumentException.class, () -> classifier.boostedScore(0.5, -1, 0));
    }
}
