package com.attribution.consolidation.source;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.SourceContribution;
import com.attribution.consolidation.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("AbstractSourceAdapter Tests")
class AbstractSourceAdapterTest {

    private MetricsService metrics;

    @BeforeEach
    void setUp() {
        metrics = mock(MetricsService.class);
    }

    /**
     * Maps each raw confidence to one attribution; the collaborator's records are the list itself.
     */
    private static class ScoreAdapter extends AbstractSourceAdapter {
        private final List<Double> scores;

        ScoreAdapter(List<Double> scores, MetricsService metrics) {
            super("score_feed", metrics);
            this.scores = scores;
        }

        @Override
        protected List<Attribution> doFetch(String address, String blockchain) {
            return mapEach(address, scores, score -> Attribution.builder()
                    .id(attributionId(address, null, score))
                    .address(address)
                    .blockchain(blockchain)
                    .entity("Entity " + score)
                    .source(SourceContribution.of(sourceName(), score))
                    .build());
        }
    }

    @Test
    @DisplayName("A record that fails to map is skipped and the rest are kept")
    void skipsMalformedRecord() {
        ScoreAdapter adapter = new ScoreAdapter(Arrays.asList(0.7, 1.5, null, 0.4), metrics);

        List<Attribution> result = adapter.fetch("0xabc", "ethereum");

        assertEquals(2, result.size());
        assertEquals("Entity 0.7", result.get(0).getEntity());
        assertEquals("Entity 0.4", result.get(1).getEntity());
        verify(metrics, never()).incrementSourceFailure(anyString());
    }

    @Test
    @DisplayName("Content-derived ids differ by content and repeat for equal content")
    void contentIds() {
        ScoreAdapter adapter = new ScoreAdapter(List.of(0.7), metrics);

        assertEquals(adapter.attributionId("0xabc", null, "a", 1), adapter.attributionId("0xabc", null, "a", 1));
        assertNotEquals(adapter.attributionId("0xabc", null, "a", 1), adapter.attributionId("0xabc", null, "a", 2));
        assertEquals(adapter.attributionId("0xabc", "n-1", "a"), adapter.attributionId("0xabc", "n-1", "b"));
    }

    @Test
    @DisplayName("clamp maps NaN to zero and bounds the rest to [0, 1]")
    void clamp() {
        assertEquals(0.0, AbstractSourceAdapter.clamp(Double.NaN));
        assertEquals(1.0, AbstractSourceAdapter.clamp(3.0));
        assertEquals(0.0, AbstractSourceAdapter.clamp(-1.0));
        assertEquals(0.25, AbstractSourceAdapter.clamp(0.25));
    }
}
