package com.attribution.consolidation.api;

import com.attribution.consolidation.core.model.AttributionConsolidation;

/**
 * Observes batch items as they finish.
 */
@FunctionalInterface
public interface BatchItemListener {

    BatchItemListener NONE = (address, consolidation) -> { };

    /**
     * @param address       the address as given by the caller
     * @param consolidation the result, or {@code null} when nothing was found or the item failed
     */
    void onItem(String address, AttributionConsolidation consolidation);
}
