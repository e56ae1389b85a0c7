package com.attribution.consolidation.source;

import com.attribution.consolidation.core.model.Attribution;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Attributions gathered by one fan-out, plus the sources that timed out or threw.
 *
 * @param attributions       results of the sources that answered, in registration order
 * @param unavailableSources sources whose answer is missing from {@code attributions}
 */
public record SourceResults(List<Attribution> attributions, Set<String> unavailableSources) {

    public SourceResults {
        attributions = attributions != null ? List.copyOf(attributions) : List.of();
        unavailableSources = unavailableSources != null
                ? Collections.unmodifiableSet(new TreeSet<>(unavailableSources))
                : Set.of();
    }

    /**
     * True when every queried source answered.
     */
    public boolean isComplete() {
        return unavailableSources.isEmpty();
    }
}
