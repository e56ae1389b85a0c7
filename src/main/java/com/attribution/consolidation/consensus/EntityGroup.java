package com.attribution.consolidation.consensus;

import com.attribution.consolidation.core.model.Attribution;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Attributions that claim the same entity, with their weighted agreement.
 *
 * @param entityKey    claimed entity, or {@value Attribution#UNKNOWN_ENTITY}
 * @param attributions members in canonical order
 * @param score        weighted mean raw confidence of every source contribution
 * @param totalWeight  sum of the source weights that produced {@code score}
 */
public record EntityGroup(String entityKey, List<Attribution> attributions, double score, double totalWeight) {

    public EntityGroup {
        attributions = List.copyOf(attributions);
    }

    public boolean isUnknown() {
        return Attribution.UNKNOWN_ENTITY.equals(entityKey);
    }

    public Set<String> sourceNames() {
        Set<String> names = new TreeSet<>();
        for (Attribution attribution : attributions) {
            names.addAll(attribution.getSourceNames());
        }
        return names;
    }

    /**
     * First entity type declared by a member, or null.
     */
    public String entityType() {
        for (Attribution attribution : attributions) {
            if (attribution.getEntityType() != null) {
                return attribution.getEntityType();
            }
        }
        return null;
    }
}
