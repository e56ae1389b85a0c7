package com.attribution.consolidation.source;

import java.util.Optional;

/**
 * Lookup against the registered VASP attribution registry.
 */
public interface VaspAttributionCollaborator {

    /**
     * Attributes an address to a VASP.
     *
     * @param minConfidence registry matches below this confidence are not returned
     * @return the best registry match, or empty
     */
    Optional<VaspAttributionResult> attribute(String address, String blockchain, double minConfidence);
}
