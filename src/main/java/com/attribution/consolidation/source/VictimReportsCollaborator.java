package com.attribution.consolidation.source;

import java.util.List;

/**
 * Read access to the victim reports database.
 */
public interface VictimReportsCollaborator {

    /**
     * Returns reports that mention the given address.
     */
    List<VictimReport> searchByAddress(String address);
}
