package com.attribution.consolidation.core.model;

import java.util.Set;

/**
 * Well-known intelligence source names.
 */
public final class SourceNames {

    public static final String VICTIM_REPORTS = "victim_reports";
    public static final String THREAT_INTELLIGENCE = "threat_intelligence";
    public static final String VASP_REGISTRY = "vasp_registry";
    public static final String ON_CHAIN_ANALYSIS = "on_chain_analysis";
    public static final String USER_REPORTS = "user_reports";
    public static final String EXTERNAL_API = "external_api";
    public static final String MANUAL_INVESTIGATION = "manual_investigation";

    /** Every name accepted in a sources filter. */
    public static final Set<String> ALL = Set.of(
            VICTIM_REPORTS, THREAT_INTELLIGENCE, VASP_REGISTRY, ON_CHAIN_ANALYSIS,
            USER_REPORTS, EXTERNAL_API, MANUAL_INVESTIGATION);

    private SourceNames() {
    }
}
