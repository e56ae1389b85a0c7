package com.attribution.consolidation.source;

import com.attribution.consolidation.core.model.Attribution;

import java.util.List;

/**
 * Normalizes one intelligence source into {@link Attribution}s.
 *
 * <p>Implementations are best-effort: a failing collaborator yields an empty list,
 * never an exception, so one degraded source cannot block consolidation.</p>
 */
public interface SourceAdapter {

    /**
     * Source name stamped on every contribution this adapter produces.
     */
    String sourceName();

    /**
     * Fetches this source's attributions for an address.
     *
     * @return attributions, possibly empty; never null
     */
    List<Attribution> fetch(String address, String blockchain);
}
