package com.attribution.consolidation.consensus;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Agreement verdict for one address. Exactly one of the two sets is non-empty.
 */
public record ConflictAssessment(SortedSet<String> supportingSources, SortedSet<String> conflictingSources) {

    public ConflictAssessment {
        supportingSources = Collections.unmodifiableSortedSet(new TreeSet<>(supportingSources));
        conflictingSources = Collections.unmodifiableSortedSet(new TreeSet<>(conflictingSources));
    }

    static ConflictAssessment supporting(Set<String> sources) {
        return new ConflictAssessment(new TreeSet<>(sources), new TreeSet<>());
    }

    static ConflictAssessment conflicting(Set<String> sources) {
        return new ConflictAssessment(new TreeSet<>(), new TreeSet<>(sources));
    }

    public boolean hasConflicts() {
        return !conflictingSources.isEmpty();
    }
}
