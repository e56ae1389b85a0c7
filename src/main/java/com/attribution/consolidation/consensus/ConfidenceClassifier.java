package com.attribution.consolidation.consensus;

import com.attribution.consolidation.core.model.ConfidenceLevel;

/**
 * Maps a consensus score to an ordinal {@link ConfidenceLevel}, rewarding corroboration.
 *
 * <pre>
 *   sourceBoost   = min(0.20, distinctSources × 0.05)
 *   evidenceBoost = min(0.10, evidenceItems  × 0.02)
 *   final         = clamp(score + sourceBoost + evidenceBoost, 0, 1)
 * </pre>
 */
public class ConfidenceClassifier {

    static final double SOURCE_BOOST_STEP = 0.05;
    static final double SOURCE_BOOST_CAP = 0.20;
    static final double EVIDENCE_BOOST_STEP = 0.02;
    static final double EVIDENCE_BOOST_CAP = 0.10;

    /**
     * Returns the boosted score, clamped to [0, 1].
     */
    public double boostedScore(double consolidationScore, int sourceCount, int evidenceCount) {
        if (sourceCount < 0 || evidenceCount < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
        double sourceBoost = Math.min(SOURCE_BOOST_CAP, sourceCount * SOURCE_BOOST_STEP);
        double evidenceBoost = Math.min(EVIDENCE_BOOST_CAP, evidenceCount * EVIDENCE_BOOST_STEP);
        double boosted = consolidationScore + sourceBoost + evidenceBoost;
        return Math.max(0.0, Math.min(1.0, boosted));
    }

    public ConfidenceLevel classify(double consolidationScore, int sourceCount, int evidenceCount) {
        return ConfidenceLevel.fromScore(boostedScore(consolidationScore, sourceCount, evidenceCount));
    }
}
