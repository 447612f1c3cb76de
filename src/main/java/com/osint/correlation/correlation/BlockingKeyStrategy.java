package com.osint.correlation.correlation;

import com.osint.correlation.core.model.Observation;

import java.util.Set;

/**
 * Strategy for generating blocking keys from observations.
 * Blocking keys narrow the candidate set for pairwise scoring: only observations that share
 * at least one key are compared, so unrelated observations never cost a comparison.
 */
public interface BlockingKeyStrategy {

    /**
     * @return blocking keys for the observation (never null, may be empty)
     */
    Set<String> generateKeys(Observation observation);
}
