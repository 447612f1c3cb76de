package com.osint.correlation.core.model;

import java.util.List;

/**
 * Transient grouping of observations produced by the clustering pass.
 *
 * @param memberObservationIds sorted observation ids
 * @param confidence           aggregate (decayed) confidence of the cluster
 */
public record EntityCluster(List<String> memberObservationIds, double confidence) {

    public EntityCluster {
        if (memberObservationIds == null || memberObservationIds.isEmpty()) {
            throw new IllegalArgumentException("a cluster needs at least one member");
        }
        memberObservationIds = List.copyOf(memberObservationIds);
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "confidence must be between 0.0 and 1.0, got " + confidence);
        }
    }

    public int size() {
        return memberObservationIds.size();
    }
}
