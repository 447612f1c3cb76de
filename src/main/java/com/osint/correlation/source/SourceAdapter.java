package com.osint.correlation.source;

import com.osint.correlation.core.model.Observation;

import java.util.List;

/**
 * Query contract for one external data source (username enumeration, social API, DNS...).
 * This is the only way raw data enters the correlation core.
 *
 * <p>Implementations must tolerate concurrent invocation and must ignore
 * {@link SearchOptions} they do not support rather than fail. They report failures by
 * throwing {@link TransientSourceException} (retryable) or {@link PermanentSourceException}.
 * A call may be interrupted when the aggregator's per-call timeout expires.</p>
 */
public interface SourceAdapter {

    /**
     * Stable name of this adapter, used in logs, metrics and error observations.
     */
    String getName();

    /**
     * Queries the source for each value.
     *
     * @param queryValues values to look up (usernames, emails...)
     * @param options     timeout, parallelism hint, site/category filters, sensitivity exclusion
     * @param progress    invoked as {@code (completed, total)} after each unit of work
     * @return observations, one or more per query value
     */
    List<Observation> search(List<String> queryValues, SearchOptions options, SourceProgressCallback progress);

    /**
     * Sites this adapter can query, empty when the notion does not apply.
     */
    List<String> availableSites();

    /**
     * Site categories this adapter can filter on, empty when the notion does not apply.
     */
    List<String> availableCategories();
}
