package com.osint.correlation.source;

/**
 * Callback a source adapter invokes after each unit of work (typically one site checked).
 */
@FunctionalInterface
public interface SourceProgressCallback {

    /**
     * @param completed units finished so far
     * @param total     total units, or -1 when unknown
     */
    void onProgress(int completed, int total);

    /**
     * A no-op progress callback.
     */
    SourceProgressCallback NOOP = (completed, total) -> {};
}
