package com.osint.correlation.graph;

/**
 * A graph write would break a data invariant: a relationship to a missing or merged entity,
 * or a merge of an entity into itself. The write is rejected before any mutation.
 */
public class GraphInvariantException extends RuntimeException {

    public GraphInvariantException(String message) {
        super(message);
    }
}
