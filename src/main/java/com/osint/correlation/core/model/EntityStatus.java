package com.osint.correlation.core.model;

/**
 * Lifecycle status of an entity. Entities are never deleted.
 */
public enum EntityStatus {
    /**
     * Live entity, addressable by relationships and queries.
     */
    ACTIVE,

    /**
     * Entity absorbed by another one. Kept for provenance with a back-reference
     * to the entity that absorbed it.
     */
    MERGED
}
