package com.osint.correlation.core.model;

/**
 * Typed, directed links between entities.
 */
public enum RelationshipType {
    SAME_IDENTITY("same_identity"),
    ASSOCIATED_WITH("associated_with"),
    MENTIONS("mentions"),
    FOLLOWS("follows");

    private final String label;

    RelationshipType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
