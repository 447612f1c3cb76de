package com.osint.correlation.core.model;

/**
 * Kinds of fused identities held in the relationship graph.
 */
public enum EntityType {
    USERNAME("Username"),
    EMAIL("Email"),
    DOMAIN("Domain"),
    IP("Ip"),
    PERSON("Person");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
