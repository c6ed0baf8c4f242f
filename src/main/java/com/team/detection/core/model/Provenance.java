package com.team.detection.core.model;

/**
 * Where a related identity was found on a profile.
 */
public enum Provenance {
    /** Listed on the profile's relationship (friends) list. */
    RELATIONSHIP("relationship"),
    /** Authored an annotation (comment) on the profile. */
    ANNOTATION("annotation");

    private final String label;

    Provenance(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
