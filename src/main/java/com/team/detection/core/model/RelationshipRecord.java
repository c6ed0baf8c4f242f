package com.team.detection.core.model;

import java.util.Objects;

/**
 * A related identity read from a profile, tagged with where it was found.
 *
 * @param identity   the related profile, usually with only one identifier known
 * @param provenance relationship list or annotation author
 */
public record RelationshipRecord(ProfileIdentity identity, Provenance provenance) {

    public RelationshipRecord {
        Objects.requireNonNull(identity, "identity is required");
        Objects.requireNonNull(provenance, "provenance is required");
    }

    public static RelationshipRecord relationship(ProfileIdentity identity) {
        return new RelationshipRecord(identity, Provenance.RELATIONSHIP);
    }

    public static RelationshipRecord annotation(ProfileIdentity identity) {
        return new RelationshipRecord(identity, Provenance.ANNOTATION);
    }

    public String displayName() {
        return identity.getDisplayName();
    }
}
