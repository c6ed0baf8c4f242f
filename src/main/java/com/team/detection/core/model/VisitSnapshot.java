package com.team.detection.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything gathered while visiting one profile.
 *
 * @param profile          the visited profile, fully resolved
 * @param depth            crawl depth at which the profile was visited
 * @param rawRelationships related identities in the order they were read, relationship list first,
 *                         before deduplication and roster filtering
 */
public record VisitSnapshot(ProfileIdentity profile, int depth, List<RelationshipRecord> rawRelationships) {

    public VisitSnapshot {
        Objects.requireNonNull(profile, "profile is required");
        rawRelationships = rawRelationships != null ? List.copyOf(rawRelationships) : List.of();
    }

    /**
     * Returns true if any raw relationship record denotes the given profile.
     */
    public boolean references(ProfileIdentity other) {
        return rawRelationships.stream().anyMatch(r -> r.identity().sameIdentityAs(other));
    }
}
