package com.team.detection.crawl;

import com.team.detection.core.model.ProfileIdentity;
import com.team.detection.core.model.RelationshipRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * List helpers applied to the candidates gathered during one visit. All comparisons use
 * {@link ProfileIdentity#sameIdentityAs(ProfileIdentity)}; display names are never compared.
 */
final class Candidates {

    private Candidates() {
    }

    /**
     * Removes later duplicates, keeping the first occurrence of each identity.
     */
    static List<RelationshipRecord> deduplicate(List<RelationshipRecord> candidates) {
        List<RelationshipRecord> distinct = new ArrayList<>();
        for (RelationshipRecord candidate : candidates) {
            boolean seen = distinct.stream().anyMatch(d -> d.identity().sameIdentityAs(candidate.identity()));
            if (!seen) {
                distinct.add(candidate);
            }
        }
        return distinct;
    }

    /**
     * Removes every candidate denoting the visited profile itself.
     */
    static List<RelationshipRecord> excludeSelf(ProfileIdentity self, List<RelationshipRecord> candidates) {
        return candidates.stream()
                .filter(candidate -> !candidate.identity().sameIdentityAs(self))
                .toList();
    }

    /**
     * Removes every candidate denoting a profile that has already been visited.
     */
    static List<RelationshipRecord> excludeFound(List<RelationshipRecord> candidates,
                                                 Collection<ProfileIdentity> found) {
        return candidates.stream()
                .filter(candidate -> found.stream().noneMatch(f -> f.sameIdentityAs(candidate.identity())))
                .toList();
    }
}
