package com.team.detection.crawl;

import com.team.detection.core.model.ProfileIdentity;
import com.team.detection.core.model.RelationshipRecord;

import java.util.List;
import java.util.Objects;

/**
 * Roster-matched candidates of one visited profile, recorded at the moment the match occurred
 * and regardless of whether each candidate is visited later.
 *
 * @param profile the visited profile
 * @param matched deduplicated, self-excluded candidates whose display name is on the roster
 */
public record DirectMatch(ProfileIdentity profile, List<RelationshipRecord> matched) {

    public DirectMatch {
        Objects.requireNonNull(profile, "profile is required");
        matched = matched != null ? List.copyOf(matched) : List.of();
    }
}
