package com.team.detection.crawl;

import com.team.detection.core.model.RelationshipRecord;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps the related identities whose display name is on the session roster.
 *
 * Matching is exact string equality on the display name, the only field the roster exposes.
 * Two different profiles sharing a display name are therefore indistinguishable here.
 */
public class RosterMatcher {

    private final Set<String> roster;

    public RosterMatcher(Collection<String> roster) {
        this.roster = new LinkedHashSet<>(roster);
    }

    public boolean isOnRoster(String displayName) {
        return roster.contains(displayName);
    }

    public List<RelationshipRecord> match(List<RelationshipRecord> candidates) {
        return candidates.stream()
                .filter(candidate -> isOnRoster(candidate.displayName()))
                .toList();
    }

    public int size() {
        return roster.size();
    }
}
