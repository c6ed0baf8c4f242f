package com.team.detection.source;

import java.util.List;

/**
 * Supplies the display names of the participants currently active in a session.
 */
@FunctionalInterface
public interface RosterSource {

    /**
     * Fetches the current roster.
     *
     * @param rosterReference server or session reference
     * @return display names in the order reported by the source
     */
    List<String> fetchRoster(String rosterReference);
}
