package com.team.detection.crawl;

/**
 * Terminal state of one pending visit.
 */
public enum VisitOutcome {
    /** Profile was fully visited and added to the found players. */
    VISITED,
    /** Profile had already been visited. */
    SKIPPED,
    /** Maximum depth reached; the profile was not visited. */
    STOPPED
}
