package com.team.detection.api;

import com.team.detection.core.model.ProfileIdentity;
import com.team.detection.crawl.CrawlResult;
import com.team.detection.graph.RelationshipGraph;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a detection run.
 *
 * @param rosterReference the session the roster was read from
 * @param roster          display names active in the session
 * @param crawl           crawl output
 * @param graph           relationship graph built from the crawl
 */
public record TeamDetectionReport(
        String rosterReference,
        List<String> roster,
        CrawlResult crawl,
        RelationshipGraph graph
) {
    public TeamDetectionReport {
        Objects.requireNonNull(rosterReference, "rosterReference is required");
        Objects.requireNonNull(crawl, "crawl is required");
        Objects.requireNonNull(graph, "graph is required");
        roster = roster != null ? List.copyOf(roster) : List.of();
    }

    public List<ProfileIdentity> foundPlayers() {
        return crawl.foundPlayers();
    }
}
