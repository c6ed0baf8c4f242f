package com.team.detection.graph;

import com.team.detection.core.model.ProfileIdentity;
import com.team.detection.core.model.RelationshipRecord;
import com.team.detection.core.model.VisitSnapshot;
import com.team.detection.crawl.CrawlResult;
import com.team.detection.crawl.DirectMatch;
import com.team.detection.resolve.IdentityResolutionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Builds the relationship graph of a completed crawl in two passes.
 *
 * <ol>
 *   <li>Direct: every roster match recorded during a visit connects the visited profile and the
 *       matched candidate, whether or not the candidate was visited afterwards.</li>
 *   <li>Inferred: two distinct found players are connected when either one appears among the raw
 *       relationship records of the other's snapshot. This recovers links between players that were
 *       each reached through a third profile.</li>
 * </ol>
 *
 * Every found player is a node, so seeds without any match still show up, isolated.
 */
public class GraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    /**
     * Builds the graph.
     *
     * @param result        the crawl output
     * @param identityTable alias bindings of the run, used to match alias-only records in pass 2
     */
    public RelationshipGraph build(CrawlResult result, IdentityResolutionTable identityTable) {
        RelationshipGraph graph = new RelationshipGraph();
        result.foundPlayers().forEach(player -> graph.addNode(player.getDisplayName()));

        int direct = addDirectEdges(graph, result.directMatches());
        int inferred = addInferredEdges(graph, result.snapshots(), identityTable);

        log.info("graph.built nodes={} edges={} direct={} inferred={}",
                graph.nodeCount(), graph.edgeCount(), direct, inferred);
        return graph;
    }

    /**
     * Pass 1.
     *
     * @return number of edges that were new
     */
    int addDirectEdges(RelationshipGraph graph, List<DirectMatch> directMatches) {
        int added = 0;
        for (DirectMatch match : directMatches) {
            String from = match.profile().getDisplayName();
            for (RelationshipRecord candidate : match.matched()) {
                if (graph.addEdge(from, candidate.displayName())) {
                    added++;
                }
            }
        }
        return added;
    }

    /**
     * Pass 2. Pairs are examined in both directions, so a reference from either side is enough.
     *
     * @return number of edges that were new
     */
    int addInferredEdges(RelationshipGraph graph, List<VisitSnapshot> snapshots, IdentityResolutionTable identityTable) {
        int added = 0;
        for (VisitSnapshot outer : snapshots) {
            for (VisitSnapshot inner : snapshots) {
                ProfileIdentity a = outer.profile();
                ProfileIdentity b = inner.profile();
                if (a.sameIdentityAs(b)) {
                    continue;
                }
                if (references(inner, a, identityTable)
                        && graph.addEdge(a.getDisplayName(), b.getDisplayName())) {
                    log.debug("graph.inferred a='{}' b='{}'", a.getDisplayName(), b.getDisplayName());
                    added++;
                }
            }
        }
        return added;
    }

    /**
     * Returns true if the snapshot's raw relationship records denote the target profile, by numeric
     * identifier, by non-empty alias, or by an alias bound to the target's numeric identifier.
     */
    static boolean references(VisitSnapshot snapshot, ProfileIdentity target, IdentityResolutionTable identityTable) {
        if (snapshot.references(target)) {
            return true;
        }
        Optional<String> targetNumeric = target.getNumericId();
        if (targetNumeric.isEmpty()) {
            return false;
        }
        return snapshot.rawRelationships().stream()
                .map(RelationshipRecord::identity)
                .filter(identity -> identity.getNumericId().isEmpty())
                .map(identity -> identity.knownAlias().flatMap(identityTable::numericFor))
                .anyMatch(targetNumeric::equals);
    }
}
