package com.team.detection.crawl;

import com.team.detection.cache.FetchCache;
import com.team.detection.core.model.ProfileIdentity;
import com.team.detection.core.model.VisitSnapshot;
import com.team.detection.extract.RelationshipExtractor;
import com.team.detection.metrics.MetricsService;
import com.team.detection.resolve.IdentityResolutionTable;
import com.team.detection.resolve.IdentityResolver;
import com.team.detection.source.ProfileSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All mutable state of one detection run: the fetch cache, the identity resolution table, the
 * found players in discovery order, their visit snapshots and the direct matches.
 *
 * A context is created per run and closed when the run ends; nothing in it outlives the run.
 * Found players and snapshots are append-only. {@link #markFound(ProfileIdentity)} is the single
 * check-then-add point that guarantees a profile is visited at most once.
 */
public class CrawlContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CrawlContext.class);

    private final String runId;
    private final IdentityResolutionTable identityTable;
    private final FetchCache fetchCache;
    private final IdentityResolver resolver;

    private final Map<String, ProfileIdentity> foundPlayers = new LinkedHashMap<>();
    private final Map<String, VisitSnapshot> snapshots = new LinkedHashMap<>();
    private final List<DirectMatch> directMatches = new ArrayList<>();
    private final Map<VisitOutcome, Integer> visitCounts = new EnumMap<>(VisitOutcome.class);

    public CrawlContext(String runId, ProfileSource source, RelationshipExtractor extractor,
                        MetricsService metricsService) {
        this.runId = runId;
        this.identityTable = new IdentityResolutionTable();
        this.fetchCache = new FetchCache(source, extractor, identityTable, metricsService);
        this.resolver = new IdentityResolver(fetchCache, identityTable);
    }

    public IdentityResolver getResolver() {
        return resolver;
    }

    public FetchCache getFetchCache() {
        return fetchCache;
    }

    public IdentityResolutionTable getIdentityTable() {
        return identityTable;
    }

    public synchronized boolean isFound(String numericId) {
        return foundPlayers.containsKey(numericId);
    }

    /**
     * Adds a profile to the found players.
     *
     * @return false if a profile with the same numeric identifier was already found
     */
    public synchronized boolean markFound(ProfileIdentity profile) {
        String numericId = profile.getNumericId()
                .orElseThrow(() -> new IllegalArgumentException("found player needs a numeric identifier"));
        return foundPlayers.putIfAbsent(numericId, profile) == null;
    }

    public synchronized void recordSnapshot(VisitSnapshot snapshot) {
        String numericId = snapshot.profile().getNumericId().orElseThrow();
        if (snapshots.putIfAbsent(numericId, snapshot) != null) {
            throw new IllegalStateException("snapshot already recorded for " + numericId);
        }
    }

    public synchronized void recordDirectMatch(DirectMatch match) {
        directMatches.add(match);
    }

    public synchronized void countVisit(VisitOutcome outcome) {
        visitCounts.merge(outcome, 1, Integer::sum);
    }

    public synchronized Collection<ProfileIdentity> getFoundPlayers() {
        return List.copyOf(foundPlayers.values());
    }

    public synchronized Optional<VisitSnapshot> getSnapshot(String numericId) {
        return Optional.ofNullable(snapshots.get(numericId));
    }

    public synchronized List<VisitSnapshot> getSnapshots() {
        return List.copyOf(snapshots.values());
    }

    public synchronized List<DirectMatch> getDirectMatches() {
        return List.copyOf(directMatches);
    }

    public synchronized Map<VisitOutcome, Integer> getVisitCounts() {
        return Collections.unmodifiableMap(new EnumMap<>(visitCounts));
    }

    @Override
    public void close() {
        fetchCache.invalidateAll();
        log.debug("crawl.context.closed runId={}", runId);
    }
}
