package com.team.detection.crawl;

import com.team.detection.cache.CacheStats;
import com.team.detection.core.model.ProfileIdentity;
import com.team.detection.core.model.VisitSnapshot;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of a completed crawl.
 *
 * @param foundPlayers  visited profiles in discovery order, each exactly once
 * @param snapshots     one snapshot per found player, in the same order
 * @param directMatches roster matches recorded during the visits
 * @param visitCounts   number of pending visits per outcome
 * @param cacheStats    fetch cache statistics at the end of the crawl
 * @param duration      wall-clock duration of the crawl
 */
public record CrawlResult(
        List<ProfileIdentity> foundPlayers,
        List<VisitSnapshot> snapshots,
        List<DirectMatch> directMatches,
        Map<VisitOutcome, Integer> visitCounts,
        CacheStats cacheStats,
        Duration duration
) {
    public CrawlResult {
        foundPlayers = foundPlayers != null ? List.copyOf(foundPlayers) : List.of();
        snapshots = snapshots != null ? List.copyOf(snapshots) : List.of();
        directMatches = directMatches != null ? List.copyOf(directMatches) : List.of();
        visitCounts = visitCounts != null ? Map.copyOf(visitCounts) : Map.of();
        cacheStats = cacheStats != null ? cacheStats : CacheStats.empty();
        duration = duration != null ? duration : Duration.ZERO;
    }

    public int visitCount(VisitOutcome outcome) {
        return visitCounts.getOrDefault(outcome, 0);
    }

    Optional<VisitSnapshot> snapshotOf(ProfileIdentity profile) {
        return snapshots.stream()
                .filter(s -> s.profile().sameIdentityAs(profile))
                .findFirst();
    }

    public List<String> foundPlayerNames() {
        return foundPlayers.stream().map(ProfileIdentity::getDisplayName).toList();
    }
}
