package com.team.detection.metrics;

import com.team.detection.cache.PageKind;
import com.team.detection.crawl.VisitOutcome;

import java.time.Duration;

/**
 * Interface for recording crawl metrics.
 * The default {@link NoOpMetricsService} does nothing, so a run works without any registry configured.
 */
public interface MetricsService {

    void recordFetch(PageKind kind);

    void recordCacheHit(PageKind kind);

    void recordCacheMiss(PageKind kind);

    void recordVisit(VisitOutcome outcome);

    void recordCrawlDuration(Duration duration);

    void recordPlayersFound(int count);
}
