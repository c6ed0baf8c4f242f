package com.team.detection.metrics;

import com.team.detection.cache.PageKind;
import com.team.detection.crawl.VisitOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordFetch(PageKind kind) {
    }

    @Override
    public void recordCacheHit(PageKind kind) {
    }

    @Override
    public void recordCacheMiss(PageKind kind) {
    }

    @Override
    public void recordVisit(VisitOutcome outcome) {
    }

    @Override
    public void recordCrawlDuration(Duration duration) {
    }

    @Override
    public void recordPlayersFound(int count) {
    }
}
