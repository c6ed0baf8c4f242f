package com.team.detection.metrics;

import com.team.detection.cache.PageKind;
import com.team.detection.crawl.VisitOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code teamdetector.fetch} - Counter (tag: kind)</li>
 *   <li>{@code teamdetector.cache.hit} - Counter (tag: kind)</li>
 *   <li>{@code teamdetector.cache.miss} - Counter (tag: kind)</li>
 *   <li>{@code teamdetector.visit} - Counter (tag: outcome)</li>
 *   <li>{@code teamdetector.crawl.duration} - Timer</li>
 *   <li>{@code teamdetector.players.found} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer crawlTimer;
    private final DistributionSummary playersFoundSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.crawlTimer = Timer.builder("teamdetector.crawl.duration")
                .description("Duration of a complete crawl")
                .register(registry);
        this.playersFoundSummary = DistributionSummary.builder("teamdetector.players.found")
                .description("Number of players found per crawl")
                .register(registry);
    }

    @Override
    public void recordFetch(PageKind kind) {
        counter("teamdetector.fetch", "kind", kind.name(), "Pages fetched from the relationship source").increment();
    }

    @Override
    public void recordCacheHit(PageKind kind) {
        counter("teamdetector.cache.hit", "kind", kind.name(), "Fetch cache hits").increment();
    }

    @Override
    public void recordCacheMiss(PageKind kind) {
        counter("teamdetector.cache.miss", "kind", kind.name(), "Fetch cache misses").increment();
    }

    @Override
    public void recordVisit(VisitOutcome outcome) {
        counter("teamdetector.visit", "outcome", outcome.name(), "Pending visits by outcome").increment();
    }

    @Override
    public void recordCrawlDuration(Duration duration) {
        crawlTimer.record(duration);
    }

    @Override
    public void recordPlayersFound(int count) {
        playersFoundSummary.record(count);
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        String key = name + ":" + tagValue;
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
