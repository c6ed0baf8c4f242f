package com.team.detection.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.team.detection.core.model.ProfileDetails;
import com.team.detection.extract.RelationshipExtractor;
import com.team.detection.metrics.MetricsService;
import com.team.detection.resolve.IdentityResolutionTable;
import com.team.detection.source.ProfileSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Caffeine-backed memo of pages fetched from the relationship source, keyed by numeric identifier.
 * Profile pages are parsed on arrival and their {@link ProfileDetails} kept alongside the page.
 *
 * Entries never expire and are never evicted: a page is fetched at most once per run. Failed fetches
 * are not cached; the {@link com.team.detection.source.TransportException} propagates to the caller.
 * Every profile page that passes through the cache also records its alias binding in the
 * {@link IdentityResolutionTable}.
 */
public class FetchCache {
    private static final Logger log = LoggerFactory.getLogger(FetchCache.class);

    private final Cache<PageKey, String> cache;
    private final Cache<String, ProfileDetails> details;
    private final ProfileSource source;
    private final RelationshipExtractor extractor;
    private final IdentityResolutionTable identityTable;
    private final MetricsService metricsService;

    public FetchCache(ProfileSource source, RelationshipExtractor extractor,
                      IdentityResolutionTable identityTable, MetricsService metricsService) {
        this.source = Objects.requireNonNull(source, "source is required");
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        this.identityTable = Objects.requireNonNull(identityTable, "identityTable is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.cache = Caffeine.newBuilder()
                .recordStats()
                .build();
        this.details = Caffeine.newBuilder().build();
    }

    /**
     * Returns the details of a profile, fetching and parsing its page on first use.
     */
    public ProfileDetails getProfileDetails(String numericId) {
        PageKey key = PageKey.profile(numericId);
        String cached = lookup(key);
        ProfileDetails known = details.getIfPresent(numericId);
        if (cached != null && known != null) {
            return known;
        }
        String content = cached != null ? cached : fetch(key, () -> source.fetchProfile(numericId));
        return remember(content);
    }

    /**
     * Returns the details of a profile addressed by alias. When the alias is already bound, this is
     * served through the numeric key; otherwise the page is fetched by alias, its numeric identifier
     * extracted, the binding recorded and the page cached under the numeric key.
     *
     * @throws com.team.detection.extract.ExtractionException if the page carries no numeric identifier
     */
    public ProfileDetails getProfileDetailsByAlias(String aliasId) {
        String knownNumeric = identityTable.numericFor(aliasId).orElse(null);
        if (knownNumeric != null) {
            return getProfileDetails(knownNumeric);
        }

        metricsService.recordCacheMiss(PageKind.PROFILE);
        metricsService.recordFetch(PageKind.PROFILE);
        log.debug("cache.miss kind=PROFILE alias={}", aliasId);
        String content = source.fetchProfileByAlias(aliasId);

        ProfileDetails parsed = remember(content);
        identityTable.record(aliasId, parsed.numericId());
        cache.asMap().putIfAbsent(PageKey.profile(parsed.numericId()), content);
        return parsed;
    }

    /**
     * Returns the relationship list page of a profile, fetching it on first use.
     */
    public String getRelationshipList(String numericId) {
        PageKey key = PageKey.relationshipList(numericId);
        String cached = lookup(key);
        return cached != null ? cached : fetch(key, () -> source.fetchRelationshipList(numericId));
    }

    /**
     * Returns one annotation page of a profile, fetching it on first use.
     */
    public String getAnnotationsPage(String numericId, int page) {
        PageKey key = PageKey.annotations(numericId, page);
        String cached = lookup(key);
        return cached != null ? cached : fetch(key, () -> source.fetchAnnotationsPage(numericId, page));
    }

    boolean contains(PageKey key) {
        return cache.asMap().containsKey(key);
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(caffeineStats.hitCount(), caffeineStats.missCount(), cache.estimatedSize());
    }

    public void invalidateAll() {
        cache.invalidateAll();
        details.invalidateAll();
        log.debug("cache.cleared");
    }

    // Each profile page is parsed once; later lookups reuse the details
    private ProfileDetails remember(String content) {
        ProfileDetails parsed = extractor.parseProfile(content);
        identityTable.record(parsed.aliasId(), parsed.numericId());
        details.put(parsed.numericId(), parsed);
        return parsed;
    }

    private String lookup(PageKey key) {
        String cached = cache.getIfPresent(key);
        if (cached != null) {
            metricsService.recordCacheHit(key.kind());
            log.debug("cache.hit kind={} numericId={} page={}", key.kind(), key.numericId(), key.page());
        } else {
            metricsService.recordCacheMiss(key.kind());
            log.debug("cache.miss kind={} numericId={} page={}", key.kind(), key.numericId(), key.page());
        }
        return cached;
    }

    private String fetch(PageKey key, Supplier<String> fetcher) {
        metricsService.recordFetch(key.kind());
        String content = fetcher.get();
        cache.put(key, content);
        return content;
    }
}
