package com.team.detection.cache;

/**
 * Fetch cache metrics.
 *
 * @param hitCount  number of cache hits
 * @param missCount number of lookups by numeric key that missed
 * @param size      current number of cached pages
 */
public record CacheStats(long hitCount, long missCount, long size) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0);
    }
}
