package com.team.detection.cache;

import java.util.Objects;

/**
 * Cache key for a fetched page. Profiles and relationship lists use page 0;
 * annotation pages are keyed by their 1-based page number.
 *
 * @param kind      the page kind
 * @param numericId numeric identifier of the profile the page belongs to
 * @param page      page number
 */
public record PageKey(PageKind kind, String numericId, int page) {

    public PageKey {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(numericId, "numericId is required");
    }

    public static PageKey profile(String numericId) {
        return new PageKey(PageKind.PROFILE, numericId, 0);
    }

    public static PageKey relationshipList(String numericId) {
        return new PageKey(PageKind.RELATIONSHIP_LIST, numericId, 0);
    }

    public static PageKey annotations(String numericId, int page) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        return new PageKey(PageKind.ANNOTATIONS, numericId, page);
    }
}
