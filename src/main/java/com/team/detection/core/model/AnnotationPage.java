package com.team.detection.core.model;

import java.util.List;

/**
 * Authors read from one page of a profile's annotations.
 *
 * @param authorsRead number of author entries on the page, counted before deduplication
 * @param authors     distinct authors on the page
 */
public record AnnotationPage(int authorsRead, List<RelationshipRecord> authors) {

    public AnnotationPage {
        authors = authors != null ? List.copyOf(authors) : List.of();
    }

    public static AnnotationPage empty() {
        return new AnnotationPage(0, List.of());
    }
}
