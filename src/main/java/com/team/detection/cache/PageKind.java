package com.team.detection.cache;

/**
 * Kinds of pages held by the fetch cache.
 */
public enum PageKind {
    PROFILE,
    RELATIONSHIP_LIST,
    ANNOTATIONS
}
