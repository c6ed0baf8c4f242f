package com.team.detection.crawl;

import com.team.detection.core.model.ProfileIdentity;

import java.util.Objects;

/**
 * A worklist entry: a profile waiting to be visited at a given depth.
 */
public record PendingVisit(ProfileIdentity identity, int depth) {

    public PendingVisit {
        Objects.requireNonNull(identity, "identity is required");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0");
        }
    }
}
