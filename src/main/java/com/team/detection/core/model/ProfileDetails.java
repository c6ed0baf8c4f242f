package com.team.detection.core.model;

import java.util.Objects;

/**
 * Fields read from a profile page.
 *
 * @param numericId            permanent identifier, always present
 * @param aliasId              alias, or empty string if the profile has none
 * @param displayName          current display name, empty if it could not be read
 * @param relationshipsPublic  whether the relationship list is visible
 * @param annotationsPublic    whether annotations are visible
 * @param annotationTotalCount total number of annotations reported by the profile
 */
public record ProfileDetails(
        String numericId,
        String aliasId,
        String displayName,
        boolean relationshipsPublic,
        boolean annotationsPublic,
        int annotationTotalCount
) {
    public ProfileDetails {
        Objects.requireNonNull(numericId, "numericId is required");
        aliasId = aliasId != null ? aliasId : "";
        displayName = displayName != null ? displayName : "";
        if (annotationTotalCount < 0) {
            throw new IllegalArgumentException("annotationTotalCount must be >= 0");
        }
    }
}
