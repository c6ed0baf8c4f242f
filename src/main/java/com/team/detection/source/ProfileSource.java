package com.team.detection.source;

/**
 * Raw page access to the relationship source. Implementations do not cache.
 */
public interface ProfileSource {

    /**
     * Fetches the profile page addressed by numeric identifier.
     */
    String fetchProfile(String numericId);

    /**
     * Fetches the profile page addressed by alias.
     */
    String fetchProfileByAlias(String aliasId);

    /**
     * Fetches the relationship list page of a profile.
     */
    String fetchRelationshipList(String numericId);

    /**
     * Fetches one page of annotations on a profile.
     *
     * @param page 1-based page number
     */
    String fetchAnnotationsPage(String numericId, int page);

    /**
     * Returns the canonical link to a profile, used in reports.
     */
    String profileLink(String numericId);
}
