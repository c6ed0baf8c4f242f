package com.team.detection.extract;

import com.team.detection.core.model.AnnotationPage;
import com.team.detection.core.model.ProfileDetails;
import com.team.detection.core.model.RelationshipRecord;

import java.util.List;

/**
 * Reads profile data out of pages returned by the relationship source.
 */
public interface RelationshipExtractor {

    /**
     * Parses a profile page.
     *
     * @throws ExtractionException if the numeric identifier is missing
     */
    ProfileDetails parseProfile(String content);

    /**
     * Parses a relationship list page. Every record has {@link com.team.detection.core.model.Provenance#RELATIONSHIP}
     * provenance and a numeric identifier; the alias is set when the listing links by alias.
     */
    List<RelationshipRecord> parseRelationshipList(String content);

    /**
     * Parses one page of annotations into its distinct authors.
     */
    AnnotationPage parseAnnotationPage(String content);
}
