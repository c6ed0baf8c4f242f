package com.team.detection.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The values a run needs from the user: the roster reference and the seed identities.
 * Serialized as {@code {"battlemetrics_id": "...", "steam_id": ["..."]}}.
 *
 * @param rosterReference session whose roster is matched
 * @param seeds           numeric identifiers or aliases the crawl starts from
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunConfig(
        @JsonProperty("battlemetrics_id") String rosterReference,
        @JsonProperty("steam_id") List<String> seeds
) {
    public RunConfig {
        seeds = seeds != null ? List.copyOf(seeds) : List.of();
    }

    public boolean hasRosterReference() {
        return rosterReference != null && !rosterReference.isBlank();
    }

    public boolean hasSeeds() {
        return !seeds.isEmpty();
    }
}
