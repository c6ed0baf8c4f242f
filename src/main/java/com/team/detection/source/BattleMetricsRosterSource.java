package com.team.detection.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.detection.extract.ExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link RosterSource} reading the player list of a BattleMetrics server.
 * Player names are taken from {@code included[*].attributes.name}.
 */
public class BattleMetricsRosterSource implements RosterSource {
    private static final Logger log = LoggerFactory.getLogger(BattleMetricsRosterSource.class);

    public static final String DEFAULT_BASE_URL = "https://api.battlemetrics.com";

    private final PageFetcher fetcher;
    private final String baseUrl;
    private final ObjectMapper objectMapper;

    public BattleMetricsRosterSource(PageFetcher fetcher) {
        this(fetcher, DEFAULT_BASE_URL);
    }

    public BattleMetricsRosterSource(PageFetcher fetcher, String baseUrl) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<String> fetchRoster(String rosterReference) {
        String content = fetcher.fetch(baseUrl + "/servers/" + rosterReference + "?include=player");
        List<String> players = parseRoster(content);
        log.info("roster.fetched server={} players={}", rosterReference, players.size());
        return players;
    }

    /**
     * Parses a server document into player names.
     *
     * @throws ExtractionException if the document is not valid JSON
     */
    List<String> parseRoster(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("roster", "Roster document is not valid JSON: " + e.getOriginalMessage(), e);
        }

        List<String> players = new ArrayList<>();
        for (JsonNode included : root.path("included")) {
            JsonNode name = included.path("attributes").path("name");
            if (name.isTextual()) {
                players.add(name.asText());
            }
        }
        return players;
    }
}
