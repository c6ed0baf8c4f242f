package com.team.detection.source;

import com.team.detection.extract.ExtractionException;
import com.team.detection.fixtures.FixturePageFetcher;
import com.team.detection.fixtures.SteamPages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BattleMetricsRosterSourceTest {

    @Test
    @DisplayName("Should read player names in document order")
    void readsPlayers() {
        FixturePageFetcher fetcher = new FixturePageFetcher()
                .register(SteamPages.rosterUrl("42"), SteamPages.roster(List.of("Alice", "Bob", "Carol")));

        List<String> roster = new BattleMetricsRosterSource(fetcher).fetchRoster("42");

        assertEquals(List.of("Alice", "Bob", "Carol"), roster);
    }

    @Test
    @DisplayName("Should ignore included resources without a name")
    void skipsNamelessResources() {
        BattleMetricsRosterSource source = new BattleMetricsRosterSource(new FixturePageFetcher());
        String json = "{\"included\":[{\"type\":\"identifier\",\"attributes\":{}},"
                + "{\"type\":\"player\",\"attributes\":{\"name\":\"Alice\"}}]}";

        assertEquals(List.of("Alice"), source.parseRoster(json));
    }

    @Test
    @DisplayName("Should return an empty roster for an empty server")
    void emptyServer() {
        BattleMetricsRosterSource source = new BattleMetricsRosterSource(new FixturePageFetcher());

        assertTrue(source.parseRoster("{\"data\":{\"id\":\"42\"}}").isEmpty());
    }

    @Test
    @DisplayName("Should fail on malformed JSON")
    void malformedJson() {
        BattleMetricsRosterSource source = new BattleMetricsRosterSource(new FixturePageFetcher());

        ExtractionException e = assertThrows(ExtractionException.class, () -> source.parseRoster("<html>"));
        assertEquals("roster", e.getField());
    }

    @Test
    @DisplayName("Should propagate transport failures")
    void transportFailure() {
        BattleMetricsRosterSource source = new BattleMetricsRosterSource(new FixturePageFetcher());

        TransportException e = assertThrows(TransportException.class, () -> source.fetchRoster("404"));
        assertEquals(404, e.getStatusCode().getAsInt());
    }

    @Test
    @DisplayName("Should honour a custom base URL")
    void customBaseUrl() {
        FixturePageFetcher fetcher = new FixturePageFetcher()
                .register("http://localhost:8080/servers/1?include=player", SteamPages.roster(List.of("Alice")));

        assertEquals(List.of("Alice"),
                new BattleMetricsRosterSource(fetcher, "http://localhost:8080/").fetchRoster("1"));
    }
}
