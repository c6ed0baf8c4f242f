package com.team.detection.api;

import com.team.detection.config.ConfigurationException;
import com.team.detection.core.model.ProfileIdentity;
import com.team.detection.crawl.CrawlOptions;
import com.team.detection.crawl.VisitOutcome;
import com.team.detection.fixtures.FixturePageFetcher;
import com.team.detection.fixtures.SteamNetwork;
import com.team.detection.fixtures.SteamNetwork.Player;
import com.team.detection.fixtures.SteamPages;
import com.team.detection.source.RosterSource;
import com.team.detection.source.SteamProfileSource;
import com.team.detection.source.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TeamDetectorTest {

    private SteamNetwork network;

    @BeforeEach
    void setUp() {
        network = new SteamNetwork();
    }

    @Nested
    @DisplayName("Detection")
    class DetectionTests {

        @Test
        @DisplayName("Should find the team and connect it")
        void aliceBobDan() {
            Player alice = network.player("1", "Alice");
            Player bob = network.player("2", "Bob");
            Player dan = network.player("3", "Dan");
            alice.friends(bob, dan);
            bob.friends(dan, alice);
            network.server("42", "Alice", "Bob", "Carol");

            TeamDetectionReport report = TeamDetector.builder()
                    .steamCommunity(network.fetcher())
                    .build()
                    .detect("42", List.of("1"));

            assertEquals(List.of("Alice", "Bob", "Carol"), report.roster());
            assertEquals(List.of("Alice", "Bob"), report.crawl().foundPlayerNames());
            assertTrue(report.graph().hasEdge("Alice", "Bob"));
            assertEquals(1, report.graph().edgeCount());
            assertFalse(report.graph().hasNode("Dan"));
        }

        @Test
        @DisplayName("Should infer edges between found players that never matched each other")
        void inferredEdge() {
            Player bob = network.player("2", "Bob");
            Player carol = network.player("3", "Carol");
            bob.friends(carol);
            network.server("42", "Alice");

            TeamDetectionReport report = TeamDetector.builder()
                    .steamCommunity(network.fetcher())
                    .build()
                    .detect("42", List.of("2", "3"));

            assertTrue(report.crawl().directMatches().stream().allMatch(m -> m.matched().isEmpty()));
            assertTrue(report.graph().hasEdge("Bob", "Carol"));
            assertEquals(1, report.graph().edgeCount());
        }

        @Test
        @DisplayName("Should resolve alias seeds before crawling")
        void aliasSeed() {
            Player alice = network.player("1", "Alice").alias("alice");
            Player bob = network.player("2", "Bob");
            alice.friends(bob);
            network.server("42", "Alice", "Bob");
            FixturePageFetcher fetcher = network.fetcher();

            TeamDetectionReport report = TeamDetector.builder()
                    .steamCommunity(fetcher)
                    .build()
                    .detect("42", List.of("alice", "1"));

            assertEquals(List.of("Alice", "Bob"), report.crawl().foundPlayerNames());
            assertEquals(1, report.crawl().visitCount(VisitOutcome.SKIPPED));
            assertEquals(1, fetcher.requestCount(SteamPages.aliasUrl("alice")));
            assertEquals(0, fetcher.requestCount(SteamPages.profileUrl("1")));
        }

        @Test
        @DisplayName("Should show an isolated seed as a lone node")
        void isolatedSeed() {
            network.player("7", "Ghost").friendsPrivate();
            network.server("42", "Alice");

            TeamDetectionReport report = TeamDetector.builder()
                    .steamCommunity(network.fetcher())
                    .options(CrawlOptions.builder().includeAnnotations(true).build())
                    .build()
                    .detect("42", List.of("7"));

            assertTrue(report.graph().hasNode("Ghost"));
            assertEquals(0, report.graph().edgeCount());
        }

        @Test
        @DisplayName("Should start each run with an empty cache")
        void freshStatePerRun() {
            network.player("1", "Alice");
            network.server("42", "Alice");
            FixturePageFetcher fetcher = network.fetcher();
            TeamDetector detector = TeamDetector.builder().steamCommunity(fetcher).build();

            detector.detect("42", List.of("1"));
            detector.detect("42", List.of("1"));

            assertEquals(2, fetcher.requestCount(SteamPages.profileUrl("1")));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should reject missing input before any network activity")
        void validatesInput() {
            RosterSource rosterSource = mock(RosterSource.class);
            TeamDetector detector = TeamDetector.builder()
                    .profileSource(new SteamProfileSource(new FixturePageFetcher()))
                    .rosterSource(rosterSource)
                    .build();

            assertThrows(ConfigurationException.class, () -> detector.detect(" ", List.of("1")));
            assertThrows(ConfigurationException.class, () -> detector.detect("42", List.of()));
            assertThrows(ConfigurationException.class, () -> detector.detect("42", List.of("")));
            verifyNoInteractions(rosterSource);
        }

        @Test
        @DisplayName("Should propagate a roster fetch failure")
        void rosterFailure() {
            network.player("1", "Alice");

            TeamDetector detector = TeamDetector.builder().steamCommunity(network.fetcher()).build();

            assertThrows(TransportException.class, () -> detector.detect("404", List.of("1")));
        }

        @Test
        @DisplayName("Should require both sources")
        void builderValidation() {
            assertThrows(IllegalStateException.class, () -> TeamDetector.builder().build());
        }
    }

    @Test
    @DisplayName("Should treat digit-only seeds as numeric identifiers")
    void parseSeed() {
        ProfileIdentity numeric = TeamDetector.parseSeed(" 76561198000000001 ");
        ProfileIdentity alias = TeamDetector.parseSeed("gamer123");

        assertEquals("76561198000000001", numeric.getNumericId().orElseThrow());
        assertEquals("gamer123", alias.knownAlias().orElseThrow());
        assertTrue(alias.getNumericId().isEmpty());
    }
}
