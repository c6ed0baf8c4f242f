package com.team.detection.cli;

import com.team.detection.api.TeamDetector;
import com.team.detection.config.RunConfig;
import com.team.detection.config.RunConfigStore;
import com.team.detection.fixtures.FixturePageFetcher;
import com.team.detection.fixtures.SteamNetwork;
import com.team.detection.fixtures.SteamNetwork.Player;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TeamDetectorCliTest {

    @TempDir
    Path tempDir;

    private FixturePageFetcher fetcher;
    private RunConfigStore store;
    private ByteArrayOutputStream out;

    @BeforeEach
    void setUp() {
        SteamNetwork network = new SteamNetwork();
        Player alice = network.player("76561198000000001", "Alice");
        Player bob = network.player("76561198000000002", "Bob");
        alice.friends(bob);
        network.server("42", "Alice", "Bob");
        fetcher = network.fetcher();
        store = new RunConfigStore(tempDir.resolve("team_detector.json"));
        out = new ByteArrayOutputStream();
    }

    private int execute(String... args) {
        CliArguments arguments = CliArguments.parse(args);
        TeamDetector.Builder detector = TeamDetector.builder().steamCommunity(fetcher);
        return TeamDetectorCli.execute(arguments, store, detector, new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should print the table, write the graph and store the configuration")
    void successfulRun() throws IOException {
        Path graph = tempDir.resolve("graph.html");

        int status = execute("-b", "42", "-s", "76561198000000001", "-o", graph.toString());

        assertEquals(TeamDetectorCli.EXIT_OK, status);
        String table = out.toString(StandardCharsets.UTF_8);
        assertTrue(table.contains("Alice"));
        assertTrue(table.contains("https://steamcommunity.com/profiles/76561198000000002/?l=english"));
        assertTrue(Files.readString(graph).contains("\"from\":\"Alice\",\"to\":\"Bob\""));
        assertEquals(new RunConfig("42", List.of("76561198000000001")), store.read().orElseThrow());
    }

    @Test
    @DisplayName("Should fall back to the stored configuration")
    void storedConfiguration() {
        store.write(new RunConfig("42", List.of("76561198000000001")));

        int status = execute("-o", tempDir.resolve("graph.html").toString());

        assertEquals(TeamDetectorCli.EXIT_OK, status);
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Bob"));
    }

    @Test
    @DisplayName("Should exit with the configuration status before any request")
    void missingConfiguration() {
        int status = execute("-s", "76561198000000001");

        assertEquals(TeamDetectorCli.EXIT_CONFIGURATION, status);
        assertTrue(fetcher.getRequests().isEmpty());
    }

    @Test
    @DisplayName("Should exit with the failure status and keep the old configuration when a fetch fails")
    void fetchFailure() {
        int status = execute("-b", "404", "-s", "76561198000000001", "-o", tempDir.resolve("graph.html").toString());

        assertEquals(TeamDetectorCli.EXIT_FAILURE, status);
        assertTrue(store.read().isEmpty());
    }

    @Test
    @DisplayName("Should exit with the failure status and keep the old configuration when the graph cannot be written")
    void outputFailure() {
        Path graph = tempDir.resolve("missing").resolve("dir").resolve("graph.html");

        int status = execute("-b", "42", "-s", "76561198000000001", "-o", graph.toString());

        assertEquals(TeamDetectorCli.EXIT_FAILURE, status);
        assertFalse(Files.exists(graph));
        assertTrue(store.read().isEmpty());
    }

    @Test
    @DisplayName("Should print usage for help and for bad arguments")
    void usage() {
        PrintStream stream = new PrintStream(out, true, StandardCharsets.UTF_8);

        assertEquals(TeamDetectorCli.EXIT_OK, TeamDetectorCli.run(new String[]{"-h"}, stream));
        assertEquals(TeamDetectorCli.EXIT_CONFIGURATION, TeamDetectorCli.run(new String[]{"--bogus"}, stream));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("--battlemetrics-id"));
    }
}
