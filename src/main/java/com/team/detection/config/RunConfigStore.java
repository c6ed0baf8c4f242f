package com.team.detection.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists the last used {@link RunConfig} as a JSON file so that later runs can omit the values.
 *
 * <p>Resolution order per field: command line first, then the stored file. A field missing from
 * both is a {@link ConfigurationException}.</p>
 */
public class RunConfigStore {
    private static final Logger log = LoggerFactory.getLogger(RunConfigStore.class);

    public static final String DEFAULT_FILE_NAME = "team_detector.json";

    private final Path path;
    private final ObjectMapper objectMapper;

    public RunConfigStore(Path path) {
        this.path = Objects.requireNonNull(path, "path is required");
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static RunConfigStore inWorkingDirectory() {
        return new RunConfigStore(Path.of(DEFAULT_FILE_NAME));
    }

    /**
     * Reads the stored configuration.
     *
     * @return empty if the file does not exist
     * @throws ConfigurationException if the file exists but cannot be read or parsed
     */
    public Optional<RunConfig> read() {
        if (!Files.exists(path)) {
            log.debug("config.absent path={}", path);
            return Optional.empty();
        }
        try {
            RunConfig config = objectMapper.readValue(Files.readString(path, StandardCharsets.UTF_8), RunConfig.class);
            log.debug("config.read path={} roster={} seeds={}", path, config.rosterReference(), config.seeds());
            return Optional.of(config);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration file " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read configuration file " + path, e);
        }
    }

    /**
     * Writes the configuration, replacing any previous file.
     */
    public void write(RunConfig config) {
        try {
            Files.writeString(path, objectMapper.writeValueAsString(config), StandardCharsets.UTF_8);
            log.debug("config.written path={}", path);
        } catch (IOException e) {
            throw new ConfigurationException("Could not write configuration file " + path, e);
        }
    }

    /**
     * Merges command-line values over the stored configuration.
     *
     * @param rosterReference roster reference from the command line, or null
     * @param seeds           seeds from the command line, or null/empty
     * @param stored          previously stored configuration
     * @throws ConfigurationException if either field is supplied by neither source
     */
    public static RunConfig resolve(String rosterReference, List<String> seeds, Optional<RunConfig> stored) {
        String resolvedRoster = rosterReference != null && !rosterReference.isBlank()
                ? rosterReference
                : stored.filter(RunConfig::hasRosterReference).map(RunConfig::rosterReference)
                .orElseThrow(() -> new ConfigurationException(
                        "No roster reference given and none stored; pass -b/--battlemetrics-id"));

        List<String> resolvedSeeds = seeds != null && !seeds.isEmpty()
                ? seeds
                : stored.filter(RunConfig::hasSeeds).map(RunConfig::seeds)
                .orElseThrow(() -> new ConfigurationException(
                        "No seed identities given and none stored; pass -s/--steam-id"));

        return new RunConfig(resolvedRoster, resolvedSeeds);
    }
}
