package com.team.detection.api;

import com.team.detection.config.ConfigurationException;
import com.team.detection.core.model.ProfileIdentity;
import com.team.detection.crawl.CrawlContext;
import com.team.detection.crawl.CrawlEngine;
import com.team.detection.crawl.CrawlOptions;
import com.team.detection.crawl.CrawlResult;
import com.team.detection.crawl.RosterMatcher;
import com.team.detection.extract.RelationshipExtractor;
import com.team.detection.extract.SteamRelationshipExtractor;
import com.team.detection.graph.GraphBuilder;
import com.team.detection.graph.RelationshipGraph;
import com.team.detection.logging.LogContext;
import com.team.detection.metrics.MetricsService;
import com.team.detection.metrics.NoOpMetricsService;
import com.team.detection.source.BattleMetricsRosterSource;
import com.team.detection.source.PageFetcher;
import com.team.detection.source.ProfileSource;
import com.team.detection.source.RosterSource;
import com.team.detection.source.SteamProfileSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Main entry point: detects the team structure among the players of a session.
 *
 * <p>A detector is stateless between runs. Each call to {@link #detect(String, List)} creates its own
 * {@link CrawlContext} (fetch cache, identity table, found players) and discards it when the run ends.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * TeamDetector detector = TeamDetector.builder()
 *     .steamCommunity(HttpPageFetcher.createDefault())
 *     .options(CrawlOptions.builder().maxDepth(3).includeAnnotations(true).build())
 *     .build();
 *
 * TeamDetectionReport report = detector.detect("1234567", List.of("76561198000000001", "some_alias"));
 * report.graph().getEdges().forEach(System.out::println);
 * </pre>
 */
public class TeamDetector {
    private static final Logger log = LoggerFactory.getLogger(TeamDetector.class);

    private static final Pattern NUMERIC_SEED = Pattern.compile("\\d+");

    private final ProfileSource profileSource;
    private final RosterSource rosterSource;
    private final RelationshipExtractor extractor;
    private final CrawlOptions options;
    private final MetricsService metricsService;
    private final CrawlEngine crawlEngine;
    private final GraphBuilder graphBuilder;

    private TeamDetector(Builder builder) {
        this.profileSource = builder.profileSource;
        this.rosterSource = builder.rosterSource;
        this.extractor = builder.extractor != null ? builder.extractor : new SteamRelationshipExtractor();
        this.options = builder.options;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.crawlEngine = new CrawlEngine(options, extractor, metricsService);
        this.graphBuilder = new GraphBuilder();
    }

    /**
     * Runs one detection: reads the roster, crawls from the seeds and builds the relationship graph.
     *
     * @param rosterReference session whose roster is matched
     * @param seeds           numeric identifiers (digits only) or aliases
     * @throws ConfigurationException if the roster reference or the seeds are missing
     * @throws com.team.detection.source.TransportException if any fetch fails
     * @throws com.team.detection.extract.ExtractionException if a profile carries no numeric identifier
     */
    public TeamDetectionReport detect(String rosterReference, List<String> seeds) {
        validate(rosterReference, seeds);
        String runId = LogContext.generateRunId();

        try (LogContext ignored = LogContext.forRun(runId, rosterReference)) {
            log.info("detect.started roster={} seeds={} options={}", rosterReference, seeds, options);
            List<String> roster = rosterSource.fetchRoster(rosterReference);

            try (CrawlContext context = new CrawlContext(runId, profileSource, extractor, metricsService)) {
                List<ProfileIdentity> seedIdentities = new ArrayList<>();
                for (String seed : seeds) {
                    seedIdentities.add(context.getResolver().withNumericId(parseSeed(seed)));
                }

                CrawlResult result = crawlEngine.crawl(context, new RosterMatcher(roster), seedIdentities);
                RelationshipGraph graph = graphBuilder.build(result, context.getIdentityTable());

                log.info("detect.completed found={} edges={}", result.foundPlayers().size(), graph.edgeCount());
                return new TeamDetectionReport(rosterReference, roster, result, graph);
            }
        }
    }

    /**
     * Parses a user-supplied seed: digits only is a numeric identifier, anything else an alias.
     */
    static ProfileIdentity parseSeed(String seed) {
        String trimmed = seed.trim();
        return NUMERIC_SEED.matcher(trimmed).matches()
                ? ProfileIdentity.ofNumeric(trimmed, "")
                : ProfileIdentity.ofAlias(trimmed, "");
    }

    private static void validate(String rosterReference, List<String> seeds) {
        if (rosterReference == null || rosterReference.isBlank()) {
            throw new ConfigurationException("rosterReference is required");
        }
        if (seeds == null || seeds.isEmpty()) {
            throw new ConfigurationException("at least one seed identity is required");
        }
        for (String seed : seeds) {
            if (seed == null || seed.isBlank()) {
                throw new ConfigurationException("seed identities cannot be blank");
            }
        }
    }

    public ProfileSource getProfileSource() {
        return profileSource;
    }

    public CrawlOptions getOptions() {
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for TeamDetector.
     */
    public static class Builder {
        private ProfileSource profileSource;
        private RosterSource rosterSource;
        private RelationshipExtractor extractor;
        private CrawlOptions options = CrawlOptions.defaults();
        private MetricsService metricsService;

        /**
         * Sets the relationship source.
         */
        public Builder profileSource(ProfileSource profileSource) {
            this.profileSource = profileSource;
            return this;
        }

        /**
         * Sets the roster source.
         */
        public Builder rosterSource(RosterSource rosterSource) {
            this.rosterSource = rosterSource;
            return this;
        }

        /**
         * Uses Steam Community profiles and BattleMetrics rosters, both fetched through the given fetcher.
         */
        public Builder steamCommunity(PageFetcher fetcher) {
            this.profileSource = new SteamProfileSource(fetcher);
            this.rosterSource = new BattleMetricsRosterSource(fetcher);
            this.extractor = new SteamRelationshipExtractor();
            return this;
        }

        /**
         * Sets the extractor. Defaults to {@link SteamRelationshipExtractor} if not set.
         */
        public Builder extractor(RelationshipExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder options(CrawlOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a custom metrics service.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public TeamDetector build() {
            if (profileSource == null) {
                throw new IllegalStateException("ProfileSource is required");
            }
            if (rosterSource == null) {
                throw new IllegalStateException("RosterSource is required");
            }
            if (options == null) {
                throw new IllegalStateException("CrawlOptions is required");
            }
            return new TeamDetector(this);
        }
    }
}
