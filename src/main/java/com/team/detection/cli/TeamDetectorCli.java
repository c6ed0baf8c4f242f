package com.team.detection.cli;

import com.team.detection.api.TeamDetectionReport;
import com.team.detection.api.TeamDetector;
import com.team.detection.config.ConfigurationException;
import com.team.detection.config.RunConfig;
import com.team.detection.config.RunConfigStore;
import com.team.detection.core.TeamDetectionException;
import com.team.detection.metrics.MicrometerMetricsService;
import com.team.detection.report.GraphHtmlRenderer;
import com.team.detection.report.TableReporter;
import com.team.detection.source.HttpPageFetcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Command line entry point.
 *
 * <p>Exit status: 0 on success, 1 when the run fails (transport, extraction or I/O), 2 when the
 * run cannot be configured.</p>
 */
public final class TeamDetectorCli {

    public static final String LOG_LEVEL_PROPERTY = "teamdetector.log.level";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIGURATION = 2;

    private TeamDetectorCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (ConfigurationException e) {
            log().error("cli.arguments.invalid reason='{}'", e.getMessage());
            out.print(CliArguments.usage());
            return EXIT_CONFIGURATION;
        }
        if (arguments.isHelp()) {
            out.print(CliArguments.usage());
            return EXIT_OK;
        }
        // Must happen before logback initializes
        if (arguments.isDebug()) {
            System.setProperty(LOG_LEVEL_PROPERTY, "DEBUG");
        }

        TeamDetector.Builder detector = TeamDetector.builder().steamCommunity(HttpPageFetcher.createDefault());
        return execute(arguments, RunConfigStore.inWorkingDirectory(), detector, out);
    }

    /**
     * Resolves the configuration, runs the detection, prints the table, writes the graph file and
     * stores the configuration that was used.
     */
    static int execute(CliArguments arguments, RunConfigStore store, TeamDetector.Builder detectorBuilder,
                       PrintStream out) {
        Logger log = log();

        RunConfig config;
        try {
            config = RunConfigStore.resolve(arguments.getRosterReference(), arguments.getSeeds(), store.read());
        } catch (ConfigurationException e) {
            log.error("cli.config.invalid reason='{}'", e.getMessage());
            return EXIT_CONFIGURATION;
        }

        MeterRegistry registry = new SimpleMeterRegistry();
        TeamDetector detector = detectorBuilder
                .options(arguments.toCrawlOptions())
                .metricsService(new MicrometerMetricsService(registry))
                .build();

        try {
            TeamDetectionReport report = detector.detect(config.rosterReference(), config.seeds());

            Writer console = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            new TableReporter(detector.getProfileSource()).write(report, console);

            try (Writer graphFile = Files.newBufferedWriter(arguments.getOutput(), StandardCharsets.UTF_8)) {
                new GraphHtmlRenderer().write(report, graphFile);
            }
            log.info("cli.graph.written path={}", arguments.getOutput().toAbsolutePath());
            store.write(config);
            logMetrics(log, registry);
            return EXIT_OK;
        } catch (ConfigurationException e) {
            log.error("cli.config.invalid reason='{}'", e.getMessage());
            return EXIT_CONFIGURATION;
        } catch (TeamDetectionException e) {
            log.error("cli.run.failed type={} reason='{}'", e.getClass().getSimpleName(), e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("cli.output.failed reason='{}'", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    private static void logMetrics(Logger log, MeterRegistry registry) {
        log.debug("metrics.summary fetches={} cacheHits={} cacheMisses={} visits={}",
                (long) total(registry, "teamdetector.fetch"),
                (long) total(registry, "teamdetector.cache.hit"),
                (long) total(registry, "teamdetector.cache.miss"),
                (long) total(registry, "teamdetector.visit"));
    }

    private static double total(MeterRegistry registry, String name) {
        return registry.find(name).counters().stream().mapToDouble(Counter::count).sum();
    }

    private static Logger log() {
        return LoggerFactory.getLogger(TeamDetectorCli.class);
    }
}
