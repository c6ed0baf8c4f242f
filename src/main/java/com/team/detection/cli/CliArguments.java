package com.team.detection.cli;

import com.team.detection.config.ConfigurationException;
import com.team.detection.crawl.CrawlOptions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line. Values the user did not supply stay null (roster reference) or empty (seeds)
 * so that they can be filled from the stored configuration.
 *
 * <p>Parsing never logs: the log level depends on {@code --debug}, which is only known afterwards.</p>
 */
public final class CliArguments {

    public static final String DEFAULT_OUTPUT = "team_network.html";

    private String rosterReference;
    private final List<String> seeds = new ArrayList<>();
    private int maxDepth = CrawlOptions.DEFAULT_MAX_DEPTH;
    private boolean includeAnnotations;
    private int maxAnnotationPages = CrawlOptions.DEFAULT_MAX_ANNOTATION_PAGES;
    private boolean debug;
    private Path output = Path.of(DEFAULT_OUTPUT);
    private boolean help;

    private CliArguments() {
    }

    /**
     * Parses the arguments.
     *
     * @throws ConfigurationException on unknown flags, missing values or malformed integers
     */
    public static CliArguments parse(String[] args) {
        CliArguments parsed = new CliArguments();
        int i = 0;
        while (i < args.length) {
            String flag = args[i++];
            switch (flag) {
                case "-b", "--battlemetrics-id" -> parsed.rosterReference = value(args, i++, flag);
                case "-s", "--steam-id" -> {
                    int start = i;
                    while (i < args.length && !args[i].startsWith("-")) {
                        parsed.seeds.add(args[i++]);
                    }
                    if (i == start) {
                        throw new ConfigurationException("Flag " + flag + " expects at least one value");
                    }
                }
                case "-r", "--recursive-depth" -> parsed.maxDepth = nonNegative(value(args, i++, flag), flag);
                case "-c", "--comments" -> parsed.includeAnnotations = true;
                case "-p", "--comment-pages" -> parsed.maxAnnotationPages = nonNegative(value(args, i++, flag), flag);
                case "-d", "--debug" -> parsed.debug = true;
                case "-o", "--output" -> parsed.output = Path.of(value(args, i++, flag));
                case "-h", "--help" -> parsed.help = true;
                default -> throw new ConfigurationException("Unknown argument: " + flag);
            }
        }
        return parsed;
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new ConfigurationException("Flag " + flag + " expects a value");
        }
        return args[index];
    }

    private static int nonNegative(String value, String flag) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Flag " + flag + " expects an integer, got '" + value + "'", e);
        }
        if (parsed < 0) {
            throw new ConfigurationException("Flag " + flag + " must be >= 0, got " + parsed);
        }
        return parsed;
    }

    public CrawlOptions toCrawlOptions() {
        return CrawlOptions.builder()
                .maxDepth(maxDepth)
                .includeAnnotations(includeAnnotations)
                .maxAnnotationPages(maxAnnotationPages)
                .build();
    }

    public static String usage() {
        return String.join(System.lineSeparator(),
                "usage: team-detector [-h] [-b BATTLEMETRICS_ID] [-s STEAM_ID [STEAM_ID ...]] [-r RECURSIVE_DEPTH]",
                "                     [-c] [-p COMMENT_PAGES] [-d] [-o OUTPUT]",
                "",
                "Detects teams among the players of a server from the friend networks of seed profiles.",
                "",
                "options:",
                "  -h, --help                      show this help message and exit",
                "  -b, --battlemetrics-id ID       BattleMetrics server id",
                "  -s, --steam-id ID [ID ...]      seed Steam ids or custom URL aliases",
                "  -r, --recursive-depth N         maximum crawl depth (default " + CrawlOptions.DEFAULT_MAX_DEPTH + ")",
                "  -c, --comments                  also follow profile comment authors",
                "  -p, --comment-pages N           comment pages read per profile (default "
                        + CrawlOptions.DEFAULT_MAX_ANNOTATION_PAGES + ")",
                "  -d, --debug                     enable debug logging",
                "  -o, --output FILE               graph file (default " + DEFAULT_OUTPUT + ")",
                "");
    }

    public String getRosterReference() {
        return rosterReference;
    }

    public List<String> getSeeds() {
        return List.copyOf(seeds);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public boolean isIncludeAnnotations() {
        return includeAnnotations;
    }

    public int getMaxAnnotationPages() {
        return maxAnnotationPages;
    }

    public boolean isDebug() {
        return debug;
    }

    public Path getOutput() {
        return output;
    }

    public boolean isHelp() {
        return help;
    }
}
