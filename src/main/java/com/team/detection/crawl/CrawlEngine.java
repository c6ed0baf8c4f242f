package com.team.detection.crawl;

import com.team.detection.core.model.AnnotationPage;
import com.team.detection.core.model.ProfileDetails;
import com.team.detection.core.model.ProfileIdentity;
import com.team.detection.core.model.RelationshipRecord;
import com.team.detection.core.model.VisitSnapshot;
import com.team.detection.extract.RelationshipExtractor;
import com.team.detection.logging.LogContext;
import com.team.detection.metrics.MetricsService;
import com.team.detection.metrics.NoOpMetricsService;
import com.team.detection.resolve.IdentityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Depth-bounded traversal of the relationship network, starting from the seed profiles.
 *
 * <p>Each pending visit ends in exactly one {@link VisitOutcome}:</p>
 * <ol>
 *   <li>{@code STOPPED} when its depth has reached {@link CrawlOptions#getMaxDepth()}</li>
 *   <li>{@code SKIPPED} when its numeric identifier is already among the found players</li>
 *   <li>{@code VISITED} otherwise: the profile is resolved and recorded, its relationship list and
 *       (optionally) annotation authors are gathered, deduplicated, stripped of the profile itself
 *       and matched against the roster; matched candidates are recorded as direct matches and
 *       the ones not yet found are scheduled one level deeper</li>
 * </ol>
 *
 * Any fetch or extraction failure propagates and aborts the crawl; there is no partial result.
 */
public class CrawlEngine {
    private static final Logger log = LoggerFactory.getLogger(CrawlEngine.class);

    private final CrawlOptions options;
    private final RelationshipExtractor extractor;
    private final MetricsService metricsService;

    public CrawlEngine(CrawlOptions options, RelationshipExtractor extractor) {
        this(options, extractor, new NoOpMetricsService());
    }

    public CrawlEngine(CrawlOptions options, RelationshipExtractor extractor, MetricsService metricsService) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Crawls from the given seeds until the worklist is exhausted.
     *
     * @param context run state; receives found players, snapshots and direct matches
     * @param matcher roster matcher for this run
     * @param seeds   starting profiles, visited at depth 0 in the given order
     */
    public CrawlResult crawl(CrawlContext context, RosterMatcher matcher, List<ProfileIdentity> seeds) {
        long start = System.nanoTime();
        log.info("crawl.started seeds={} roster={} options={}", seeds.size(), matcher.size(), options);

        Deque<PendingVisit> worklist = new ArrayDeque<>();
        options.getTraversalStrategy().schedule(worklist,
                seeds.stream().map(seed -> new PendingVisit(seed, 0)).toList());

        while (!worklist.isEmpty()) {
            PendingVisit next = worklist.pollFirst();
            VisitOutcome outcome = visit(context, matcher, next, worklist);
            context.countVisit(outcome);
            metricsService.recordVisit(outcome);
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        CrawlResult result = new CrawlResult(
                List.copyOf(context.getFoundPlayers()),
                context.getSnapshots(),
                context.getDirectMatches(),
                context.getVisitCounts(),
                context.getFetchCache().getStats(),
                duration);

        metricsService.recordCrawlDuration(duration);
        metricsService.recordPlayersFound(result.foundPlayers().size());
        log.info("crawl.completed found={} visited={} skipped={} stopped={} durationMs={}",
                result.foundPlayers().size(),
                result.visitCount(VisitOutcome.VISITED),
                result.visitCount(VisitOutcome.SKIPPED),
                result.visitCount(VisitOutcome.STOPPED),
                duration.toMillis());
        return result;
    }

    VisitOutcome visit(CrawlContext context, RosterMatcher matcher, PendingVisit pending,
                       Deque<PendingVisit> worklist) {
        if (pending.depth() >= options.getMaxDepth()) {
            log.debug("crawl.stopped identity={} depth={}", pending.identity(), pending.depth());
            return VisitOutcome.STOPPED;
        }

        IdentityResolver resolver = context.getResolver();
        String numericId = resolver.withNumericId(pending.identity()).getNumericId().orElseThrow();
        if (context.isFound(numericId)) {
            log.debug("crawl.skipped numericId={} depth={}", numericId, pending.depth());
            return VisitOutcome.SKIPPED;
        }

        try (LogContext ignored = LogContext.forVisit(numericId, pending.depth())) {
            ProfileDetails details = resolver.details(numericId);
            String alias = resolver.resolveAlias(numericId);
            ProfileIdentity profile = ProfileIdentity.resolved(numericId, alias, details.displayName());
            if (!context.markFound(profile)) {
                return VisitOutcome.SKIPPED;
            }
            log.debug("crawl.visiting numericId={} name='{}' depth={}", numericId, profile.getDisplayName(),
                    pending.depth());

            List<RelationshipRecord> gathered = gather(context, numericId, details);
            context.recordSnapshot(new VisitSnapshot(profile, pending.depth(), gathered));

            List<RelationshipRecord> candidates = Candidates.deduplicate(gathered);
            candidates = Candidates.excludeSelf(profile, candidates);
            List<RelationshipRecord> matched = matcher.match(candidates);
            context.recordDirectMatch(new DirectMatch(profile, matched));

            List<RelationshipRecord> unvisited = Candidates.excludeFound(matched, context.getFoundPlayers());
            options.getTraversalStrategy().schedule(worklist, unvisited.stream()
                    .map(candidate -> new PendingVisit(candidate.identity(), pending.depth() + 1))
                    .toList());

            log.info("crawl.visited name='{}' numericId={} depth={} gathered={} matched={} scheduled={}",
                    profile.getDisplayName(), numericId, pending.depth(), gathered.size(), matched.size(),
                    unvisited.size());
            return VisitOutcome.VISITED;
        }
    }

    /**
     * Collects candidates from the relationship list, then from annotation pages in increasing order.
     * Private sources contribute nothing.
     */
    private List<RelationshipRecord> gather(CrawlContext context, String numericId, ProfileDetails details) {
        List<RelationshipRecord> gathered = new ArrayList<>();

        if (details.relationshipsPublic()) {
            List<RelationshipRecord> relationships =
                    extractor.parseRelationshipList(context.getFetchCache().getRelationshipList(numericId));
            context.getResolver().learn(relationships);
            gathered.addAll(relationships);
        } else {
            log.debug("crawl.relationships.private numericId={}", numericId);
        }

        if (options.isIncludeAnnotations() && options.getMaxAnnotationPages() > 0 && details.annotationsPublic()) {
            int remaining = details.annotationTotalCount();
            for (int page = 1; page <= options.getMaxAnnotationPages() && remaining > 0; page++) {
                AnnotationPage annotations =
                        extractor.parseAnnotationPage(context.getFetchCache().getAnnotationsPage(numericId, page));
                remaining -= annotations.authorsRead();
                gathered.addAll(annotations.authors());
                if (annotations.authorsRead() == 0) {
                    break;
                }
            }
        }
        return gathered;
    }
}
