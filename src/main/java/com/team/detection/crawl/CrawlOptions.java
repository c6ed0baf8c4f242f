package com.team.detection.crawl;

/**
 * Options for a crawl: depth bound, annotation gathering and traversal order.
 */
public class CrawlOptions {

    public static final int DEFAULT_MAX_DEPTH = 5;
    public static final int DEFAULT_MAX_ANNOTATION_PAGES = 1;

    private final int maxDepth;
    private final boolean includeAnnotations;
    private final int maxAnnotationPages;
    private final TraversalStrategy traversalStrategy;

    private CrawlOptions(Builder builder) {
        this.maxDepth = builder.maxDepth;
        this.includeAnnotations = builder.includeAnnotations;
        this.maxAnnotationPages = builder.maxAnnotationPages;
        this.traversalStrategy = builder.traversalStrategy;
    }

    /**
     * Number of depth levels visited. Seeds are at depth 0, so a value of 1 visits only the seeds.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    public boolean isIncludeAnnotations() {
        return includeAnnotations;
    }

    public int getMaxAnnotationPages() {
        return maxAnnotationPages;
    }

    public TraversalStrategy getTraversalStrategy() {
        return traversalStrategy;
    }

    public static CrawlOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private boolean includeAnnotations = false;
        private int maxAnnotationPages = DEFAULT_MAX_ANNOTATION_PAGES;
        private TraversalStrategy traversalStrategy = TraversalStrategy.DEPTH_FIRST;

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 0) {
                throw new IllegalArgumentException("maxDepth must be >= 0");
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder includeAnnotations(boolean includeAnnotations) {
            this.includeAnnotations = includeAnnotations;
            return this;
        }

        public Builder maxAnnotationPages(int maxAnnotationPages) {
            if (maxAnnotationPages < 0) {
                throw new IllegalArgumentException("maxAnnotationPages must be >= 0");
            }
            this.maxAnnotationPages = maxAnnotationPages;
            return this;
        }

        public Builder traversalStrategy(TraversalStrategy traversalStrategy) {
            if (traversalStrategy == null) {
                throw new IllegalArgumentException("traversalStrategy is required");
            }
            this.traversalStrategy = traversalStrategy;
            return this;
        }

        public CrawlOptions build() {
            return new CrawlOptions(this);
        }
    }

    @Override
    public String toString() {
        return "CrawlOptions{" +
                "maxDepth=" + maxDepth +
                ", includeAnnotations=" + includeAnnotations +
                ", maxAnnotationPages=" + maxAnnotationPages +
                ", traversalStrategy=" + traversalStrategy +
                '}';
    }
}
