package webscan.crawler;

/**
 * Limits and policies of one crawl.
 */
public final class CrawlOptions {
    private final int maxDepth;
    private final int maxUrls;
    private final boolean followRobots;
    private final int parallelism;
    private final ScopePolicy scopePolicy;

    private CrawlOptions(Builder builder) {
        if (builder.maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth cannot be negative");
        }
        if (builder.maxUrls < 1) {
            throw new IllegalArgumentException("maxUrls must be at least 1");
        }
        if (builder.parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.maxDepth = builder.maxDepth;
        this.maxUrls = builder.maxUrls;
        this.followRobots = builder.followRobots;
        this.parallelism = builder.parallelism;
        this.scopePolicy = builder.scopePolicy != null ? builder.scopePolicy : ScopePolicy.REGISTRABLE_DOMAIN;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CrawlOptions defaultOptions() {
        return builder().build();
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxUrls() {
        return maxUrls;
    }

    public boolean isFollowRobots() {
        return followRobots;
    }

    public int getParallelism() {
        return parallelism;
    }

    public ScopePolicy getScopePolicy() {
        return scopePolicy;
    }

    @Override
    public String toString() {
        return "CrawlOptions{maxDepth=" + maxDepth + ", maxUrls=" + maxUrls +
               ", followRobots=" + followRobots + ", parallelism=" + parallelism +
               ", scope=" + scopePolicy + "}";
    }

    public static class Builder {
        private int maxDepth = 3;
        private int maxUrls = 100;
        private boolean followRobots = true;
        private int parallelism = 5;
        private ScopePolicy scopePolicy;

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxUrls(int maxUrls) {
            this.maxUrls = maxUrls;
            return this;
        }

        public Builder followRobots(boolean followRobots) {
            this.followRobots = followRobots;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder scopePolicy(ScopePolicy scopePolicy) {
            this.scopePolicy = scopePolicy;
            return this;
        }

        public CrawlOptions build() {
            return new CrawlOptions(this);
        }
    }
}
