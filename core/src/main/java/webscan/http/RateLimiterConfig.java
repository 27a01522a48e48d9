package webscan.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link RateLimiter}.
 */
public final class RateLimiterConfig {
    private final Duration minDelay;
    private final int maxConcurrent;
    private final int cooldownThreshold;
    private final Duration cooldownTime;
    private final double initialRequestsPerSecond;
    private final double minRequestsPerSecond;
    private final double maxRequestsPerSecond;
    private final boolean adaptive;
    private final Duration fastLatency;
    private final Duration slowLatency;

    private RateLimiterConfig(Builder builder) {
        this.minDelay = Objects.requireNonNull(builder.minDelay, "minDelay cannot be null");
        this.cooldownTime = Objects.requireNonNull(builder.cooldownTime, "cooldownTime cannot be null");
        this.fastLatency = Objects.requireNonNull(builder.fastLatency, "fastLatency cannot be null");
        this.slowLatency = Objects.requireNonNull(builder.slowLatency, "slowLatency cannot be null");
        if (builder.maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        if (builder.cooldownThreshold < 1) {
            throw new IllegalArgumentException("cooldownThreshold must be at least 1");
        }
        if (builder.minRequestsPerSecond <= 0 || builder.maxRequestsPerSecond < builder.minRequestsPerSecond) {
            throw new IllegalArgumentException("requests-per-second bounds are invalid");
        }
        this.maxConcurrent = builder.maxConcurrent;
        this.cooldownThreshold = builder.cooldownThreshold;
        this.minRequestsPerSecond = builder.minRequestsPerSecond;
        this.maxRequestsPerSecond = builder.maxRequestsPerSecond;
        this.initialRequestsPerSecond = Math.max(minRequestsPerSecond,
            Math.min(maxRequestsPerSecond, builder.initialRequestsPerSecond));
        this.adaptive = builder.adaptive;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RateLimiterConfig defaultConfig() {
        return builder().build();
    }

    public Duration getMinDelay() {
        return minDelay;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public int getCooldownThreshold() {
        return cooldownThreshold;
    }

    public Duration getCooldownTime() {
        return cooldownTime;
    }

    public double getInitialRequestsPerSecond() {
        return initialRequestsPerSecond;
    }

    public double getMinRequestsPerSecond() {
        return minRequestsPerSecond;
    }

    public double getMaxRequestsPerSecond() {
        return maxRequestsPerSecond;
    }

    public boolean isAdaptive() {
        return adaptive;
    }

    public Duration getFastLatency() {
        return fastLatency;
    }

    public Duration getSlowLatency() {
        return slowLatency;
    }

    public static class Builder {
        private Duration minDelay = Duration.ofSeconds(1);
        private int maxConcurrent = 5;
        private int cooldownThreshold = 50;
        private Duration cooldownTime = Duration.ofSeconds(2);
        private double initialRequestsPerSecond = 10;
        private double minRequestsPerSecond = 1;
        private double maxRequestsPerSecond = 20;
        private boolean adaptive = true;
        private Duration fastLatency = Duration.ofMillis(100);
        private Duration slowLatency = Duration.ofSeconds(1);

        public Builder minDelay(Duration minDelay) {
            this.minDelay = minDelay;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder cooldownThreshold(int cooldownThreshold) {
            this.cooldownThreshold = cooldownThreshold;
            return this;
        }

        public Builder cooldownTime(Duration cooldownTime) {
            this.cooldownTime = cooldownTime;
            return this;
        }

        public Builder initialRequestsPerSecond(double initialRequestsPerSecond) {
            this.initialRequestsPerSecond = initialRequestsPerSecond;
            return this;
        }

        public Builder requestsPerSecondBounds(double min, double max) {
            this.minRequestsPerSecond = min;
            this.maxRequestsPerSecond = max;
            return this;
        }

        public Builder adaptive(boolean adaptive) {
            this.adaptive = adaptive;
            return this;
        }

        public Builder latencyBands(Duration fastLatency, Duration slowLatency) {
            this.fastLatency = fastLatency;
            this.slowLatency = slowLatency;
            return this;
        }

        public RateLimiterConfig build() {
            return new RateLimiterConfig(this);
        }
    }
}
