package webscan.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Политика повторов для транзиентных сетевых ошибок.
 *
 * <p>Задержка перед повтором растет экспоненциально: {@code baseDelay * 2^(attempt-1)},
 * но не превышает {@code maxDelay}. {@code maxAttempts} включает первую попытку.
 */
public final class RetryPolicy {
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;

    private RetryPolicy(Builder builder) {
        if (builder.maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = Objects.requireNonNull(builder.baseDelay, "baseDelay cannot be null");
        this.maxDelay = Objects.requireNonNull(builder.maxDelay, "maxDelay cannot be null");
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay >= 0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryPolicy defaultPolicy() {
        return builder().build();
    }

    public static RetryPolicy noRetry() {
        return builder().maxAttempts(1).build();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public boolean shouldRetry(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    /**
     * Delay to wait after the given failed attempt (1-based) before the next one.
     */
    public Duration backoffAfter(int failedAttempt) {
        int exponent = Math.max(0, Math.min(failedAttempt - 1, 30));
        long delayMillis = baseDelay.toMillis() * (1L << exponent);
        return delayMillis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(delayMillis);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts +
               ", baseDelay=" + baseDelay.toMillis() + "ms" +
               ", maxDelay=" + maxDelay.toMillis() + "ms}";
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(10);

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
