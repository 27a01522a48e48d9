package webscan.http;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Ограничитель частоты запросов одного {@link RequestExecutor}.
 *
 * <p>Обеспечивает:
 * <ul>
 *   <li>минимальный интервал между запусками запросов: максимум из {@code minDelay}
 *       и {@code 1 / requestsPerSecond}</li>
 *   <li>ограничение числа одновременных запросов через семафор</li>
 *   <li>паузу каждые {@code cooldownThreshold} запросов с перенастройкой
 *       requestsPerSecond по средней задержке ответа цели</li>
 * </ul>
 *
 * <p>Экземпляр не разделяется между сканированиями разных целей.
 */
public final class RateLimiter {
    private static final Logger logger = Logger.getLogger(RateLimiter.class.getName());

    private final RateLimiterConfig config;
    private final Semaphore permits;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;

    private long nextSlotNanos;
    private boolean started;
    private long requestCount;
    private double requestsPerSecond;
    private long windowLatencyNanos;
    private int windowSamples;

    public RateLimiter(RateLimiterConfig config) {
        this(config, Sleeper.system(), System::nanoTime);
    }

    public RateLimiter(RateLimiterConfig config, Sleeper sleeper, LongSupplier nanoClock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock cannot be null");
        this.permits = new Semaphore(config.getMaxConcurrent(), true);
        this.requestsPerSecond = config.getInitialRequestsPerSecond();
    }

    /**
     * Blocks until a concurrency slot is free and the inter-request delay has elapsed.
     * Every successful call must be paired with {@link #release(Duration)}.
     *
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    public void acquire() throws InterruptedException {
        permits.acquire();
        try {
            long waitNanos;
            boolean cooldownDue;
            synchronized (this) {
                long now = nanoClock.getAsLong();
                long slot = started ? Math.max(now, nextSlotNanos) : now;
                started = true;
                nextSlotNanos = slot + currentIntervalNanos();
                waitNanos = slot - now;
                requestCount++;
                cooldownDue = requestCount % config.getCooldownThreshold() == 0;
            }

            if (waitNanos > 0) {
                sleeper.sleep(Duration.ofNanos(waitNanos));
            }

            if (cooldownDue) {
                logger.fine("Cooldown after " + requestCount + " requests: " + config.getCooldownTime().toMillis() + "ms");
                sleeper.sleep(config.getCooldownTime());
                retune();
            }
        } catch (InterruptedException | RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    /**
     * Frees the concurrency slot and records the observed latency for adaptive tuning.
     *
     * @param latency response time of the finished request, or null if none was observed
     */
    public void release(Duration latency) {
        if (latency != null) {
            synchronized (this) {
                windowLatencyNanos += latency.toNanos();
                windowSamples++;
            }
        }
        permits.release();
    }

    public synchronized double getRequestsPerSecond() {
        return requestsPerSecond;
    }

    public synchronized long getRequestCount() {
        return requestCount;
    }

    public int getAvailablePermits() {
        return permits.availablePermits();
    }

    private long currentIntervalNanos() {
        long rateInterval = (long) (1_000_000_000L / requestsPerSecond);
        return Math.max(config.getMinDelay().toNanos(), rateInterval);
    }

    private synchronized void retune() {
        if (!config.isAdaptive() || windowSamples == 0) {
            return;
        }

        long averageNanos = windowLatencyNanos / windowSamples;
        double previous = requestsPerSecond;
        if (averageNanos < config.getFastLatency().toNanos()) {
            requestsPerSecond = Math.min(config.getMaxRequestsPerSecond(), requestsPerSecond * 1.2);
        } else if (averageNanos > config.getSlowLatency().toNanos()) {
            requestsPerSecond = Math.max(config.getMinRequestsPerSecond(), requestsPerSecond * 0.8);
        }
        windowLatencyNanos = 0;
        windowSamples = 0;

        if (previous != requestsPerSecond) {
            logger.fine(String.format("Adjusted rate limit: %.2f -> %.2f req/s (avg latency %dms)",
                previous, requestsPerSecond, averageNanos / 1_000_000));
        }
    }
}
