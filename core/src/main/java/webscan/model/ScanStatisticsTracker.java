package webscan.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Mutable counters of one scan. Every method is safe to call from concurrent detection tasks.
 */
public final class ScanStatisticsTracker {
    private final String scanId;
    private final Clock clock;
    private final AtomicReference<ScanStatus> status = new AtomicReference<>(ScanStatus.PENDING);
    private final AtomicReference<ScanPhase> phase = new AtomicReference<>(ScanPhase.INITIALIZING);
    private final AtomicInteger urlsCrawled = new AtomicInteger();
    private final AtomicInteger formsDiscovered = new AtomicInteger();
    private final Set<String> testedForms = ConcurrentHashMap.newKeySet();
    private final AtomicInteger vulnerabilitiesFound = new AtomicInteger();
    private final AtomicInteger pluginsExecuted = new AtomicInteger();
    private final Map<String, AtomicInteger> findingsByPlugin = new ConcurrentHashMap<>();
    private final AtomicReference<String> currentUrl = new AtomicReference<>();
    private final AtomicReference<String> errorMessage = new AtomicReference<>();
    private volatile LongSupplier requestCounter = () -> 0L;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile boolean timedOut;

    public ScanStatisticsTracker(String scanId) {
        this(scanId, Clock.systemUTC());
    }

    public ScanStatisticsTracker(String scanId, Clock clock) {
        this.scanId = scanId;
        this.clock = clock;
    }

    public void start() {
        startedAt = clock.instant();
        status.set(ScanStatus.RUNNING);
    }

    /**
     * Moves to a terminal status. Only the first terminal transition takes effect.
     *
     * @return true if this call performed the transition
     */
    public boolean finish(ScanStatus terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        ScanStatus current;
        do {
            current = status.get();
            if (current.isTerminal()) {
                return false;
            }
        } while (!status.compareAndSet(current, terminal));
        finishedAt = clock.instant();
        phase.set(ScanPhase.FINISHED);
        currentUrl.set(null);
        return true;
    }

    public ScanStatus getStatus() {
        return status.get();
    }

    public void setPhase(ScanPhase newPhase) {
        phase.set(newPhase);
    }

    public ScanPhase getPhase() {
        return phase.get();
    }

    /**
     * Requests are counted by the shared execution control; the tracker only reads it.
     */
    public void bindRequestCounter(LongSupplier counter) {
        this.requestCounter = counter;
    }

    public void urlCrawled(String url) {
        urlsCrawled.incrementAndGet();
        currentUrl.set(url);
    }

    public void formsDiscovered(int count) {
        formsDiscovered.addAndGet(count);
    }

    public void formTested(String formSignature) {
        testedForms.add(formSignature);
    }

    public void setCurrentUrl(String url) {
        currentUrl.set(url);
    }

    public void pluginExecuted() {
        pluginsExecuted.incrementAndGet();
    }

    public void findingRecorded(String pluginName) {
        vulnerabilitiesFound.incrementAndGet();
        findingsByPlugin.computeIfAbsent(pluginName, k -> new AtomicInteger()).incrementAndGet();
    }

    public void markTimedOut() {
        timedOut = true;
    }

    public void recordError(String message) {
        errorMessage.compareAndSet(null, message);
    }

    public ScanStatistics snapshot() {
        Map<String, Integer> perPlugin = new TreeMap<>();
        findingsByPlugin.forEach((name, count) -> perPlugin.put(name, count.get()));

        Instant start = startedAt;
        Instant end = finishedAt != null ? finishedAt : clock.instant();
        Duration elapsed = start != null ? Duration.between(start, end) : Duration.ZERO;

        return ScanStatistics.builder()
            .scanId(scanId)
            .status(status.get())
            .phase(phase.get())
            .urlsCrawled(urlsCrawled.get())
            .formsDiscovered(formsDiscovered.get())
            .formsTested(testedForms.size())
            .requestsSent(requestCounter.getAsLong())
            .vulnerabilitiesFound(vulnerabilitiesFound.get())
            .pluginsExecuted(pluginsExecuted.get())
            .findingsByPlugin(perPlugin)
            .currentUrl(currentUrl.get())
            .startedAt(start)
            .elapsed(elapsed)
            .timedOut(timedOut)
            .errorMessage(errorMessage.get())
            .build();
    }
}
