package webscan.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Снимок статистики сканирования на момент запроса.
 */
public final class ScanStatistics {
    private final String scanId;
    private final ScanStatus status;
    private final ScanPhase phase;
    private final int urlsCrawled;
    private final int formsDiscovered;
    private final int formsTested;
    private final long requestsSent;
    private final int vulnerabilitiesFound;
    private final int pluginsExecuted;
    private final Map<String, Integer> findingsByPlugin;
    private final String currentUrl;
    private final Instant startedAt;
    private final Duration elapsed;
    private final boolean timedOut;
    private final String errorMessage;

    private ScanStatistics(Builder builder) {
        this.scanId = builder.scanId;
        this.status = builder.status;
        this.phase = builder.phase;
        this.urlsCrawled = builder.urlsCrawled;
        this.formsDiscovered = builder.formsDiscovered;
        this.formsTested = builder.formsTested;
        this.requestsSent = builder.requestsSent;
        this.vulnerabilitiesFound = builder.vulnerabilitiesFound;
        this.pluginsExecuted = builder.pluginsExecuted;
        this.findingsByPlugin = Collections.unmodifiableMap(new LinkedHashMap<>(builder.findingsByPlugin));
        this.currentUrl = builder.currentUrl;
        this.startedAt = builder.startedAt;
        this.elapsed = builder.elapsed != null ? builder.elapsed : Duration.ZERO;
        this.timedOut = builder.timedOut;
        this.errorMessage = builder.errorMessage;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getScanId() {
        return scanId;
    }

    public ScanStatus getStatus() {
        return status;
    }

    public ScanPhase getPhase() {
        return phase;
    }

    public int getUrlsCrawled() {
        return urlsCrawled;
    }

    public int getFormsDiscovered() {
        return formsDiscovered;
    }

    public int getFormsTested() {
        return formsTested;
    }

    public long getRequestsSent() {
        return requestsSent;
    }

    public int getVulnerabilitiesFound() {
        return vulnerabilitiesFound;
    }

    public int getPluginsExecuted() {
        return pluginsExecuted;
    }

    public Map<String, Integer> getFindingsByPlugin() {
        return findingsByPlugin;
    }

    public Optional<String> getCurrentUrl() {
        return Optional.ofNullable(currentUrl);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        return "ScanStatistics{" + scanId + ", status=" + status + ", phase=" + phase +
               ", urls=" + urlsCrawled + ", requests=" + requestsSent +
               ", findings=" + vulnerabilitiesFound + ", elapsed=" + elapsed.toSeconds() + "s}";
    }

    public static class Builder {
        private String scanId;
        private ScanStatus status = ScanStatus.PENDING;
        private ScanPhase phase = ScanPhase.INITIALIZING;
        private int urlsCrawled;
        private int formsDiscovered;
        private int formsTested;
        private long requestsSent;
        private int vulnerabilitiesFound;
        private int pluginsExecuted;
        private final Map<String, Integer> findingsByPlugin = new LinkedHashMap<>();
        private String currentUrl;
        private Instant startedAt;
        private Duration elapsed;
        private boolean timedOut;
        private String errorMessage;

        public Builder scanId(String scanId) {
            this.scanId = scanId;
            return this;
        }

        public Builder status(ScanStatus status) {
            this.status = status;
            return this;
        }

        public Builder phase(ScanPhase phase) {
            this.phase = phase;
            return this;
        }

        public Builder urlsCrawled(int urlsCrawled) {
            this.urlsCrawled = urlsCrawled;
            return this;
        }

        public Builder formsDiscovered(int formsDiscovered) {
            this.formsDiscovered = formsDiscovered;
            return this;
        }

        public Builder formsTested(int formsTested) {
            this.formsTested = formsTested;
            return this;
        }

        public Builder requestsSent(long requestsSent) {
            this.requestsSent = requestsSent;
            return this;
        }

        public Builder vulnerabilitiesFound(int vulnerabilitiesFound) {
            this.vulnerabilitiesFound = vulnerabilitiesFound;
            return this;
        }

        public Builder pluginsExecuted(int pluginsExecuted) {
            this.pluginsExecuted = pluginsExecuted;
            return this;
        }

        public Builder findingsByPlugin(Map<String, Integer> findingsByPlugin) {
            this.findingsByPlugin.putAll(findingsByPlugin);
            return this;
        }

        public Builder currentUrl(String currentUrl) {
            this.currentUrl = currentUrl;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder elapsed(Duration elapsed) {
            this.elapsed = elapsed;
            return this;
        }

        public Builder timedOut(boolean timedOut) {
            this.timedOut = timedOut;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public ScanStatistics build() {
            return new ScanStatistics(this);
        }
    }
}
