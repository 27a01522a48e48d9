package webscan;

import webscan.model.Finding;
import webscan.model.Severity;

import java.util.*;

/**
 * Single mutation point for the findings of one scan.
 *
 * <p>A finding is kept only once per endpoint, parameter and detection strategy; later
 * findings for the same combination are dropped.
 */
public final class FindingAggregator {
    private final Map<String, Finding> findings = new LinkedHashMap<>();

    /**
     * @return true if the finding was new and has been recorded
     */
    public synchronized boolean add(Finding finding) {
        Objects.requireNonNull(finding, "finding cannot be null");
        return findings.putIfAbsent(keyOf(finding), finding) == null;
    }

    static String keyOf(Finding finding) {
        return finding.getEndpoint() + "|" + finding.getParameterLocation() + ":" + finding.getParameter()
            + "|" + finding.getStrategy().getTag();
    }

    public synchronized List<Finding> getFindings() {
        return List.copyOf(findings.values());
    }

    public synchronized int size() {
        return findings.size();
    }

    public synchronized Map<Severity, Long> countByRisk() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Finding finding : findings.values()) {
            counts.merge(finding.getRisk(), 1L, Long::sum);
        }
        return counts;
    }
}
