package webscan;

import java.time.Instant;
import java.util.List;

/**
 * Opaque reference to a started scan.
 *
 * @param scanId unique scan identifier
 * @param targetUrl normalized seed URL
 * @param scanTypes plugin names the scan runs
 * @param createdAt when the scan was accepted
 */
public record ScanHandle(String scanId, String targetUrl, List<String> scanTypes, Instant createdAt) {

    public ScanHandle {
        scanTypes = List.copyOf(scanTypes);
    }
}
