package webscan.model;

/**
 * Lifecycle status of one logical scan.
 */
public enum ScanStatus {
    PENDING("Scan accepted, not started yet"),
    RUNNING("Scan is running"),
    COMPLETED("Scan completed"),
    FAILED("Scan failed"),
    CANCELLED("Scan was cancelled");

    private final String description;

    ScanStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
