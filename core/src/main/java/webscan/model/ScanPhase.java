package webscan.model;

/**
 * Phase a running scan is currently in.
 */
public enum ScanPhase {
    INITIALIZING,
    CRAWLING,
    SCANNING,
    FINISHED
}
