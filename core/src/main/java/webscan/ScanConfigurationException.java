package webscan;

/**
 * Thrown synchronously when a scan cannot be started because its configuration is invalid:
 * malformed seed URL, unknown plugin name, invalid options or a rejected target.
 */
public class ScanConfigurationException extends RuntimeException {

    public ScanConfigurationException(String message) {
        super(message);
    }

    public ScanConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
