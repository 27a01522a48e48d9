package webscan.security;

import webscan.ScanConfigurationException;

/**
 * Thrown when the target guard refuses to let a scan reach a host.
 */
public class TargetRejectedException extends ScanConfigurationException {
    private final String host;

    public TargetRejectedException(String host, String reason) {
        super("Target host '" + host + "' rejected: " + reason);
        this.host = host;
    }

    public String getHost() {
        return host;
    }
}
