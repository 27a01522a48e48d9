package webscan.model;

/**
 * Класс уязвимости, который обнаруживает плагин сканера.
 */
public enum VulnerabilityClass {
    SQL_INJECTION("SQL Injection", "CWE-89"),
    XSS("Cross-Site Scripting", "CWE-79"),
    PATH_TRAVERSAL("Path Traversal", "CWE-22");

    private final String displayName;
    private final String cweId;

    VulnerabilityClass(String displayName, String cweId) {
        this.displayName = displayName;
        this.cweId = cweId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getCweId() {
        return cweId;
    }
}
