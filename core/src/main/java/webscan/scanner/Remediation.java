package webscan.scanner;

import webscan.model.DetectionStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Рекомендации по устранению для каждой стратегии обнаружения.
 */
public final class Remediation {

    private static final List<String> SQL_INJECTION = List.of(
        "Use prepared statements with parameterized queries for every database access",
        "Never build SQL by concatenating user input",
        "Validate input against an allow-list of expected types and formats",
        "Run the application with a least-privilege database account"
    );

    private static final List<String> XSS = List.of(
        "Encode output for the context it is written to (HTML body, attribute, JavaScript, URL)",
        "Validate and sanitize user input on the server side",
        "Deploy a Content-Security-Policy that forbids inline script",
        "Set session cookies with the HttpOnly flag"
    );

    private static final List<String> PATH_TRAVERSAL = List.of(
        "Never pass user input to file system calls directly",
        "Map requested names to an allow-list of files or directories",
        "Canonicalize the resolved path and reject it unless it stays under the base directory",
        "Run the application with an account that cannot read system files"
    );

    private Remediation() {
    }

    public static List<String> forStrategy(DetectionStrategy strategy) {
        List<String> steps = new ArrayList<>(switch (strategy.getVulnerabilityClass()) {
            case SQL_INJECTION -> SQL_INJECTION;
            case XSS -> XSS;
            case PATH_TRAVERSAL -> PATH_TRAVERSAL;
        });
        switch (strategy) {
            case ERROR -> steps.add("Return generic error pages and never expose database error messages");
            case UNION -> steps.add("Restrict the database account from reading information_schema and system tables");
            case TIME -> steps.add("Enforce statement timeouts on the database side");
            case STORED -> steps.add("Sanitize stored content both when saving and when rendering it");
            case DOM -> steps.add("Avoid writing location-derived data into innerHTML or document.write; use textContent");
            default -> {
            }
        }
        return steps;
    }
}
