package webscan.detection;

import webscan.http.HttpResponse;
import webscan.model.DetectionStrategy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Обнаружение раскрытия файлов при обходе каталогов.
 *
 * <p>Ответ считается уязвимым, если в нем есть сигнатура системного файла,
 * которой нет в baseline. Ответы 4xx и 5xx не учитываются. Эхо самой нагрузки
 * вырезается из тела перед поиском.
 *
 * <p>Уверенность 0.9 для содержимого, которое больше нигде не встречается
 * ({@code /etc/passwd}, {@code /etc/shadow}, {@code win.ini}, {@code boot.ini}),
 * и 0.7 для остальных сигнатур.
 */
public final class FileDisclosureDetector implements ResponseComparisonDetector {
    static final double STRONG_CONFIDENCE = 0.9;
    static final double WEAK_CONFIDENCE = 0.7;
    private static final int EXCERPT_CONTEXT = 50;

    private static final List<FileSignature> SIGNATURES = List.of(
        new FileSignature("/etc/passwd", Pattern.compile("root:[^:\\r\\n]*:0:0:"), STRONG_CONFIDENCE),
        new FileSignature("/etc/passwd", Pattern.compile("daemon:[^:\\r\\n]*:1:1:"), STRONG_CONFIDENCE),
        new FileSignature("/etc/shadow", Pattern.compile("root:\\$(?:[1-6]|y)\\$"), STRONG_CONFIDENCE),
        new FileSignature("win.ini", Pattern.compile("\\[fonts\\][\\s\\S]*\\[extensions\\]", Pattern.CASE_INSENSITIVE),
            STRONG_CONFIDENCE),
        new FileSignature("win.ini", Pattern.compile("for 16-bit app support", Pattern.CASE_INSENSITIVE),
            STRONG_CONFIDENCE),
        new FileSignature("boot.ini", Pattern.compile("\\[boot loader\\]", Pattern.CASE_INSENSITIVE), STRONG_CONFIDENCE),
        new FileSignature("boot.ini", Pattern.compile("multi\\(0\\)disk\\(0\\)rdisk\\(0\\)", Pattern.CASE_INSENSITIVE),
            STRONG_CONFIDENCE),
        new FileSignature("hosts", Pattern.compile("^\\s*127\\.0\\.0\\.1\\s+localhost", Pattern.MULTILINE),
            WEAK_CONFIDENCE),
        new FileSignature("/proc/self/environ", Pattern.compile("(?:DOCUMENT_ROOT|SERVER_SOFTWARE|HTTP_USER_AGENT)=\\S"),
            WEAK_CONFIDENCE),
        new FileSignature("web.xml", Pattern.compile("<web-app[\\s>]"), WEAK_CONFIDENCE),
        new FileSignature(".git/config", Pattern.compile("\\[core\\]\\s+repositoryformatversion"), WEAK_CONFIDENCE),
        new FileSignature("httpd.conf", Pattern.compile("^\\s*ServerRoot\\s+\"", Pattern.MULTILINE), WEAK_CONFIDENCE)
    );

    @Override
    public DetectionResult analyze(HttpResponse baseline, HttpResponse probe, String payload) {
        if (probe.getStatusCode() >= 400) {
            return DetectionResult.notVulnerable(DetectionStrategy.FILE_DISCLOSURE);
        }
        String body = payload == null || payload.isEmpty() ? probe.getBody() : probe.getBody().replace(payload, "");
        String baselineBody = baseline.getBody();

        FileSignature best = null;
        Matcher bestMatch = null;
        for (FileSignature signature : SIGNATURES) {
            if (best != null && best.confidence() >= signature.confidence()) {
                continue;
            }
            Matcher matcher = signature.pattern().matcher(body);
            if (matcher.find() && !signature.pattern().matcher(baselineBody).find()) {
                best = signature;
                bestMatch = matcher;
            }
        }
        if (best == null) {
            return DetectionResult.notVulnerable(DetectionStrategy.FILE_DISCLOSURE);
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("disclosed_file", best.file());
        evidence.put("file_pattern", best.pattern().pattern());
        evidence.put("matched_content", bestMatch.group());
        evidence.put("content_excerpt", excerpt(body, bestMatch.start(), bestMatch.end()));
        evidence.put("status_code", probe.getStatusCode());
        return DetectionResult.vulnerable(DetectionStrategy.FILE_DISCLOSURE, best.confidence(), evidence);
    }

    static String excerpt(String body, int start, int end) {
        int from = Math.max(0, start - EXCERPT_CONTEXT);
        int to = Math.min(body.length(), end + EXCERPT_CONTEXT);
        return (from > 0 ? "..." : "") + body.substring(from, to) + (to < body.length() ? "..." : "");
    }

    private record FileSignature(String file, Pattern pattern, double confidence) {
    }
}
