package webscan.detection;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers shared by the XSS detectors.
 *
 * <p>Контекст определяется по дереву, которое строит jsoup: обработчик события
 * должен быть настоящим атрибутом тега, а маркер в блоке script должен стоять
 * вне строкового литерала, открытого до отражения нагрузки.
 */
final class XssMarkers {
    private static final Pattern MARKER = Pattern.compile("XSSMARK[A-Za-z0-9]{8}XSSMARK");
    private static final Set<String> URL_ATTRIBUTES = Set.of("href", "src", "action", "formaction", "data");

    private XssMarkers() {
    }

    static Optional<String> markerIn(String payload) {
        if (payload == null) {
            return Optional.empty();
        }
        Matcher matcher = MARKER.matcher(payload);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    static Document parse(String body) {
        return Jsoup.parse(body);
    }

    /**
     * @return true if some script block carries the needle in executable position
     */
    static boolean inScriptBlock(Document document, String needle, String payload) {
        for (Element script : document.select("script")) {
            if (executableIn(script.data(), needle, payload)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if an {@code on*} attribute parsed from the page runs code carrying the needle
     */
    static boolean inEventHandler(Document document, String needle, String payload) {
        for (Element element : document.getAllElements()) {
            for (Attribute attribute : element.attributes()) {
                if (attribute.getKey().toLowerCase(Locale.ROOT).startsWith("on")
                    && executableIn(attribute.getValue(), needle, payload)) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean inJavascriptUrl(Document document, String needle) {
        for (Element element : document.getAllElements()) {
            for (Attribute attribute : element.attributes()) {
                if (!URL_ATTRIBUTES.contains(attribute.getKey().toLowerCase(Locale.ROOT))) {
                    continue;
                }
                String value = attribute.getValue().trim();
                if (value.toLowerCase(Locale.ROOT).startsWith("javascript:") && value.contains(needle)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Проверяет, что хотя бы одно вхождение маркера в JavaScript коде не заперто
     * в строке или комментарии, которые открылись до начала отраженной нагрузки.
     * Экранированная кавычка ({@code \"}) строку не закрывает, поэтому
     * экранированный выход из строки не считается.
     */
    static boolean executableIn(String script, String needle, String payload) {
        if (script == null || script.isEmpty()) {
            return false;
        }
        int markerOffset = payload.indexOf(needle);
        String prefix = markerOffset > 0 ? payload.substring(0, markerOffset) : "";

        int position = script.indexOf(needle);
        while (position >= 0) {
            int reflectionStart = position - matchedPrefixLength(script, position, prefix);
            int enclosingStart = enclosingLiteralStart(script, position);
            if (enclosingStart < 0 || enclosingStart >= reflectionStart) {
                return true;
            }
            position = script.indexOf(needle, position + needle.length());
        }
        return false;
    }

    /**
     * Longest tail of {@code prefix} that sits right before {@code position}.
     */
    static int matchedPrefixLength(String script, int position, String prefix) {
        for (int length = Math.min(prefix.length(), position); length > 0; length--) {
            if (script.regionMatches(position - length, prefix, prefix.length() - length, length)) {
                return length;
            }
        }
        return 0;
    }

    /**
     * @return start offset of the string literal or comment enclosing {@code position}, or -1 for plain code
     */
    static int enclosingLiteralStart(String script, int position) {
        char quote = 0;
        int start = -1;
        boolean lineComment = false;
        boolean blockComment = false;

        for (int i = 0; i < position; i++) {
            char c = script.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                    start = -1;
                } else if (c == '\n' && quote != '`') {
                    quote = 0;
                    start = -1;
                }
            } else if (lineComment) {
                if (c == '\n') {
                    lineComment = false;
                    start = -1;
                }
            } else if (blockComment) {
                if (c == '*' && i + 1 < script.length() && script.charAt(i + 1) == '/') {
                    blockComment = false;
                    start = -1;
                    i++;
                }
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = c;
                start = i;
            } else if (c == '/' && i + 1 < script.length() && script.charAt(i + 1) == '/') {
                lineComment = true;
                start = i;
                i++;
            } else if (c == '/' && i + 1 < script.length() && script.charAt(i + 1) == '*') {
                blockComment = true;
                start = i;
                i++;
            }
        }
        return start;
    }

    static boolean hasExecutionIndicator(String payload) {
        String lower = payload.toLowerCase(Locale.ROOT);
        return lower.contains("<script") || lower.contains("javascript:")
            || lower.matches("(?s).*\\son\\w+\\s*=.*") || lower.contains("alert(");
    }
}
