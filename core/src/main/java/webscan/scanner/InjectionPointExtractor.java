package webscan.scanner;

import webscan.crawler.DiscoveredForm;
import webscan.crawler.FormField;
import webscan.model.ParameterLocation;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Извлекает точки внедрения из URL и форм страницы.
 *
 * <ul>
 *   <li>каждый параметр query</li>
 *   <li>числовые сегменты пути и последний сегмент</li>
 *   <li>текстовые поля форм (text, search, url, tel, email, password, hidden, textarea)</li>
 * </ul>
 */
public final class InjectionPointExtractor {
    private static final Logger logger = Logger.getLogger(InjectionPointExtractor.class.getName());

    static final String DEFAULT_FIELD_VALUE = "test";
    private static final Pattern NUMERIC = Pattern.compile("\\d+");

    public List<InjectionPoint> extract(String url, List<DiscoveredForm> forms) {
        Map<String, InjectionPoint> points = new LinkedHashMap<>();
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            logger.warning("Cannot extract injection points from malformed URL: " + url);
            return List.of();
        }

        Map<String, String> query = InjectionPoint.parseQuery(uri.getRawQuery());
        for (Map.Entry<String, String> param : query.entrySet()) {
            add(points, InjectionPoint.builder()
                .url(url)
                .name(param.getKey())
                .location(ParameterLocation.QUERY)
                .originalValue(param.getValue())
                .parameters(query)
                .build());
        }

        pathPoints(url, uri).forEach(point -> add(points, point));

        for (DiscoveredForm form : forms) {
            Map<String, String> values = form.defaultValues(DEFAULT_FIELD_VALUE);
            for (FormField field : form.getFields()) {
                if (!field.isTextLike()) {
                    continue;
                }
                add(points, InjectionPoint.builder()
                    .url(form.getAction())
                    .method(form.getMethod())
                    .name(field.name())
                    .location(ParameterLocation.FORM)
                    .originalValue(values.get(field.name()))
                    .parameters(values)
                    .form(form)
                    .build());
            }
        }

        logger.fine("Extracted " + points.size() + " injection points from " + url);
        return new ArrayList<>(points.values());
    }

    private static List<InjectionPoint> pathPoints(String url, URI uri) {
        String rawPath = uri.getRawPath();
        if (rawPath == null || rawPath.isEmpty() || rawPath.equals("/")) {
            return List.of();
        }
        String[] segments = rawPath.split("/", -1);
        int last = segments.length - 1;
        while (last > 0 && segments[last].isEmpty()) {
            last--;
        }

        List<InjectionPoint> points = new ArrayList<>();
        for (int i = 1; i < segments.length; i++) {
            String segment = segments[i];
            if (segment.isEmpty()) {
                continue;
            }
            if (i == last || NUMERIC.matcher(segment).matches()) {
                points.add(InjectionPoint.builder()
                    .url(url)
                    .name("path[" + i + "]")
                    .location(ParameterLocation.PATH)
                    .originalValue(URLDecoder.decode(segment, StandardCharsets.UTF_8))
                    .pathSegmentIndex(i)
                    .build());
            }
        }
        return points;
    }

    private static void add(Map<String, InjectionPoint> points, InjectionPoint point) {
        points.putIfAbsent(point.key(), point);
    }
}
