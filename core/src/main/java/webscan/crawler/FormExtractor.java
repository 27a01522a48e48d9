package webscan.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.*;

/**
 * Extracts {@code <form>} elements with their named fields using jsoup.
 */
public final class FormExtractor {

    private static final Set<String> EXCLUDED_INPUT_TYPES = Set.of(
        "submit", "button", "reset", "image", "file"
    );

    private FormExtractor() {
    }

    public static List<DiscoveredForm> extract(String html, String pageUrl) {
        if (html == null || html.isEmpty()) {
            return List.of();
        }

        Document document = Jsoup.parse(html, pageUrl);
        List<DiscoveredForm> forms = new ArrayList<>();

        for (Element form : document.select("form")) {
            String actionAttr = form.attr("action").trim();
            String action = actionAttr.isEmpty()
                ? UrlNormalizer.normalize(pageUrl)
                : UrlNormalizer.resolve(pageUrl, actionAttr).orElse(null);
            if (action == null) {
                continue;
            }

            List<FormField> fields = new ArrayList<>();
            Map<String, String> submitParameters = new LinkedHashMap<>();

            for (Element element : form.select("input, textarea, select")) {
                String name = element.attr("name").trim();
                if (name.isEmpty()) {
                    continue;
                }

                switch (element.tagName()) {
                    case "textarea" -> fields.add(new FormField(name, "textarea", element.text()));
                    case "select" -> fields.add(new FormField(name, "select", selectedOption(element)));
                    default -> {
                        String type = element.attr("type").trim().toLowerCase(Locale.ROOT);
                        if (type.isEmpty()) {
                            type = "text";
                        }
                        if (type.equals("submit")) {
                            submitParameters.put(name, element.attr("value").isEmpty() ? name : element.attr("value"));
                        } else if (!EXCLUDED_INPUT_TYPES.contains(type)) {
                            fields.add(new FormField(name, type, element.attr("value")));
                        }
                    }
                }
            }

            forms.add(new DiscoveredForm(UrlNormalizer.normalize(pageUrl), action, form.attr("method"),
                fields, submitParameters));
        }
        return forms;
    }

    private static String selectedOption(Element select) {
        Element option = select.selectFirst("option[selected]");
        if (option == null) {
            option = select.selectFirst("option");
        }
        if (option == null) {
            return "";
        }
        return option.hasAttr("value") ? option.attr("value") : option.text();
    }
}
