package webscan.crawler;

import java.util.*;

/**
 * HTML форма, найденная на странице.
 * Содержит абсолютный URL обработчика, HTTP метод и именованные поля ввода.
 * Кнопки отправки хранятся отдельно: они передаются с запросом, но не тестируются.
 */
public final class DiscoveredForm {
    private final String pageUrl;
    private final String action;
    private final String method;
    private final List<FormField> fields;
    private final Map<String, String> submitParameters;

    public DiscoveredForm(String pageUrl, String action, String method,
                          List<FormField> fields, Map<String, String> submitParameters) {
        this.pageUrl = Objects.requireNonNull(pageUrl, "pageUrl cannot be null");
        this.action = Objects.requireNonNull(action, "action cannot be null");
        this.method = method != null && !method.isBlank() ? method.trim().toUpperCase(Locale.ROOT) : "GET";
        this.fields = List.copyOf(fields);
        this.submitParameters = Collections.unmodifiableMap(new LinkedHashMap<>(submitParameters));
    }

    public String getPageUrl() {
        return pageUrl;
    }

    public String getAction() {
        return action;
    }

    public String getMethod() {
        return method;
    }

    public boolean isPost() {
        return "POST".equals(method);
    }

    public List<FormField> getFields() {
        return fields;
    }

    public Map<String, String> getSubmitParameters() {
        return submitParameters;
    }

    /**
     * Field values to submit when no field carries a payload. Empty text fields get {@code fallback}.
     */
    public Map<String, String> defaultValues(String fallback) {
        Map<String, String> values = new LinkedHashMap<>();
        for (FormField field : fields) {
            values.put(field.name(), field.value().isEmpty() && field.isTextLike() ? fallback : field.value());
        }
        values.putAll(submitParameters);
        return values;
    }

    /**
     * Identity used to deduplicate the same form found on several pages.
     */
    public String signature() {
        StringBuilder sb = new StringBuilder(method).append(' ').append(action).append(' ');
        fields.forEach(f -> sb.append(f.name()).append(','));
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DiscoveredForm)) {
            return false;
        }
        return signature().equals(((DiscoveredForm) o).signature());
    }

    @Override
    public int hashCode() {
        return signature().hashCode();
    }

    @Override
    public String toString() {
        return "DiscoveredForm{" + method + " " + action + ", fields=" +
               fields.stream().map(FormField::name).toList() + "}";
    }
}
