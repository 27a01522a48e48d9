package webscan.crawler;

import java.util.Objects;
import java.util.Set;

/**
 * A named, user-editable field of an HTML form.
 *
 * @param name field name
 * @param type lower-cased input type; {@code textarea} and {@code select} for those elements
 * @param value default value, never null
 */
public record FormField(String name, String type, String value) {
    private static final Set<String> TEXT_LIKE_TYPES = Set.of(
        "text", "search", "url", "tel", "email", "password", "hidden", "textarea"
    );

    public FormField {
        Objects.requireNonNull(name, "name cannot be null");
        type = type != null ? type : "text";
        value = value != null ? value : "";
    }

    /**
     * True for fields that accept free text and are worth injecting into.
     */
    public boolean isTextLike() {
        return TEXT_LIKE_TYPES.contains(type);
    }
}
