package webscan.payload;

/**
 * Markup context an XSS payload is built to break out of.
 */
public enum InjectionContext {
    HTML,
    ATTRIBUTE,
    JAVASCRIPT,
    URL
}
