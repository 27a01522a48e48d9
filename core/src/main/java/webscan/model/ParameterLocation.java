package webscan.model;

/**
 * Where an injectable parameter lives in a request.
 */
public enum ParameterLocation {
    QUERY,
    FORM,
    PATH,
    /** URL fragment; never sent to the server, read only by client-side script. */
    FRAGMENT
}
