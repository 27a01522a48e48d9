package webscan.crawler;

/**
 * How strictly discovered URLs must match the seed's host.
 */
public enum ScopePolicy {
    /** Same effective TLD+1, any subdomain. */
    REGISTRABLE_DOMAIN,
    /** Exactly the seed's host. */
    EXACT_HOST
}
