package webscan.crawler;

import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * Decides whether a URL belongs to the crawl scope of a seed URL.
 *
 * <p>The registrable domain is the public suffix plus one label ({@code shop.example.co.uk}
 * gives {@code example.co.uk}). IP literals and hosts without a public suffix, such as
 * {@code localhost}, are their own registrable domain.
 */
public final class DomainScope {
    private final ScopePolicy policy;
    private final String seedHost;
    private final String seedDomain;

    public DomainScope(String seedUrl, ScopePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.seedHost = hostOf(seedUrl);
        if (seedHost.isEmpty()) {
            throw new IllegalArgumentException("Seed URL has no host: " + seedUrl);
        }
        this.seedDomain = registrableDomain(seedHost);
    }

    public boolean isInScope(String url) {
        String host = hostOf(url);
        if (host.isEmpty()) {
            return false;
        }
        return switch (policy) {
            case EXACT_HOST -> host.equals(seedHost);
            case REGISTRABLE_DOMAIN -> registrableDomain(host).equals(seedDomain);
        };
    }

    public String getSeedDomain() {
        return seedDomain;
    }

    public static String registrableDomain(String host) {
        String normalized = host.toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.startsWith("[") || InetAddresses.isInetAddress(normalized)) {
            return normalized;
        }
        try {
            InternetDomainName name = InternetDomainName.from(normalized);
            return name.isUnderPublicSuffix() ? name.topPrivateDomain().toString() : normalized;
        } catch (IllegalArgumentException | IllegalStateException e) {
            return normalized;
        }
    }

    static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : "";
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
