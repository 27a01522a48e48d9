package webscan.security;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Защита от SSRF: проверяет цель сканирования до отправки первого запроса.
 *
 * <p>Порядок проверки:
 * <ol>
 *   <li>схема URL должна быть http или https</li>
 *   <li>хост не должен входить в список запрещенных</li>
 *   <li>если задан список разрешенных хостов, хост должен в него входить</li>
 *   <li>ни один адрес хоста не должен относиться к loopback, link-local,
 *       частным или служебным диапазонам, если это явно не разрешено</li>
 * </ol>
 *
 * <p>Совпадение с элементом списка засчитывается для самого хоста и всех его поддоменов.
 *
 * <p>Один экземпляр живет одно сканирование: {@link #permits(String)} проверяет каждый
 * новый хост, найденный краулером или полученный из редиректа, и запоминает решение.
 */
public final class TargetGuard {
    private static final Logger logger = Logger.getLogger(TargetGuard.class.getName());

    private final boolean allowPrivateTargets;
    private final Set<String> allowedHosts;
    private final Set<String> deniedHosts;
    private final HostResolver resolver;
    private final ConcurrentMap<String, Boolean> decisions = new ConcurrentHashMap<>();

    private TargetGuard(Builder builder) {
        this.allowPrivateTargets = builder.allowPrivateTargets;
        this.allowedHosts = normalize(builder.allowedHosts);
        this.deniedHosts = normalize(builder.deniedHosts);
        this.resolver = builder.resolver != null ? builder.resolver : HostResolver.system();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TargetGuard defaultGuard() {
        return builder().build();
    }

    /**
     * Проверяет URL цели.
     *
     * @param url абсолютный URL цели
     * @throws TargetRejectedException если цель запрещена
     */
    public void check(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new TargetRejectedException(String.valueOf(url), "malformed URL");
        }

        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        String host = uri.getHost() != null ? uri.getHost().toLowerCase(Locale.ROOT) : "";
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new TargetRejectedException(host, "unsupported scheme '" + scheme + "'");
        }
        if (host.isEmpty()) {
            throw new TargetRejectedException(url, "URL has no host");
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }

        if (matches(deniedHosts, host)) {
            throw new TargetRejectedException(host, "host is on the deny list");
        }
        if (!allowedHosts.isEmpty() && !matches(allowedHosts, host)) {
            throw new TargetRejectedException(host, "host is not on the allow list");
        }

        if (allowPrivateTargets) {
            logger.fine("Private target check disabled, accepting " + host);
            return;
        }

        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(host);
        } catch (UnknownHostException e) {
            throw new TargetRejectedException(host, "host cannot be resolved");
        }

        for (InetAddress address : addresses) {
            if (isRestricted(address)) {
                throw new TargetRejectedException(host,
                    "resolves to restricted address " + address.getHostAddress());
            }
        }
    }

    /**
     * Non-throwing variant of {@link #check(String)} for URLs discovered during a scan.
     * The decision is cached per scheme and host; a rejection is logged once.
     *
     * @return false if the URL must not be requested
     */
    public boolean permits(String url) {
        String key;
        try {
            URI uri = URI.create(url);
            key = String.valueOf(uri.getScheme()).toLowerCase(Locale.ROOT) + "://"
                + String.valueOf(uri.getHost()).toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            logger.fine("Refusing malformed URL: " + url);
            return false;
        }
        return decisions.computeIfAbsent(key, k -> {
            try {
                check(url);
                return true;
            } catch (TargetRejectedException e) {
                logger.warning("Dropping URLs on " + k + ": " + e.getMessage());
                return false;
            }
        });
    }

    public boolean isAllowPrivateTargets() {
        return allowPrivateTargets;
    }

    /**
     * Returns true for loopback, link-local, private, unspecified, multicast,
     * carrier-grade NAT and IPv6 unique-local addresses.
     */
    static boolean isRestricted(InetAddress address) {
        if (address.isLoopbackAddress()
                || address.isLinkLocalAddress()
                || address.isSiteLocalAddress()
                || address.isAnyLocalAddress()
                || address.isMulticastAddress()) {
            return true;
        }

        byte[] bytes = address.getAddress();
        if (address instanceof Inet6Address) {
            // fc00::/7 unique local
            return (bytes[0] & 0xFE) == 0xFC;
        }
        // 100.64.0.0/10 carrier-grade NAT
        return (bytes[0] & 0xFF) == 100 && (bytes[1] & 0xC0) == 64;
    }

    private static boolean matches(Set<String> hosts, String host) {
        for (String candidate : hosts) {
            if (host.equals(candidate) || host.endsWith("." + candidate)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> normalize(Collection<String> hosts) {
        Set<String> result = new LinkedHashSet<>();
        for (String host : hosts) {
            if (host != null && !host.isBlank()) {
                result.add(host.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    public static class Builder {
        private boolean allowPrivateTargets;
        private final List<String> allowedHosts = new ArrayList<>();
        private final List<String> deniedHosts = new ArrayList<>();
        private HostResolver resolver;

        public Builder allowPrivateTargets(boolean allowPrivateTargets) {
            this.allowPrivateTargets = allowPrivateTargets;
            return this;
        }

        public Builder allowedHosts(Collection<String> hosts) {
            this.allowedHosts.addAll(hosts);
            return this;
        }

        public Builder deniedHosts(Collection<String> hosts) {
            this.deniedHosts.addAll(hosts);
            return this;
        }

        public Builder resolver(HostResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public TargetGuard build() {
            return new TargetGuard(this);
        }
    }
}
