package webscan.http;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cookie jar of one scanner plugin. Cookies set by the target are merged in
 * after every successful response and replayed on later requests.
 */
public final class SessionState {
    private final Map<String, String> cookies = new ConcurrentHashMap<>();
    private final Set<String> authenticatedHosts = ConcurrentHashMap.newKeySet();

    public SessionState() {
    }

    public SessionState(Map<String, String> initialCookies) {
        if (initialCookies != null) {
            cookies.putAll(initialCookies);
        }
    }

    public Map<String, String> getCookies() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(cookies));
    }

    public Optional<String> getCookie(String name) {
        return Optional.ofNullable(cookies.get(name));
    }

    public void putCookie(String name, String value) {
        cookies.put(name, value);
    }

    /**
     * Merges {@code Set-Cookie} headers of a response. Cookies with an empty value
     * or {@code Max-Age=0} are removed.
     *
     * @return number of cookies added or updated
     */
    public int mergeSetCookieHeaders(List<String> setCookieHeaders) {
        int merged = 0;
        for (String header : setCookieHeaders) {
            if (header == null || header.isBlank()) {
                continue;
            }
            String pair = header.split(";", 2)[0];
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = pair.substring(0, eq).trim();
            String value = pair.substring(eq + 1).trim();
            String lowerHeader = header.toLowerCase(Locale.ROOT);

            if (value.isEmpty() || lowerHeader.contains("max-age=0")) {
                cookies.remove(name);
            } else {
                cookies.put(name, value);
                merged++;
            }
        }
        return merged;
    }

    public void markAuthenticated(String host) {
        authenticatedHosts.add(host.toLowerCase(Locale.ROOT));
    }

    public boolean isAuthenticated(String host) {
        return authenticatedHosts.contains(host.toLowerCase(Locale.ROOT));
    }

    public void clear() {
        cookies.clear();
        authenticatedHosts.clear();
    }
}
