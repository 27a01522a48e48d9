package webscan.crawler;

import java.time.Duration;
import java.util.*;

/**
 * Результат обхода сайта: найденные URL в пределах области и формы.
 */
public final class CrawlResult {
    private final String seedUrl;
    private final Set<String> urls;
    private final List<DiscoveredForm> forms;
    private final int pagesFetched;
    private final int failedPages;
    private final int robotsBlocked;
    private final Duration duration;

    public CrawlResult(String seedUrl, Set<String> urls, List<DiscoveredForm> forms,
                       int pagesFetched, int failedPages, int robotsBlocked, Duration duration) {
        this.seedUrl = Objects.requireNonNull(seedUrl, "seedUrl cannot be null");
        this.urls = Collections.unmodifiableSet(new LinkedHashSet<>(urls));
        this.forms = List.copyOf(forms);
        this.pagesFetched = pagesFetched;
        this.failedPages = failedPages;
        this.robotsBlocked = robotsBlocked;
        this.duration = duration;
    }

    public String getSeedUrl() {
        return seedUrl;
    }

    public Set<String> getUrls() {
        return urls;
    }

    public List<DiscoveredForm> getForms() {
        return forms;
    }

    /**
     * Forms found on the given page (normalized URL).
     */
    public List<DiscoveredForm> getFormsOnPage(String pageUrl) {
        return forms.stream()
            .filter(form -> form.getPageUrl().equals(pageUrl))
            .toList();
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    public int getFailedPages() {
        return failedPages;
    }

    public int getRobotsBlocked() {
        return robotsBlocked;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "CrawlResult{seed=" + seedUrl + ", urls=" + urls.size() + ", forms=" + forms.size() +
               ", fetched=" + pagesFetched + ", failed=" + failedPages + "}";
    }
}
