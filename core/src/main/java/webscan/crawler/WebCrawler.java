package webscan.crawler;

import webscan.http.HttpRequest;
import webscan.http.HttpResponse;
import webscan.http.RequestExecutor;
import webscan.http.RequestOutcome;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Краулер, обнаруживающий страницы и формы в пределах области исходного URL.
 *
 * <p>Обход выполняется в ширину по уровням глубины:
 * <ul>
 *   <li>robots.txt загружается один раз; пути под {@code Disallow} для {@code User-agent: *}
 *       не запрашиваются</li>
 *   <li>на каждом уровне все непосещенные URL загружаются параллельно</li>
 *   <li>ссылки извлекаются только из HTML страниц, редирект считается ссылкой</li>
 *   <li>URL вне области, статические ресурсы и служебные каталоги отбрасываются</li>
 *   <li>URL, чей хост отклонен фильтром целей, отбрасываются до постановки в очередь</li>
 * </ul>
 *
 * <p>Обход завершается, когда на текущем уровне нет новых URL, достигнута
 * {@code maxDepth} или исчерпан лимит {@code maxUrls}. Ошибка загрузки страницы
 * не прерывает обход. Экземпляр рассчитан на один обход.
 */
public final class WebCrawler {
    private static final Logger logger = Logger.getLogger(WebCrawler.class.getName());

    private final RequestExecutor executor;
    private final CrawlOptions options;
    private final CrawlListener listener;
    private final Predicate<String> targetFilter;

    private final Set<String> visited = ConcurrentHashMap.newKeySet();
    private final Set<String> found = Collections.synchronizedSet(new LinkedHashSet<>());
    private final Set<DiscoveredForm> forms = Collections.synchronizedSet(new LinkedHashSet<>());
    private final AtomicInteger pagesFetched = new AtomicInteger();
    private final AtomicInteger failedPages = new AtomicInteger();
    private final AtomicInteger robotsBlocked = new AtomicInteger();

    private DomainScope scope;
    private RobotsRules robots = RobotsRules.allowAll();

    public WebCrawler(RequestExecutor executor, CrawlOptions options) {
        this(executor, options, CrawlListener.noOp());
    }

    public WebCrawler(RequestExecutor executor, CrawlOptions options, CrawlListener listener) {
        this(executor, options, listener, url -> true);
    }

    /**
     * @param targetFilter returns false for discovered URLs whose host must not be visited
     */
    public WebCrawler(RequestExecutor executor, CrawlOptions options, CrawlListener listener,
                      Predicate<String> targetFilter) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
        this.targetFilter = Objects.requireNonNull(targetFilter, "targetFilter cannot be null");
    }

    /**
     * Обходит сайт начиная с исходного URL.
     *
     * @param seedUrl абсолютный http(s) URL
     * @return найденные URL и формы
     * @throws IllegalArgumentException если URL некорректен
     */
    public CrawlResult crawl(String seedUrl) {
        Instant startTime = Instant.now();
        String seed = UrlNormalizer.normalize(seedUrl);
        this.scope = new DomainScope(seed, options.getScopePolicy());

        logger.info("Starting crawl of " + seed + " with " + options);

        if (options.isFollowRobots()) {
            this.robots = fetchRobots(seed);
        }

        if (isAllowedByRobots(seed)) {
            found.add(seed);
        } else {
            robotsBlocked.incrementAndGet();
            logger.info("Seed URL is disallowed by robots.txt: " + seed);
        }

        ExecutorService pool = Executors.newFixedThreadPool(options.getParallelism());
        try {
            int processed = 0;
            for (int depth = 0; depth <= options.getMaxDepth(); depth++) {
                List<String> toVisit = pendingUrls(options.getMaxUrls() - processed);
                if (toVisit.isEmpty()) {
                    logger.fine("No unvisited URLs left at depth " + depth);
                    break;
                }

                logger.info("Crawling depth " + depth + "/" + options.getMaxDepth() + ": " + toVisit.size() + " URL(s)");
                visitAll(pool, toVisit, depth);

                processed += toVisit.size();
                if (processed >= options.getMaxUrls()) {
                    logger.info("Reached URL limit (" + options.getMaxUrls() + ")");
                    break;
                }
                if (executor.getControl().isCancelled() || Thread.currentThread().isInterrupted()) {
                    logger.info("Crawl cancelled at depth " + depth);
                    break;
                }
            }
        } finally {
            pool.shutdownNow();
        }

        Set<String> urls;
        synchronized (found) {
            urls = new LinkedHashSet<>(found);
        }
        List<DiscoveredForm> formList;
        synchronized (forms) {
            formList = new ArrayList<>(forms);
        }

        CrawlResult result = new CrawlResult(seed, urls, formList, pagesFetched.get(), failedPages.get(),
            robotsBlocked.get(), Duration.between(startTime, Instant.now()));
        logger.info("Crawl finished: " + result);
        return result;
    }

    private List<String> pendingUrls(int limit) {
        List<String> pending = new ArrayList<>();
        synchronized (found) {
            for (String url : found) {
                if (pending.size() >= limit) {
                    break;
                }
                if (!visited.contains(url)) {
                    pending.add(url);
                }
            }
        }
        return pending;
    }

    private void visitAll(ExecutorService pool, List<String> urls, int depth) {
        List<Future<?>> futures = new ArrayList<>();
        for (String url : urls) {
            futures.add(pool.submit(() -> visit(url, depth)));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                logger.log(Level.WARNING, "Page visit failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                return;
            }
        }
    }

    private void visit(String url, int depth) {
        if (!visited.add(url)) {
            return;
        }
        if (!isAllowedByRobots(url)) {
            robotsBlocked.incrementAndGet();
            logger.fine("Skipping " + url + " (disallowed by robots.txt)");
            return;
        }

        RequestOutcome outcome = executor.send(HttpRequest.get(url));
        if (!outcome.isOk()) {
            failedPages.incrementAndGet();
            logger.fine("Page not crawlable: " + url + " (" + outcome.getKind() + ")");
            return;
        }

        HttpResponse response = outcome.getResponse().get();
        pagesFetched.incrementAndGet();
        listener.onPageCrawled(url, depth);

        response.getLocation()
            .flatMap(location -> UrlNormalizer.resolve(url, location))
            .ifPresent(this::offer);

        if (!response.isHtml() || response.getBody().isEmpty()) {
            return;
        }

        for (String link : LinkExtractor.extract(response.getBody(), url)) {
            offer(link);
        }

        for (DiscoveredForm form : FormExtractor.extract(response.getBody(), url)) {
            offer(form.getAction());
            if (scope.isInScope(form.getAction()) && forms.add(form)) {
                logger.fine("Discovered form: " + form);
            }
        }
    }

    private void offer(String url) {
        if (!shouldKeep(url)) {
            return;
        }
        synchronized (found) {
            if (found.size() < options.getMaxUrls() && !visited.contains(url)) {
                found.add(url);
            }
        }
    }

    private boolean shouldKeep(String url) {
        if (!scope.isInScope(url)) {
            return false;
        }
        String path = URI.create(url).getRawPath();
        if (UrlFilter.isIgnored(path)) {
            return false;
        }
        return isAllowedByRobots(url) && targetFilter.test(url);
    }

    private boolean isAllowedByRobots(String url) {
        URI uri = URI.create(url);
        String pathAndQuery = uri.getRawPath() + (uri.getRawQuery() != null ? "?" + uri.getRawQuery() : "");
        return robots.isAllowed(pathAndQuery);
    }

    private RobotsRules fetchRobots(String seed) {
        URI uri = URI.create(seed);
        String robotsUrl = uri.getScheme() + "://" + uri.getRawAuthority() + "/robots.txt";

        RequestOutcome outcome = executor.send(HttpRequest.get(robotsUrl));
        if (outcome.isOk() && outcome.getResponse().get().getStatusCode() == 200) {
            RobotsRules rules = RobotsRules.parse(outcome.getResponse().get().getBody());
            logger.info("Loaded robots.txt with " + rules.getDisallowedPrefixes().size() + " disallow rule(s)");
            return rules;
        }
        logger.fine("No usable robots.txt at " + robotsUrl);
        return RobotsRules.allowAll();
    }
}
