package webscan;

import webscan.crawler.CrawlResult;
import webscan.crawler.DiscoveredForm;
import webscan.crawler.UrlNormalizer;
import webscan.crawler.WebCrawler;
import webscan.http.ExecutionControl;
import webscan.http.HttpClient;
import webscan.http.Sleeper;
import webscan.http.StandardHttpClient;
import webscan.model.*;
import webscan.scanner.PluginRegistry;
import webscan.scanner.ScanContext;
import webscan.scanner.ScannerPlugin;
import webscan.security.HostResolver;
import webscan.security.TargetGuard;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Главный оркестратор сканирования веб-приложения.
 *
 * <p>Одно сканирование проходит фазы:
 * <ol>
 *   <li>проверка конфигурации и цели (синхронно, до первого запроса)</li>
 *   <li>обход сайта краулером, если он включен</li>
 *   <li>запуск выбранных плагинов на всех найденных URL в пуле потоков</li>
 *   <li>агрегация уязвимостей и статистики</li>
 * </ol>
 *
 * <p>Защита от SSRF строится один раз на сканирование: исходный URL проверяется
 * синхронно, а каждый новый хост, найденный при обходе или в редиректе, проверяется
 * перед первым запросом к нему.
 *
 * <p>При превышении общего таймаута запросы в полете прерываются, а уже найденные
 * уязвимости возвращаются как частичный результат. Непредвиденная ошибка переводит
 * сканирование в {@link ScanStatus#FAILED} с сохранением найденного.
 */
public final class ScanOrchestrator {
    private static final Logger logger = Logger.getLogger(ScanOrchestrator.class.getName());

    private final PluginRegistry registry;
    private final Function<ScanOptions, HttpClient> httpClientFactory;
    private final HostResolver hostResolver;
    private final Sleeper sleeper;
    private final ScanProgressListener progressListener;
    private final ExecutorService scanDrivers;
    private final Map<String, ScanRun> scans = new ConcurrentHashMap<>();

    private ScanOrchestrator(Builder builder) {
        this.registry = builder.registry != null ? builder.registry : PluginRegistry.withDefaults();
        this.httpClientFactory = builder.httpClientFactory != null
            ? builder.httpClientFactory
            : options -> new StandardHttpClient(options.toHttpClientConfig());
        this.hostResolver = builder.hostResolver != null ? builder.hostResolver : HostResolver.system();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.system();
        this.progressListener = builder.progressListener != null
            ? builder.progressListener
            : ScanProgressListener.noOp();
        this.scanDrivers = Executors.newCachedThreadPool();
        logger.info("Scan orchestrator initialized with plugins: " + registry.availablePluginNames());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Проверяет запрос и запускает сканирование в фоне.
     *
     * @param targetUrl исходный URL
     * @param scanTypes имена плагинов из {@link #availablePlugins()}
     * @param options параметры сканирования
     * @return дескриптор запущенного сканирования
     * @throws ScanConfigurationException если URL некорректен, плагин неизвестен
     *         или цель отклонена защитой от SSRF
     */
    public ScanHandle startScan(String targetUrl, List<String> scanTypes, ScanOptions options) {
        Objects.requireNonNull(options, "options cannot be null");
        if (scanTypes == null || scanTypes.isEmpty()) {
            throw new ScanConfigurationException("At least one scan type is required");
        }

        String seed;
        try {
            seed = UrlNormalizer.normalize(targetUrl);
        } catch (IllegalArgumentException e) {
            throw new ScanConfigurationException("Malformed target URL: " + targetUrl, e);
        }

        List<String> types = new ArrayList<>(new LinkedHashSet<>(scanTypes));
        for (String type : types) {
            if (!registry.contains(type)) {
                throw new ScanConfigurationException(
                    "Unknown scan type '" + type + "', available: " + registry.availablePluginNames());
            }
        }

        TargetGuard guard = TargetGuard.builder()
            .allowPrivateTargets(options.isAllowPrivateTargets())
            .allowedHosts(options.getAllowedHosts())
            .deniedHosts(options.getDeniedHosts())
            .resolver(hostResolver)
            .build();
        guard.check(seed);

        ScanHandle handle = new ScanHandle(UUID.randomUUID().toString(), seed, types, Instant.now());
        ScanRun run = new ScanRun(handle, options, guard);
        scans.put(handle.scanId(), run);

        logger.info("Scan " + handle.scanId() + " accepted for " + seed + " with " + types);
        try {
            scanDrivers.submit(() -> execute(run));
        } catch (RejectedExecutionException e) {
            scans.remove(handle.scanId());
            throw new ScanConfigurationException("Orchestrator is shut down", e);
        }
        return handle;
    }

    private void execute(ScanRun run) {
        String scanId = run.handle.scanId();
        ScanStatisticsTracker tracker = run.tracker;
        tracker.start();
        Instant deadline = Instant.now().plus(run.options.getScanTimeout());

        try (HttpClient client = httpClientFactory.apply(run.options)) {
            ScanContext.Builder contextBuilder = ScanContext.builder()
                .scanId(scanId)
                .targetUrl(run.handle.targetUrl())
                .options(run.options)
                .httpClient(client)
                .control(run.control)
                .statistics(tracker)
                .sleeper(sleeper)
                .targetGuard(run.guard);

            List<String> targets = List.of(run.handle.targetUrl());
            List<DiscoveredForm> forms = List.of();
            if (run.options.isCrawlEnabled()) {
                changePhase(run, ScanPhase.CRAWLING);
                CrawlResult crawl = crawl(run, contextBuilder.build(), deadline);
                if (crawl != null) {
                    List<String> permitted = new ArrayList<>();
                    for (String url : crawl.getUrls()) {
                        if (run.guard.permits(url)) {
                            permitted.add(url);
                        }
                    }
                    if (!permitted.isEmpty()) {
                        targets = permitted;
                    }
                    forms = crawl.getForms();
                    tracker.formsDiscovered(forms.size());
                }
            }

            if (!run.control.isCancelled()) {
                changePhase(run, ScanPhase.SCANNING);
                runPlugins(run, contextBuilder.forms(forms).build(), targets, deadline);
            }

            ScanStatus terminal = run.cancelRequested.get() ? ScanStatus.CANCELLED : ScanStatus.COMPLETED;
            tracker.finish(terminal);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Scan " + scanId + " failed", e);
            tracker.recordError(e.getClass().getSimpleName() + ": " + e.getMessage());
            tracker.finish(ScanStatus.FAILED);
        } finally {
            run.control.cancel();
            ScanStatistics statistics = tracker.snapshot();
            logger.info("Scan " + scanId + " finished: " + statistics);
            notifyListener(() -> progressListener.onScanComplete(scanId, statistics));
            run.done.countDown();
        }
    }

    private CrawlResult crawl(ScanRun run, ScanContext context, Instant deadline) {
        String scanId = run.handle.scanId();
        WebCrawler crawler = new WebCrawler(context.newRequestExecutor(), run.options.toCrawlOptions(),
            (url, depth) -> {
                run.tracker.urlCrawled(url);
                notifyListener(() -> progressListener.onUrlCrawled(scanId, url, depth));
            },
            context::permits);

        ExecutorService crawlThread = Executors.newSingleThreadExecutor();
        Future<CrawlResult> future = crawlThread.submit(() -> crawler.crawl(run.handle.targetUrl()));
        try {
            return future.get(remaining(deadline), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warning("Scan " + scanId + " timed out while crawling");
            run.tracker.markTimedOut();
            run.control.cancel();
            future.cancel(true);
            return null;
        } catch (ExecutionException e) {
            logger.log(Level.WARNING, "Crawl of " + run.handle.targetUrl() + " failed, scanning seed only", e.getCause());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.control.cancel();
            future.cancel(true);
            return null;
        } finally {
            crawlThread.shutdownNow();
        }
    }

    private void runPlugins(ScanRun run, ScanContext context, List<String> targets, Instant deadline) {
        String scanId = run.handle.scanId();
        List<ScannerPlugin> plugins = new ArrayList<>();
        for (String type : run.handle.scanTypes()) {
            Optional<ScannerPlugin> created = registry.create(type);
            if (created.isEmpty()) {
                logger.warning("Plugin '" + type + "' could not be instantiated, skipping");
                continue;
            }
            ScannerPlugin plugin = created.get();
            try {
                plugin.setup(context);
                plugins.add(plugin);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Setup of plugin '" + type + "' failed, plugin abandoned", e);
                run.tracker.recordError("Plugin '" + type + "' setup failed: " + e.getMessage());
            }
        }

        ExecutorService workers = Executors.newFixedThreadPool(run.options.getConcurrency());
        Map<ScannerPlugin, List<Future<?>>> tasks = new LinkedHashMap<>();
        Map<ScannerPlugin, AtomicInteger> counts = new LinkedHashMap<>();
        try {
            for (ScannerPlugin plugin : plugins) {
                AtomicInteger count = new AtomicInteger();
                counts.put(plugin, count);
                notifyListener(() -> progressListener.onPluginStarted(scanId, plugin.getName(), targets.size()));
                List<Future<?>> futures = new ArrayList<>();
                for (String url : targets) {
                    futures.add(workers.submit(() -> scanUrl(run, plugin, url, count)));
                }
                tasks.put(plugin, futures);
            }

            for (Map.Entry<ScannerPlugin, List<Future<?>>> entry : tasks.entrySet()) {
                ScannerPlugin plugin = entry.getKey();
                boolean finished = awaitAll(run, entry.getValue(), deadline);
                run.tracker.pluginExecuted();
                int count = counts.get(plugin).get();
                logger.info("Plugin " + plugin.getName() + " completed with " + count + " finding(s)");
                notifyListener(() -> progressListener.onPluginCompleted(scanId, plugin.getName(), count));
                if (!finished) {
                    break;
                }
            }
        } finally {
            workers.shutdownNow();
            for (ScannerPlugin plugin : plugins) {
                try {
                    plugin.cleanup();
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Cleanup of plugin '" + plugin.getName() + "' failed", e);
                }
            }
        }
    }

    private void scanUrl(ScanRun run, ScannerPlugin plugin, String url, AtomicInteger count) {
        if (run.control.isCancelled()) {
            return;
        }
        run.tracker.setCurrentUrl(url);
        List<Finding> findings;
        try {
            findings = plugin.scan(url);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Plugin " + plugin.getName() + " failed on " + url, e);
            return;
        }
        for (Finding finding : findings) {
            if (run.findings.add(finding)) {
                count.incrementAndGet();
                run.tracker.findingRecorded(plugin.getName());
                notifyListener(() -> progressListener.onFinding(run.handle.scanId(), finding));
            }
        }
    }

    /**
     * @return false if the deadline passed or the wait was interrupted
     */
    private boolean awaitAll(ScanRun run, List<Future<?>> futures, Instant deadline) {
        for (Future<?> future : futures) {
            try {
                future.get(remaining(deadline), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                logger.warning("Scan " + run.handle.scanId() + " timed out, returning partial results");
                run.tracker.markTimedOut();
                run.control.cancel();
                futures.forEach(f -> f.cancel(true));
                return false;
            } catch (ExecutionException e) {
                logger.log(Level.WARNING, "Scan task failed", e.getCause());
            } catch (CancellationException e) {
                logger.fine("Scan task cancelled");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.control.cancel();
                futures.forEach(f -> f.cancel(true));
                return false;
            }
        }
        return true;
    }

    private static long remaining(Instant deadline) {
        return Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
    }

    private void changePhase(ScanRun run, ScanPhase phase) {
        run.tracker.setPhase(phase);
        logger.info("Scan " + run.handle.scanId() + " entering phase " + phase);
        notifyListener(() -> progressListener.onPhaseChanged(run.handle.scanId(), phase));
    }

    private void notifyListener(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Progress listener failed", e);
        }
    }

    public ScanStatistics getStatistics(ScanHandle handle) {
        return run(handle).tracker.snapshot();
    }

    /**
     * Уязвимости, найденные на данный момент. До завершения сканирования список частичный.
     */
    public List<Finding> getFindings(ScanHandle handle) {
        return run(handle).findings.getFindings();
    }

    public ScanStatus getStatus(ScanHandle handle) {
        return run(handle).tracker.getStatus();
    }

    /**
     * Requests cancellation. Findings collected so far stay available.
     *
     * @return false if the scan had already reached a terminal status
     */
    public boolean cancel(ScanHandle handle) {
        ScanRun run = run(handle);
        if (run.tracker.getStatus().isTerminal()) {
            return false;
        }
        run.cancelRequested.set(true);
        run.control.cancel();
        logger.info("Cancellation requested for scan " + handle.scanId());
        return true;
    }

    /**
     * Waits until the scan reaches a terminal status or the timeout elapses.
     *
     * @return the status at return time
     */
    public ScanStatus awaitCompletion(ScanHandle handle, Duration timeout) throws InterruptedException {
        ScanRun run = run(handle);
        run.done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return run.tracker.getStatus();
    }

    public List<String> availablePlugins() {
        return registry.availablePluginNames();
    }

    private ScanRun run(ScanHandle handle) {
        Objects.requireNonNull(handle, "handle cannot be null");
        ScanRun run = scans.get(handle.scanId());
        if (run == null) {
            throw new IllegalArgumentException("Unknown scan: " + handle.scanId());
        }
        return run;
    }

    /**
     * Останавливает все сканирования и пул потоков.
     */
    public void shutdown() {
        logger.info("Shutting down scan orchestrator");
        scans.values().forEach(run -> run.control.cancel());
        scanDrivers.shutdown();
        try {
            if (!scanDrivers.awaitTermination(60, TimeUnit.SECONDS)) {
                scanDrivers.shutdownNow();
            }
        } catch (InterruptedException e) {
            scanDrivers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * State of one scan, owned by this orchestrator.
     */
    private static final class ScanRun {
        private final ScanHandle handle;
        private final ScanOptions options;
        private final TargetGuard guard;
        private final ScanStatisticsTracker tracker;
        private final ExecutionControl control;
        private final FindingAggregator findings = new FindingAggregator();
        private final AtomicBoolean cancelRequested = new AtomicBoolean();
        private final CountDownLatch done = new CountDownLatch(1);

        private ScanRun(ScanHandle handle, ScanOptions options, TargetGuard guard) {
            this.handle = handle;
            this.options = options;
            this.guard = guard;
            this.tracker = new ScanStatisticsTracker(handle.scanId());
            this.control = new ExecutionControl(options.getMaxRequests());
            this.tracker.bindRequestCounter(control::getIssued);
        }
    }

    public static class Builder {
        private PluginRegistry registry;
        private Function<ScanOptions, HttpClient> httpClientFactory;
        private HostResolver hostResolver;
        private Sleeper sleeper;
        private ScanProgressListener progressListener;

        public Builder registry(PluginRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder httpClientFactory(Function<ScanOptions, HttpClient> httpClientFactory) {
            this.httpClientFactory = httpClientFactory;
            return this;
        }

        public Builder hostResolver(HostResolver hostResolver) {
            this.hostResolver = hostResolver;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder progressListener(ScanProgressListener progressListener) {
            this.progressListener = progressListener;
            return this;
        }

        public ScanOrchestrator build() {
            return new ScanOrchestrator(this);
        }
    }
}
