package webscan.crawler;

/**
 * Receives crawl progress.
 */
public interface CrawlListener {

    void onPageCrawled(String url, int depth);

    static CrawlListener noOp() {
        return (url, depth) -> { };
    }
}
