package fun.fengwk.mcrawl.core.service.retry;

import lombok.extern.slf4j.Slf4j;

/**
 * Fixed pause inserted between platform requests.
 *
 * @author fengwk
 */
@Slf4j
public class BackoffScheduler {

    private final long crawlIntervalMs;
    private final Sleeper sleeper;

    public BackoffScheduler(long crawlIntervalMs) {
        this(crawlIntervalMs, Sleeper.THREAD);
    }

    public BackoffScheduler(long crawlIntervalMs, Sleeper sleeper) {
        this.crawlIntervalMs = Math.max(0, crawlIntervalMs);
        this.sleeper = sleeper;
    }

    public long getCrawlIntervalMs() {
        return crawlIntervalMs;
    }

    public void pause() {
        pause(crawlIntervalMs);
    }

    public void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("crawl pause interrupted, millis={}", millis);
        }
    }

}
