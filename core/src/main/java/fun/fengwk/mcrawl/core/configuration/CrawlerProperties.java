package fun.fengwk.mcrawl.core.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Crawl scheduling configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mcrawl.crawler")
public class CrawlerProperties {

    /**
     * Max items processed concurrently within one platform run.
     */
    private int maxConcurrency = 1;

    /**
     * Pause after every page or item request.
     */
    private long crawlIntervalMs = 2000;

    /**
     * First search page to request.
     */
    private int startPage = 1;

    /**
     * Max contents per keyword or creator, 0 means unbounded.
     */
    private int maxNotesCount = 15;

    /**
     * Max comments per content including replies, 0 means unbounded.
     */
    private int maxCommentsPerNote = 10;

    /**
     * Whether to crawl comments.
     */
    private boolean enableComments = true;

    /**
     * Whether to crawl replies of root comments.
     */
    private boolean enableSubComments = false;

    /**
     * Max search pages per keyword, 0 derives it from maxNotesCount and the platform page size.
     */
    private int searchPageLimit = 0;

    public int normalizeMaxConcurrency() {
        return Math.max(1, maxConcurrency);
    }

    public int resolveSearchPageLimit(int pageSize) {
        if (searchPageLimit > 0) {
            return searchPageLimit;
        }
        if (maxNotesCount <= 0) {
            return Integer.MAX_VALUE;
        }
        int size = Math.max(1, pageSize);
        return (maxNotesCount + size - 1) / size;
    }

}
