package fun.fengwk.mcrawl.core.exception;

/**
 * Root of crawl failures.
 *
 * @author fengwk
 */
public class CrawlException extends RuntimeException {

    public CrawlException(String message) {
        super(message);
    }

    public CrawlException(String message, Throwable cause) {
        super(message, cause);
    }

}
