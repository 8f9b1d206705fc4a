package fun.fengwk.mcrawl.core.exception;

/**
 * No proxy lease could be obtained within the bounded attempts.
 *
 * @author fengwk
 */
public class PoolExhaustedException extends CrawlException {

    public PoolExhaustedException(String message) {
        super(message);
    }

    public PoolExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }

}
