package fun.fengwk.mcrawl.core.exception;

/**
 * The platform rejected the request as rate limited or verification required.
 *
 * @author fengwk
 */
public class BlockedException extends CrawlException {

    public BlockedException(String message) {
        super(message);
    }

    public BlockedException(String message, Throwable cause) {
        super(message, cause);
    }

}
