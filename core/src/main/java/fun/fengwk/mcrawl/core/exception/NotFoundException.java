package fun.fengwk.mcrawl.core.exception;

/**
 * The requested item does not exist.
 *
 * @author fengwk
 */
public class NotFoundException extends CrawlException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

}
