package fun.fengwk.mcrawl.core.exception;

/**
 * The platform refused the request permanently.
 *
 * @author fengwk
 */
public class PlatformRequestException extends CrawlException {

    public PlatformRequestException(String message) {
        super(message);
    }

    public PlatformRequestException(String message, Throwable cause) {
        super(message, cause);
    }

}
