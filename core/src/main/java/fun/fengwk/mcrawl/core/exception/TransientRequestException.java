package fun.fengwk.mcrawl.core.exception;

/**
 * Network error, timeout or server-side failure worth retrying.
 *
 * @author fengwk
 */
public class TransientRequestException extends CrawlException {

    public TransientRequestException(String message) {
        super(message);
    }

    public TransientRequestException(String message, Throwable cause) {
        super(message, cause);
    }

}
