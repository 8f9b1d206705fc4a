package fun.fengwk.mcrawl.core.exception;

/**
 * A freshly drawn proxy lease failed its liveness probe.
 *
 * @author fengwk
 */
public class ProxyValidationException extends CrawlException {

    public ProxyValidationException(String message) {
        super(message);
    }

    public ProxyValidationException(String message, Throwable cause) {
        super(message, cause);
    }

}
