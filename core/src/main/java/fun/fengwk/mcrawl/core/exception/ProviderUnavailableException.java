package fun.fengwk.mcrawl.core.exception;

/**
 * The proxy provider failed to hand out leases.
 *
 * @author fengwk
 */
public class ProviderUnavailableException extends CrawlException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

}
