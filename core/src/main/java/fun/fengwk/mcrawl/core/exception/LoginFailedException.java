package fun.fengwk.mcrawl.core.exception;

/**
 * Login verification attempts were exhausted.
 *
 * @author fengwk
 */
public class LoginFailedException extends CrawlException {

    public LoginFailedException(String message) {
        super(message);
    }

    public LoginFailedException(String message, Throwable cause) {
        super(message, cause);
    }

}
