package fun.fengwk.mcrawl.core.exception;

/**
 * The requested item was deleted or hidden by its owner.
 *
 * @author fengwk
 */
public class ItemWithdrawnException extends NotFoundException {

    public ItemWithdrawnException(String message) {
        super(message);
    }

    public ItemWithdrawnException(String message, Throwable cause) {
        super(message, cause);
    }

}
