package fun.fengwk.mcrawl.core.service.retry;

/**
 * @author fengwk
 */
@FunctionalInterface
public interface RetryableCall<T> {

    T call() throws Exception;

}
