package fun.fengwk.mcrawl.core.service.retry;

/**
 * @author fengwk
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;

}
