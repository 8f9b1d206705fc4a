package fun.fengwk.mcrawl.core.service.crawl;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag of one platform run.
 *
 * @author fengwk
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return true if this call cancelled the token
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

}
