package fun.fengwk.mcrawl.core.service.crawl;

import fun.fengwk.mcrawl.core.exception.BlockedException;
import fun.fengwk.mcrawl.core.exception.TransientRequestException;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import fun.fengwk.mcrawl.core.service.retry.RetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Runs platform calls with retry and proxy rotation.
 *
 * <p>A blocked call discards the task's lease before the retry, so the retried call goes out through a
 * different lease.
 *
 * @author fengwk
 */
@Slf4j
@RequiredArgsConstructor
public class RequestExecutor {

    private final RetryPolicy retryPolicy;

    public static boolean isRetryable(Throwable throwable) {
        return throwable instanceof TransientRequestException
            || throwable instanceof BlockedException
            || throwable instanceof IOException;
    }

    public <T> T call(CrawlTask task, String operation, LeaseCall<T> call) {
        task.resetAttempts();
        return retryPolicy.execute(task.describe() + ":" + operation, () -> {
            int attempt = task.recordAttempt();
            ProxyLease lease = task.currentLease();
            try {
                return call.call(lease);
            } catch (BlockedException ex) {
                ProxyLease evicted = task.evictLease();
                log.warn("request blocked, lease discarded, task={}, operation={}, attempt={}, proxy={}, error={}",
                    task.describe(), operation, attempt, evicted == null ? "none" : evicted.address(), ex.getMessage());
                throw ex;
            }
        });
    }

    @FunctionalInterface
    public interface LeaseCall<T> {

        T call(ProxyLease lease) throws Exception;

    }

}
