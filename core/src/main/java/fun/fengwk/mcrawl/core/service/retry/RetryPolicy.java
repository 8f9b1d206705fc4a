package fun.fengwk.mcrawl.core.service.retry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Bounded retry with fixed or exponential backoff.
 *
 * <p>Each {@link #execute} call gets a fresh {@link Retry} instance so attempt counters are never shared
 * between concurrent callers.
 *
 * @author fengwk
 */
@Slf4j
public class RetryPolicy {

    private static final long MIN_WAIT_MS = 10;

    private final int maxAttempts;
    private final RetryConfig retryConfig;

    public RetryPolicy(int maxAttempts, long waitMs, double multiplier, Predicate<Throwable> retryOn) {
        this.maxAttempts = Math.max(1, maxAttempts);
        Duration wait = Duration.ofMillis(Math.max(MIN_WAIT_MS, waitMs));
        IntervalFunction intervalFunction = multiplier > 1.0
            ? IntervalFunction.ofExponentialBackoff(wait, multiplier)
            : IntervalFunction.of(wait);
        this.retryConfig = RetryConfig.custom()
            .maxAttempts(this.maxAttempts)
            .intervalFunction(intervalFunction)
            .retryOnException(retryOn)
            .build();
    }

    public static RetryPolicy fixed(int maxAttempts, long waitMs, Predicate<Throwable> retryOn) {
        return new RetryPolicy(maxAttempts, waitMs, 1.0, retryOn);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Run the call, retrying failures accepted by the retry predicate.
     *
     * @param operation name used in logs
     * @param call      call to run
     * @return call result
     * @throws RuntimeException the last failure once attempts are exhausted or the failure is not retryable;
     *                          checked failures are wrapped in {@link IllegalStateException}
     */
    public <T> T execute(String operation, RetryableCall<T> call) {
        Retry retry = Retry.of(operation, retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn(
            "retry scheduled, operation={}, attempt={}, waitMs={}, error={}",
            operation,
            event.getNumberOfRetryAttempts(),
            event.getWaitInterval().toMillis(),
            describe(event.getLastThrowable())
        ));
        retry.getEventPublisher().onError(event -> log.warn(
            "retry exhausted, operation={}, attempts={}, error={}",
            operation,
            event.getNumberOfRetryAttempts(),
            describe(event.getLastThrowable())
        ));
        try {
            return retry.executeCheckedSupplier(call::call);
        } catch (RuntimeException | Error ex) {
            throw ex;
        } catch (Throwable ex) {
            throw new IllegalStateException(operation + " failed: " + ex.getMessage(), ex);
        }
    }

    private String describe(Throwable throwable) {
        if (throwable == null) {
            return "";
        }
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }

}
