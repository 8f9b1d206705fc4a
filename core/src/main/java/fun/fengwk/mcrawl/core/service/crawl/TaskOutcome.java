package fun.fengwk.mcrawl.core.service.crawl;

/**
 * Result of one item processed by the worker pool.
 *
 * @author fengwk
 */
public record TaskOutcome<T, R>(T item, R result, Throwable error, boolean skipped) {

    public static <T, R> TaskOutcome<T, R> success(T item, R result) {
        return new TaskOutcome<>(item, result, null, false);
    }

    public static <T, R> TaskOutcome<T, R> failure(T item, Throwable error) {
        return new TaskOutcome<>(item, null, error, false);
    }

    public static <T, R> TaskOutcome<T, R> skip(T item) {
        return new TaskOutcome<>(item, null, null, true);
    }

    public boolean isSuccess() {
        return !skipped && error == null && result != null;
    }

}
