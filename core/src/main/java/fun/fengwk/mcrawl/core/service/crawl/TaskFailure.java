package fun.fengwk.mcrawl.core.service.crawl;

/**
 * A task that failed after its retries.
 *
 * @author fengwk
 */
public record TaskFailure(TaskKind kind, String target, FailureReason reason, int attempts, String message) {

    public static TaskFailure of(CrawlTask task, Throwable error) {
        return new TaskFailure(task.getKind(), task.getTarget(), FailureReason.of(error), task.getAttempts(), error.getMessage());
    }

}
