package fun.fengwk.mcrawl.core.service.crawl;

import fun.fengwk.mcrawl.core.model.CrawlMode;
import fun.fengwk.mcrawl.core.model.Platform;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Counters and failures of one platform run.
 *
 * @author fengwk
 */
public class CrawlReport {

    public enum Status {
        RUNNING,
        COMPLETED,
        CANCELLED,
        ABORTED
    }

    private final Platform platform;
    private volatile CrawlMode mode;
    private final AtomicInteger contents = new AtomicInteger();
    private final AtomicInteger comments = new AtomicInteger();
    private final AtomicInteger creators = new AtomicInteger();
    private final ConcurrentLinkedQueue<TaskFailure> failures = new ConcurrentLinkedQueue<>();
    private volatile Status status = Status.RUNNING;
    private volatile String abortReason;

    public CrawlReport(Platform platform, CrawlMode mode) {
        this.platform = platform;
        this.mode = mode;
    }

    public static CrawlReport aborted(Platform platform, CrawlMode mode, String reason) {
        CrawlReport report = new CrawlReport(platform, mode);
        report.abort(reason);
        return report;
    }

    void setMode(CrawlMode mode) {
        this.mode = mode;
    }

    void addContents(int count) {
        contents.addAndGet(count);
    }

    void addComments(int count) {
        comments.addAndGet(count);
    }

    void addCreators(int count) {
        creators.addAndGet(count);
    }

    void recordFailure(TaskFailure failure) {
        failures.add(failure);
    }

    void finish(boolean cancelled) {
        if (status == Status.RUNNING) {
            status = cancelled ? Status.CANCELLED : Status.COMPLETED;
        }
    }

    void abort(String reason) {
        abortReason = reason;
        status = Status.ABORTED;
    }

    public Platform getPlatform() {
        return platform;
    }

    public CrawlMode getMode() {
        return mode;
    }

    public int getContents() {
        return contents.get();
    }

    public int getComments() {
        return comments.get();
    }

    public int getCreators() {
        return creators.get();
    }

    public List<TaskFailure> getFailures() {
        return new ArrayList<>(failures);
    }

    public List<TaskFailure> getFailures(FailureReason reason) {
        return failures.stream().filter(failure -> failure.reason() == reason).collect(Collectors.toList());
    }

    public Status getStatus() {
        return status;
    }

    public String getAbortReason() {
        return abortReason;
    }

    @Override
    public String toString() {
        return "CrawlReport{platform=" + platform
            + ", mode=" + mode
            + ", status=" + status
            + ", contents=" + contents
            + ", comments=" + comments
            + ", creators=" + creators
            + ", failures=" + failures.size()
            + (abortReason == null ? "" : ", abortReason=" + abortReason)
            + "}";
    }

}
