package fun.fengwk.mcrawl.core.service.crawl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class BoundedWorkerPoolTest {

    private final CancellationToken cancellationToken = new CancellationToken();

    private BoundedWorkerPool workerPool;

    @AfterEach
    public void tearDown() {
        if (workerPool != null) {
            workerPool.close();
        }
    }

    @Test
    public void shouldNeverRunMoreItemsThanMaxConcurrency() {
        workerPool = new BoundedWorkerPool("test", 2, cancellationToken);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        List<TaskOutcome<Integer, Integer>> outcomes = workerPool.runAll("square", List.of(1, 2, 3, 4, 5, 6), item -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(30);
            active.decrementAndGet();
            return item * item;
        });

        assertThat(peak.get()).isLessThanOrEqualTo(2);
        assertThat(outcomes).extracting(TaskOutcome::item).containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(outcomes).extracting(TaskOutcome::result).containsExactly(1, 4, 9, 16, 25, 36);
    }

    @Test
    public void shouldIsolateItemFailure() {
        workerPool = new BoundedWorkerPool("test", 2, cancellationToken);

        List<TaskOutcome<String, String>> outcomes = workerPool.runAll("upper", List.of("a", "bad", "c"), item -> {
            if ("bad".equals(item)) {
                throw new IllegalStateException("boom");
            }
            return item.toUpperCase();
        });

        assertThat(outcomes.get(0).isSuccess()).isTrue();
        assertThat(outcomes.get(1).isSuccess()).isFalse();
        assertThat(outcomes.get(1).error()).hasMessage("boom");
        assertThat(outcomes.get(2).result()).isEqualTo("C");
    }

    @Test
    public void shouldStopDequeuingAfterCancellation() {
        workerPool = new BoundedWorkerPool("test", 1, cancellationToken);
        AtomicInteger started = new AtomicInteger();

        List<TaskOutcome<String, String>> outcomes = workerPool.runAll("cancel", List.of("a", "b", "c"), item -> {
            started.incrementAndGet();
            cancellationToken.cancel();
            return item;
        });

        assertThat(started.get()).isEqualTo(1);
        assertThat(outcomes.get(0).isSuccess()).isTrue();
        assertThat(outcomes.get(1).skipped()).isTrue();
        assertThat(outcomes.get(2).skipped()).isTrue();
    }

    @Test
    public void shouldSkipEverythingOnceClosed() {
        workerPool = new BoundedWorkerPool("test", 2, cancellationToken);
        workerPool.close();

        List<TaskOutcome<String, String>> outcomes = workerPool.runAll("closed", List.of("a", "b"), item -> item);

        assertThat(outcomes).allMatch(TaskOutcome::skipped);
    }

}
