package fun.fengwk.mcrawl.core.service.crawl;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs items on at most {@code maxConcurrency} workers.
 *
 * <p>A permit is taken before an item is dequeued, so once the cancellation token is set no further item
 * starts while running items finish. Handler failures are captured in the outcome.
 *
 * @author fengwk
 */
@Slf4j
public class BoundedWorkerPool implements AutoCloseable {

    private final String name;
    private final int maxConcurrency;
    private final Semaphore permits;
    private final ExecutorService executor;
    private final CancellationToken cancellationToken;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public BoundedWorkerPool(String name, int maxConcurrency, CancellationToken cancellationToken) {
        this.name = name;
        this.maxConcurrency = Math.max(1, maxConcurrency);
        this.permits = new Semaphore(this.maxConcurrency);
        this.cancellationToken = cancellationToken;
        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(this.maxConcurrency, runnable -> {
            Thread thread = new Thread(runnable, "mcrawl-" + name + "-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Process all items and wait for them, outcomes follow the item order.
     */
    public <T, R> List<TaskOutcome<T, R>> runAll(String stage, List<T> items, ItemHandler<T, R> handler) {
        List<CompletableFuture<TaskOutcome<T, R>>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            if (!takePermit()) {
                futures.add(CompletableFuture.completedFuture(TaskOutcome.skip(item)));
                continue;
            }
            try {
                futures.add(CompletableFuture.supplyAsync(() -> runOne(stage, item, handler), executor));
            } catch (RejectedExecutionException ex) {
                permits.release();
                log.warn("worker pool rejected item, pool={}, stage={}, item={}", name, stage, item);
                futures.add(CompletableFuture.completedFuture(TaskOutcome.failure(item, ex)));
            }
        }

        List<TaskOutcome<T, R>> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<TaskOutcome<T, R>> future : futures) {
            outcomes.add(future.join());
        }
        long skipped = outcomes.stream().filter(TaskOutcome::skipped).count();
        if (skipped > 0) {
            log.info("worker pool skipped cancelled items, pool={}, stage={}, skipped={}", name, stage, skipped);
        }
        return outcomes;
    }

    private boolean takePermit() {
        if (cancellationToken.isCancelled() || closed.get()) {
            return false;
        }
        try {
            permits.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancellationToken.cancel();
            log.info("worker pool interrupted, cancel remaining items, pool={}", name);
            return false;
        }
        if (cancellationToken.isCancelled()) {
            permits.release();
            return false;
        }
        return true;
    }

    private <T, R> TaskOutcome<T, R> runOne(String stage, T item, ItemHandler<T, R> handler) {
        try {
            return TaskOutcome.success(item, handler.handle(item));
        } catch (Exception ex) {
            log.warn("worker item failed, pool={}, stage={}, item={}, error={}", name, stage, item, ex.getMessage(), ex);
            return TaskOutcome.failure(item, ex);
        } finally {
            permits.release();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdownNow();
    }

}
