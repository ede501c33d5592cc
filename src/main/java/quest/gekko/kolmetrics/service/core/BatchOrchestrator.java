package quest.gekko.kolmetrics.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import quest.gekko.kolmetrics.util.Pacer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a task over many items in fixed-size batches. Items of one batch run concurrently;
 * the next batch starts only after the whole batch has finished and the delay has passed.
 * A failing item is recorded and never affects its siblings.
 */
@Slf4j
@Component
public class BatchOrchestrator {
    private final Executor executor;
    private final Pacer pacer;

    @FunctionalInterface
    public interface ItemTask<T> {
        void run(T item) throws Exception;
    }

    public BatchOrchestrator(@Qualifier("metricsFetchExecutor") final Executor executor, final Pacer pacer) {
        this.executor = executor;
        this.pacer = pacer;
    }

    public <T> BatchResult<T> run(final String label, final List<T> items, final int batchSize, final Duration delay,
                                  final ItemTask<T> task) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be positive");
        if (items.isEmpty()) return BatchResult.empty();

        final int batches = (items.size() + batchSize - 1) / batchSize;
        final List<ItemOutcome<T>> outcomes = new ArrayList<>(items.size());
        log.info("{}: {} items in {} batches of {}", label, items.size(), batches, batchSize);

        for (int b = 0; b < batches; b++) {
            final int from = b * batchSize;
            if (b > 0 && !pause(label, delay)) {
                items.subList(from, items.size()).forEach(item -> outcomes.add(ItemOutcome.failed(item, "interrupted")));
                return BatchResult.of(outcomes, b);
            }
            final List<T> batch = items.subList(from, Math.min(from + batchSize, items.size()));
            final List<CompletableFuture<ItemOutcome<T>>> futures = batch.stream()
                    .map(item -> submit(label, item, task))
                    .toList();
            futures.forEach(f -> outcomes.add(f.join()));
            log.info("{}: batch {}/{} finished", label, b + 1, batches);
        }
        return BatchResult.of(outcomes, batches);
    }

    private <T> CompletableFuture<ItemOutcome<T>> submit(final String label, final T item, final ItemTask<T> task) {
        try {
            return CompletableFuture.supplyAsync(() -> runOne(label, item, task), executor);
        } catch (RejectedExecutionException e) {
            log.warn("{}: {} rejected by the fetch pool", label, item);
            return CompletableFuture.completedFuture(ItemOutcome.failed(item, "rejected: fetch pool saturated"));
        }
    }

    private <T> ItemOutcome<T> runOne(final String label, final T item, final ItemTask<T> task) {
        try {
            task.run(item);
            log.debug("{}: {} ok", label, item);
            return ItemOutcome.succeeded(item);
        } catch (Exception e) {
            final String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("{}: {} failed: {}", label, item, message);
            return ItemOutcome.failed(item, message);
        }
    }

    private boolean pause(final String label, final Duration delay) {
        try {
            pacer.pause(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{}: interrupted between batches, remaining items not processed", label);
            return false;
        }
    }
}
