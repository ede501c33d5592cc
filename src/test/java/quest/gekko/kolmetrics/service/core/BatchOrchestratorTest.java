package quest.gekko.kolmetrics.service.core;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import quest.gekko.kolmetrics.config.PipelineConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchOrchestratorTest {

    private final List<Duration> pauses = new ArrayList<>();
    private final BatchOrchestrator orchestrator = new BatchOrchestrator(Runnable::run, pauses::add);

    @Test
    void run_splitsIntoBatchesAndPausesOnlyBetweenThem() {
        List<Integer> items = IntStream.rangeClosed(1, 23).boxed().toList();
        List<Integer> seen = new CopyOnWriteArrayList<>();

        BatchResult<Integer> result = orchestrator.run("test", items, 10, Duration.ofSeconds(1), seen::add);

        assertEquals(23, result.total());
        assertEquals(23, result.succeeded());
        assertEquals(3, result.batches());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1)), pauses);
        assertEquals(items, seen);
    }

    @Test
    void run_failingItemDoesNotAffectSiblings() {
        BatchResult<Integer> result = orchestrator.run("test", List.of(1, 2, 3), 3, Duration.ZERO, item -> {
            if (item == 2) throw new IllegalStateException("boom " + item);
        });

        assertEquals(2, result.succeeded());
        assertEquals(1, result.failed());
        assertEquals(List.of("boom 2"), result.sampleErrors(5));
        assertFalse(result.results().get(1).success());
        assertTrue(result.results().get(2).success());
    }

    @Test
    void run_emptyInputDoesNothing() {
        BatchResult<Integer> result = orchestrator.run("test", List.of(), 5, Duration.ofSeconds(1), item -> { });

        assertEquals(0, result.total());
        assertTrue(pauses.isEmpty());
    }

    @Test
    void run_interruptedPauseFailsTheRemainingItems() {
        BatchOrchestrator interrupting = new BatchOrchestrator(Runnable::run, delay -> {
            throw new InterruptedException();
        });

        BatchResult<Integer> result = interrupting.run("test", List.of(1, 2, 3, 4), 2, Duration.ofSeconds(1), item -> { });

        assertEquals(4, result.total());
        assertEquals(2, result.succeeded());
        assertEquals(List.of("interrupted", "interrupted"), result.sampleErrors(5));
        // clear the flag set by the orchestrator
        assertTrue(Thread.interrupted());
    }

    @Test
    void run_rejectsNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.run("test", List.of(1), 0, Duration.ZERO, item -> { }));
    }

    @Test
    void run_itemsOfOneBatchOverlapAndNextBatchWaitsForAllOfThem() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.initialize();
        try {
            List<CountDownLatch> gates = List.of(new CountDownLatch(4), new CountDownLatch(4));
            AtomicInteger finished = new AtomicInteger();
            List<Integer> finishedBeforeSecondBatchItem = new CopyOnWriteArrayList<>();
            BatchOrchestrator concurrent = new BatchOrchestrator(executor, delay -> { });

            BatchResult<Integer> result = concurrent.run("test", IntStream.range(0, 8).boxed().toList(), 4,
                    Duration.ZERO, item -> {
                        if (item >= 4) finishedBeforeSecondBatchItem.add(finished.get());
                        CountDownLatch gate = gates.get(item / 4);
                        gate.countDown();
                        // every item of the batch has to be running at the same time to get past here
                        if (!gate.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("batch ran serially");
                        Thread.sleep(20);
                        finished.incrementAndGet();
                    });

            assertEquals(8, result.succeeded());
            assertEquals(4, finishedBeforeSecondBatchItem.size());
            finishedBeforeSecondBatchItem.forEach(count -> assertTrue(count >= 4));
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void run_overlappingRunsOnSharedFetchPoolAllComplete() throws Exception {
        ThreadPoolTaskExecutor pool = new PipelineConfig().metricsFetchExecutor(TestProperties.refresh());
        ExecutorService tenants = Executors.newFixedThreadPool(6);
        try {
            BatchOrchestrator shared = new BatchOrchestrator(pool, delay -> { });
            List<Future<BatchResult<Integer>>> runs = new ArrayList<>();
            for (int t = 0; t < 6; t++) {
                runs.add(tenants.submit(() -> shared.run("tenant", IntStream.range(0, 10).boxed().toList(), 10,
                        Duration.ZERO, item -> Thread.sleep(300))));
            }

            for (Future<BatchResult<Integer>> run : runs) {
                BatchResult<Integer> result = run.get(30, TimeUnit.SECONDS);
                assertEquals(10, result.total());
                assertEquals(10, result.succeeded());
            }
        } finally {
            tenants.shutdownNow();
            pool.shutdown();
        }
    }

    @Test
    void run_itemRejectedByFullExecutorIsRecordedAsFailure() {
        ThreadPoolTaskExecutor single = new ThreadPoolTaskExecutor();
        single.setCorePoolSize(1);
        single.setMaxPoolSize(1);
        single.setQueueCapacity(0);
        single.initialize();
        try {
            BatchOrchestrator orchestratorOnFullPool = new BatchOrchestrator(single, delay -> { });

            BatchResult<Integer> result = orchestratorOnFullPool.run("test", List.of(1, 2), 2, Duration.ZERO,
                    item -> Thread.sleep(200));

            assertEquals(2, result.total());
            assertEquals(1, result.succeeded());
            assertEquals(1, result.failed());
            assertTrue(result.sampleErrors(5).get(0).startsWith("rejected"));
        } finally {
            single.shutdown();
        }
    }
}
