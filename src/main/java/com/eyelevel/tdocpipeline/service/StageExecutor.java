package com.eyelevel.tdocpipeline.service;

import com.eyelevel.tdocpipeline.exception.PipelineException;
import com.eyelevel.tdocpipeline.model.PipelineStage;
import com.eyelevel.tdocpipeline.model.StageItem;
import com.eyelevel.tdocpipeline.model.StageOutcome;
import com.eyelevel.tdocpipeline.model.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the items of one stage on a bounded pool of OS threads.
 * <p>
 * For N items and a bound W it keeps at most W items active, waits for all of them and returns
 * exactly N outcomes in input order, whatever order they completed in. A failing item never
 * stops the others: exceptions thrown by the worker become failed outcomes. There is no
 * cancellation API; the call returns once every item has a result.
 */
@Slf4j
@Component
public class StageExecutor {

    /**
     * Executes all items of a stage.
     *
     * @param stage       the stage being run, used for thread names and log lines
     * @param items       the work items, in reporting order
     * @param worker      the worker applied to every item
     * @param concurrency maximum number of items processed at the same time, at least 1
     * @param <T>         the work item type
     * @return one outcome per item, index-aligned with {@code items}
     * @throws IllegalArgumentException if {@code concurrency} is below 1
     * @throws PipelineException        if the calling thread is interrupted while waiting
     */
    public <T extends StageItem> List<StageOutcome<T>> execute(PipelineStage stage, List<T> items,
                                                              StageWorker<T> worker, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency bound must be at least 1, was " + concurrency);
        }
        if (items.isEmpty()) {
            log.info("[{}] No items to process.", stage.getLabel());
            return List.of();
        }

        final int total = items.size();
        final int poolSize = Math.min(concurrency, total);
        log.info("[{}] Processing {} item(s) with {} parallel worker(s).", stage.getLabel(), total, poolSize);

        ThreadPoolTaskExecutor pool = createPool(stage, poolSize);
        AtomicInteger completed = new AtomicInteger();
        try {
            List<Future<StageResult>> futures = new ArrayList<>(total);
            for (T item : items) {
                futures.add(pool.submit(() -> runItem(stage, item, worker, completed, total)));
            }

            List<StageOutcome<T>> outcomes = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                outcomes.add(new StageOutcome<>(items.get(i), await(stage, items.get(i), futures.get(i))));
            }
            return outcomes;
        } finally {
            pool.shutdown();
        }
    }

    private ThreadPoolTaskExecutor createPool(PipelineStage stage, int poolSize) {
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(poolSize);
        pool.setMaxPoolSize(poolSize);
        pool.setThreadNamePrefix(stage.getLabel() + "-");
        pool.initialize();
        return pool;
    }

    private <T extends StageItem> StageResult runItem(PipelineStage stage, T item, StageWorker<T> worker,
                                                      AtomicInteger completed, int total) {
        StageResult result;
        try {
            result = worker.process(item);
            if (result == null) {
                result = StageResult.failed("Worker returned no result");
            }
        } catch (Exception e) {
            log.error("[{}] Unhandled exception while processing '{}'.", stage.getLabel(), item.itemKey(), e);
            result = StageResult.failed(describe(e));
        }
        report(stage, item, result, completed.incrementAndGet(), total);
        return result;
    }

    private <T extends StageItem> StageResult await(PipelineStage stage, T item, Future<StageResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // Only Errors get here; exceptions are already converted inside runItem.
            log.error("[{}] Worker for '{}' terminated abnormally.", stage.getLabel(), item.itemKey(), e.getCause());
            return StageResult.failed(describe(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while waiting for the " + stage.getLabel() + " stage", e);
        }
    }

    private void report(PipelineStage stage, StageItem item, StageResult result, int done, int total) {
        switch (result.getStatus()) {
            case SUCCESS -> log.info("[{}] [OK] {} - {} ({}/{})", stage.getLabel(), item.itemKey(),
                    result.getMessage(), done, total);
            case SKIPPED -> log.info("[{}] [SKIP] {} - {} ({}/{})", stage.getLabel(), item.itemKey(),
                    result.getMessage(), done, total);
            case FAILED -> log.warn("[{}] [FAIL] {} - {} ({}/{})", stage.getLabel(), item.itemKey(),
                    result.getMessage(), done, total);
        }
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
