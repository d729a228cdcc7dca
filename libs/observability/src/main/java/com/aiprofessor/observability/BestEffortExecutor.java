package com.aiprofessor.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs side work (audit writes, activity trackers) detached from the caller.
 * <p>
 * A submitted task never fails the caller: a failure inside the task, or a rejection by the
 * underlying executor, is logged at WARN and counted on {@code best_effort.failures} with a
 * {@code task} tag. The caller's {@link CorrelationContext} is installed on the worker thread
 * while the task runs, so its log lines keep the request identifiers.
 */
public final class BestEffortExecutor {

    private static final Logger log = LoggerFactory.getLogger(BestEffortExecutor.class);

    static final String FAILURE_METRIC = "best_effort.failures";

    private final Executor executor;
    private final MetricFactory metrics;

    public BestEffortExecutor(Executor executor, MetricFactory metrics) {
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.executor = executor;
        this.metrics = metrics;
    }

    /**
     * Schedules {@code task} and returns immediately.
     *
     * @param taskName short name used in logs and as the metric tag, e.g. {@code audit.simulation-started}
     * @param task     the work to run
     */
    public void submit(String taskName, Runnable task) {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("taskName must not be null or blank");
        }
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        CorrelationContext context = CorrelationContextHolder.get().orElse(null);
        Runnable guarded = () -> {
            try {
                if (context != null) {
                    CorrelationContextHolder.runWithContext(context, task);
                } else {
                    task.run();
                }
            } catch (RuntimeException e) {
                log.warn("Best-effort task '{}' failed: {}", taskName, e.getMessage(), e);
                recordFailure(taskName);
            }
        };
        try {
            executor.execute(guarded);
        } catch (RejectedExecutionException e) {
            log.warn("Best-effort task '{}' rejected: {}", taskName, e.getMessage());
            recordFailure(taskName);
        }
    }

    private void recordFailure(String taskName) {
        metrics.counter(FAILURE_METRIC, "Side tasks that failed or were rejected", "task", taskName)
                .increment();
    }
}
