package com.taskfleet.orchestrator.worker;

import com.taskfleet.orchestrator.model.WorkerResult;
import com.taskfleet.orchestrator.model.WorkerStatus;
import com.taskfleet.orchestrator.store.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lifecycle plumbing shared by all worker flavors.
 *
 * Owns the status machine, the single-flight guard, lazy start, MDC context
 * and best-effort persistence. Subclasses only supply {@link #doStart},
 * {@link #doExecute} and {@link #doStop}.
 */
public abstract class AbstractWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(AbstractWorker.class);

    private static final int TASK_PREVIEW = 200;

    private final String      id;
    private final String      type;
    private final ResultStore resultStore;   // may be null: persistence is optional

    private final AtomicReference<WorkerStatus> status = new AtomicReference<>(WorkerStatus.PENDING);
    private final AtomicBoolean inFlight      = new AtomicBoolean();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final Object        lifecycleLock = new Object();

    private volatile WorkerResult lastResult;

    protected AbstractWorker(String id, String type, ResultStore resultStore) {
        this.id          = id;
        this.type        = type;
        this.resultStore = resultStore;
    }

    // ------------------------------------------------------------------
    // Flavor-specific hooks
    // ------------------------------------------------------------------

    /** Launch the process / container. Called at most once, in STARTING. */
    protected abstract void doStart();

    /** Run one task on a RUNNING worker. Must not throw for task-level failures. */
    protected abstract WorkerResult doExecute(String task, Duration timeout, Instant startedAt);

    /** Release the process / container. Called at most once. */
    protected abstract void doStop();

    /** Reject a task before any resource is touched. */
    protected void validateTask(String task) {
    }

    /** Re-read liveness of the underlying resource; called by getStatus(). */
    protected void refreshStatus() {
    }

    // ------------------------------------------------------------------
    // Worker
    // ------------------------------------------------------------------

    @Override public String id()   { return id; }
    @Override public String type() { return type; }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (status.get() != WorkerStatus.PENDING) {
                return;
            }
            transitionTo(WorkerStatus.STARTING);
            try {
                doStart();
            } catch (RuntimeException e) {
                transitionTo(WorkerStatus.FAILED);
                log.error("Worker {} ({}) failed to start: {}", id, type, e.getMessage());
                throw e;
            }
            transitionTo(WorkerStatus.RUNNING);
            log.info("Started worker {} ({})", id, type);
        }
    }

    @Override
    public WorkerResult execute(String task, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new InvalidTaskException("timeout must be positive, got " + timeout);
        }
        validateTask(task);
        if (!inFlight.compareAndSet(false, true)) {
            throw new WorkerBusyException(id);
        }

        MDC.put("workerId",   id);
        MDC.put("workerType", type);
        Instant startedAt = Instant.now();
        try {
            WorkerResult result;
            if (status.get() == WorkerStatus.PENDING) {
                try {
                    start();
                } catch (WorkerException e) {
                    result = WorkerResult.failure(id, e.getMessage(), startedAt,
                            Map.of("exception", e.getClass().getSimpleName()));
                    return record(result, task);
                }
            }

            WorkerStatus current = status.get();
            if (current != WorkerStatus.RUNNING) {
                result = WorkerResult.failure(id,
                        "Worker is not running (status=" + current.wireValue() + ")", startedAt, Map.of());
            } else {
                result = doExecute(task, timeout, startedAt);
            }
            return record(result, task);
        } finally {
            inFlight.set(false);
            MDC.remove("workerId");
            MDC.remove("workerType");
        }
    }

    @Override
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        synchronized (lifecycleLock) {
            try {
                doStop();
                log.info("Stopped worker {} ({})", id, type);
            } catch (RuntimeException e) {
                log.warn("Error while stopping worker {} ({}): {}", id, type, e.getMessage());
            } finally {
                transitionTo(WorkerStatus.STOPPED);
            }
        }
    }

    @Override
    public WorkerStatus getStatus() {
        if (status.get() == WorkerStatus.RUNNING && !inFlight.get()) {
            refreshStatus();
        }
        return status.get();
    }

    @Override
    public Optional<WorkerResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    // ------------------------------------------------------------------
    // Helpers for subclasses
    // ------------------------------------------------------------------

    /**
     * Move to {@code next} if the transition is legal. Terminal states never
     * change, so a late FAILED after STOPPED is silently ignored.
     *
     * @return true if the status changed
     */
    protected final boolean transitionTo(WorkerStatus next) {
        WorkerStatus previous = status.getAndUpdate(cur -> cur.canTransitionTo(next) ? next : cur);
        return previous.canTransitionTo(next);
    }

    protected final WorkerStatus currentStatus() {
        return status.get();
    }

    protected final boolean isStopRequested() {
        return stopRequested.get();
    }

    protected final ResultStore resultStore() {
        return resultStore;
    }

    /** Persist without letting a store failure reach the caller. */
    protected final void persist(WorkerResult result, Map<String, Object> metadata) {
        if (resultStore == null) {
            log.debug("No result store configured; {} result for {} kept in memory only",
                    result.status().wireValue(), id);
            return;
        }
        try {
            resultStore.store(id, result, metadata);
        } catch (Exception e) {
            log.warn("Failed to store result for worker {}: {}", id, e.getMessage());
        }
    }

    private WorkerResult record(WorkerResult result, String task) {
        lastResult = result;
        log.info("Worker {} finished task: {} ({}s)", id, result.status().wireValue(),
                String.format("%.2f", result.durationSeconds()));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("type",         "worker_execution");
        metadata.put("worker_type",  type);
        metadata.put("task_preview", preview(task));
        persist(result, metadata);
        return result;
    }

    private static String preview(String task) {
        if (task == null) return "";
        return task.length() > TASK_PREVIEW ? task.substring(0, TASK_PREVIEW) + "..." : task;
    }
}
