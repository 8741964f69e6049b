package com.taskfleet.orchestrator.service;

import com.taskfleet.orchestrator.model.WorkerHealth;
import com.taskfleet.orchestrator.model.WorkerInfo;
import com.taskfleet.orchestrator.model.WorkerResult;
import com.taskfleet.orchestrator.model.WorkerStatus;
import com.taskfleet.orchestrator.worker.InvalidTaskException;
import com.taskfleet.orchestrator.worker.LengthMismatchException;
import com.taskfleet.orchestrator.worker.Worker;
import com.taskfleet.orchestrator.worker.WorkerException;
import com.taskfleet.orchestrator.worker.WorkerNotFoundException;
import com.taskfleet.orchestrator.worker.WorkerProvider;
import com.taskfleet.orchestrator.worker.WorkerTypeRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Owns the worker registry and the shared concurrency gate.
 *
 * <p>Dispatch rules:
 * <ul>
 *   <li>Every {@link #execute} holds one gate slot for its whole duration and
 *       releases it on every exit path. Callers block while the gate is full.</li>
 *   <li>Structural errors (unknown id, bad arguments, busy worker) are thrown
 *       before any process or container is touched.</li>
 *   <li>Task outcomes always come back as a {@link WorkerResult}.</li>
 * </ul>
 *
 * The gate is global rather than per type: processes and containers draw on
 * the same host budget.
 */
@Service
public class WorkerManager {

    private static final Logger log = LoggerFactory.getLogger(WorkerManager.class);

    public static final int MIN_CONCURRENT = 1;
    public static final int MAX_CONCURRENT = 100;

    static final String DEBUG_MONITOR_TYPE = "debug-monitor";

    private final WorkerTypeRegistry  types;
    private final MeterRegistry       meterRegistry;
    private final int                 maxConcurrent;
    private final boolean             debugMode;
    private final Semaphore           gate;

    // LinkedHashMap keeps spawn order for list/snapshot output.
    private final Map<String, Worker> workers = Collections.synchronizedMap(new LinkedHashMap<>());
    private final ExecutorService     dispatch;
    private final AtomicInteger       dispatchThreads = new AtomicInteger();
    // Never reset, so an id is not reissued after its worker is closed.
    private final AtomicLong          idSequence      = new AtomicLong();

    private volatile Worker debugMonitor;

    public WorkerManager(WorkerTypeRegistry types,
                         @Value("${taskfleet.workers.max-concurrent:10}") int maxConcurrent,
                         @Value("${taskfleet.workers.debug-mode:false}") boolean debugMode,
                         MeterRegistry meterRegistry) {
        this.types         = types;
        this.meterRegistry = meterRegistry;
        this.maxConcurrent = Math.max(MIN_CONCURRENT, Math.min(maxConcurrent, MAX_CONCURRENT));
        this.debugMode     = debugMode;
        this.gate          = new Semaphore(this.maxConcurrent, true);
        this.dispatch      = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "worker-dispatch-" + dispatchThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        meterRegistry.gauge("taskfleet.gate.available", gate, Semaphore::availablePermits);
        if (this.maxConcurrent != maxConcurrent) {
            log.warn("taskfleet.workers.max-concurrent={} out of range; clamped to {}",
                    maxConcurrent, this.maxConcurrent);
        }
        log.info("WorkerManager ready (max_concurrent={}, debug={}, types={})",
                this.maxConcurrent, debugMode, types.types());
    }

    // ------------------------------------------------------------------
    // Spawn
    // ------------------------------------------------------------------

    /**
     * Create {@code count} PENDING workers of {@code workerType} and register them.
     * Nothing is launched until a worker's first execute.
     *
     * All-or-nothing: if the type is unknown or any worker cannot be created,
     * nothing is registered.
     *
     * @return the new worker ids, in creation order
     * @throws com.taskfleet.orchestrator.worker.UnknownWorkerTypeException if the type is not registered
     * @throws InvalidTaskException if {@code count < 1}
     */
    public List<String> spawn(String workerType, int count) {
        if (count < 1) {
            throw new InvalidTaskException("count must be at least 1, got " + count);
        }
        WorkerProvider provider = types.provider(workerType);

        List<Worker> created = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            created.add(provider.create(newWorkerId(provider.type())));
        }

        List<String> ids = new ArrayList<>(count);
        synchronized (workers) {
            for (Worker worker : created) {
                workers.put(worker.id(), worker);
                ids.add(worker.id());
            }
        }
        meterRegistry.counter("taskfleet.worker.spawned", "type", provider.type()).increment(count);
        log.info("Spawned {} {} worker(s): {}", count, provider.type(), ids);

        if (debugMode) {
            launchDebugMonitor();
        }
        return ids;
    }

    private String newWorkerId(String type) {
        return String.format("%s-%04d", type, idSequence.incrementAndGet());
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    /**
     * Run one task on one worker, waiting for a gate slot first.
     *
     * @throws WorkerNotFoundException if no worker has this id
     * @throws InvalidTaskException    if the worker rejects the task before dispatch
     * @throws com.taskfleet.orchestrator.worker.WorkerBusyException if the worker is already executing
     * @throws UnsupportedOperationException if the worker type cannot execute tasks
     */
    public WorkerResult execute(String workerId, String task, Duration timeout) {
        Worker worker = find(workerId);
        Instant startedAt = Instant.now();

        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WorkerResult.failure(workerId, "Interrupted while waiting for a free worker slot",
                    startedAt, Map.of("exception", e.getClass().getSimpleName()));
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            log.info("Executing task on worker {}", workerId);
            WorkerResult result = worker.execute(task, timeout);
            status = result.status().wireValue();
            return result;
        } catch (WorkerException | UnsupportedOperationException e) {
            status = "rejected";
            throw e;
        } catch (RuntimeException e) {
            log.error("Worker {} failed: {}", workerId, e.getMessage(), e);
            status = WorkerStatus.FAILED.wireValue();
            return WorkerResult.failure(workerId, e.getMessage(), startedAt,
                    Map.of("exception", e.getClass().getSimpleName()));
        } finally {
            gate.release();
            sample.stop(meterRegistry.timer("taskfleet.worker.execution",
                    "type", worker.type(), "status", status));
        }
    }

    /**
     * Run {@code tasks.get(i)} on {@code workerIds.get(i)} for every i, all
     * concurrently, each bounded by the shared gate.
     *
     * @return one result per input pair, in input order
     * @throws LengthMismatchException if the lists differ in length; nothing is dispatched
     * @throws WorkerNotFoundException if any id is not registered; nothing is dispatched
     */
    public List<WorkerResult> executeBatch(List<String> workerIds, List<String> tasks, Duration timeout) {
        if (workerIds.size() != tasks.size()) {
            throw new LengthMismatchException(workerIds.size(), tasks.size());
        }
        workerIds.forEach(this::find);

        List<CompletableFuture<WorkerResult>> futures = new ArrayList<>(workerIds.size());
        for (int i = 0; i < workerIds.size(); i++) {
            String workerId = workerIds.get(i);
            String task     = tasks.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> executeQuietly(workerId, task, timeout), dispatch));
        }

        List<WorkerResult> results = futures.stream().map(CompletableFuture::join).toList();
        log.info("Completed {} worker task(s)", results.size());
        return results;
    }

    /**
     * Batch element: anything thrown once dispatch has begun (a worker closed
     * mid-batch, a busy worker, a rejected task) becomes a FAILED entry at its position.
     */
    private WorkerResult executeQuietly(String workerId, String task, Duration timeout) {
        Instant startedAt = Instant.now();
        try {
            return execute(workerId, task, timeout);
        } catch (RuntimeException e) {
            log.warn("Batch element on worker {} rejected: {}", workerId, e.getMessage());
            return WorkerResult.failure(workerId, e.getMessage(), startedAt,
                    Map.of("exception", e.getClass().getSimpleName()));
        }
    }

    // ------------------------------------------------------------------
    // Observation
    // ------------------------------------------------------------------

    /**
     * Current status of each requested worker ({@code null} or empty means all).
     * Ids not in the registry are left out.
     */
    public Map<String, WorkerStatus> snapshot(Collection<String> workerIds) {
        Map<String, WorkerStatus> statuses = new LinkedHashMap<>();
        for (Worker worker : select(workerIds)) {
            try {
                statuses.put(worker.id(), worker.getStatus());
            } catch (RuntimeException e) {
                log.warn("Failed to get status for {}: {}", worker.id(), e.getMessage());
                statuses.put(worker.id(), WorkerStatus.FAILED);
            }
        }
        return statuses;
    }

    /**
     * Endless stream of snapshots, one per {@code interval}. The first is taken
     * immediately. The caller ends it (limit, takeWhile, short-circuiting
     * terminal operation) or interrupts the consuming thread.
     */
    public Stream<Map<String, WorkerStatus>> monitor(Collection<String> workerIds, Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new InvalidTaskException("interval must be positive, got " + interval);
        }
        List<String> ids = workerIds == null ? null : List.copyOf(workerIds);
        return Stream.iterate(
                snapshot(ids),
                s -> !Thread.currentThread().isInterrupted(),
                s -> {
                    pause(interval);
                    return snapshot(ids);
                });
    }

    /** Most recent result of each requested worker; workers that never ran are left out. */
    public Map<String, WorkerResult> collectResults(Collection<String> workerIds) {
        Map<String, WorkerResult> results = new LinkedHashMap<>();
        for (Worker worker : select(workerIds)) {
            worker.lastResult().ifPresent(r -> results.put(worker.id(), r));
        }
        return results;
    }

    public List<WorkerInfo> listWorkers() {
        return select(null).stream()
                .map(w -> new WorkerInfo(w.id(), w.type(), w.getStatus()))
                .toList();
    }

    public WorkerHealth health() {
        List<WorkerInfo> infos = listWorkers();
        return new WorkerHealth("healthy", infos.size(), maxConcurrent, gate.availablePermits(),
                debugMode, debugMonitor != null, infos);
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    public int availableSlots() {
        return gate.availablePermits();
    }

    // ------------------------------------------------------------------
    // Teardown
    // ------------------------------------------------------------------

    /**
     * Stop and deregister one worker. The worker is removed even if stopping it fails.
     *
     * @throws WorkerNotFoundException if no worker has this id
     */
    public void close(String workerId) {
        Worker worker = workers.remove(workerId);
        if (worker == null) {
            throw new WorkerNotFoundException(workerId);
        }
        stopQuietly(worker);
    }

    /**
     * Stop and deregister every worker, plus the debug monitor. Never throws;
     * the registry is empty on return.
     *
     * @return number of workers deregistered
     */
    public int closeAll() {
        List<Worker> all;
        synchronized (workers) {
            all = new ArrayList<>(workers.values());
            workers.clear();
        }
        if (!all.isEmpty()) {
            log.info("Closing {} worker(s)...", all.size());
        }
        all.forEach(this::stopQuietly);

        Worker monitor = debugMonitor;
        debugMonitor = null;
        if (monitor != null) {
            stopQuietly(monitor);
        }
        return all.size();
    }

    @PreDestroy
    void shutdown() {
        closeAll();
        dispatch.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private Worker find(String workerId) {
        Worker worker = workerId == null ? null : workers.get(workerId);
        if (worker == null) {
            throw new WorkerNotFoundException(workerId);
        }
        return worker;
    }

    private List<Worker> select(Collection<String> workerIds) {
        synchronized (workers) {
            if (workerIds == null || workerIds.isEmpty()) {
                return new ArrayList<>(workers.values());
            }
            return workerIds.stream()
                    .map(workers::get)
                    .filter(Objects::nonNull)
                    .toList();
        }
    }

    private void stopQuietly(Worker worker) {
        try {
            worker.stop();
            log.info("Closed worker {}", worker.id());
        } catch (RuntimeException e) {
            log.error("Failed to close worker {}: {}", worker.id(), e.getMessage());
        }
    }

    /** Start the debug monitor once; a failure is logged and the spawn still succeeds. */
    private synchronized void launchDebugMonitor() {
        if (debugMonitor != null) {
            return;
        }
        if (!types.supports(DEBUG_MONITOR_TYPE)) {
            log.warn("Debug mode is on but no '{}' worker type is registered", DEBUG_MONITOR_TYPE);
            return;
        }
        Worker monitor = types.provider(DEBUG_MONITOR_TYPE).create(newWorkerId(DEBUG_MONITOR_TYPE));
        try {
            monitor.start();
            debugMonitor = monitor;
            log.info("Launched debug monitor {}", monitor.id());
        } catch (RuntimeException e) {
            log.warn("Failed to launch debug monitor: {}", e.getMessage());
        }
    }

    private static void pause(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
