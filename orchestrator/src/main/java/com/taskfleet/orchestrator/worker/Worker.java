package com.taskfleet.orchestrator.worker;

import com.taskfleet.orchestrator.model.WorkerResult;
import com.taskfleet.orchestrator.model.WorkerStatus;

import java.time.Duration;
import java.util.Optional;

/**
 * One external execution unit: a CLI agent subprocess, a container, or a
 * passive monitor.
 *
 * <p>Contract shared by every flavor:
 * <ul>
 *   <li>{@link #execute} runs one task at a time; a concurrent second call
 *       fails fast with {@link WorkerBusyException}.</li>
 *   <li>Task failures and timeouts come back as a {@link WorkerResult}, never
 *       as exceptions.</li>
 *   <li>{@link #stop} is idempotent and safe from any status, including
 *       before {@link #start}.</li>
 * </ul>
 */
public interface Worker {

    /** Unique id assigned at spawn time. */
    String id();

    /** Type tag the worker was spawned with, e.g. "terminal-qwen". */
    String type();

    /**
     * Bring up the underlying process or container.
     *
     * @throws SpawnException          if a subprocess cannot be launched
     * @throws ContainerStartException if a container cannot be started
     */
    void start();

    /**
     * Run one task, bounded by {@code timeout}. Starts the worker first if it
     * is still PENDING.
     *
     * @throws WorkerBusyException           if another task is in flight on this worker
     * @throws InvalidTaskException          if the task is rejected before dispatch
     * @throws UnsupportedOperationException if this flavor cannot execute tasks
     */
    WorkerResult execute(String task, Duration timeout);

    void stop();

    WorkerStatus getStatus();

    /** Result of the most recent execute() call, if any. */
    Optional<WorkerResult> lastResult();
}
