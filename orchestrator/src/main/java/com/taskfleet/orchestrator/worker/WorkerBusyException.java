package com.taskfleet.orchestrator.worker;

/**
 * Thrown when execute() is called on a worker that already has a task in flight.
 *
 * Calls are rejected rather than queued: a second reader on the same
 * subprocess stream would interleave chunks from both tasks.
 */
public class WorkerBusyException extends WorkerException {

    public WorkerBusyException(String workerId) {
        super("Worker '" + workerId + "' is already executing a task");
    }
}
