package com.taskfleet.orchestrator.worker;

/**
 * Base type for structural worker errors: the request could not be dispatched
 * (unknown type, unknown id, bad arguments, busy worker) or a worker could not
 * be brought up.
 *
 * Task outcomes are never thrown: a task that fails or times out is reported
 * as a FAILED / TIMEOUT {@link com.taskfleet.orchestrator.model.WorkerResult}.
 */
public abstract class WorkerException extends RuntimeException {

    protected WorkerException(String message) {
        super(message);
    }

    protected WorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
