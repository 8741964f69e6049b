package com.taskfleet.orchestrator.worker;

/**
 * Thrown when a worker's executable cannot be launched.
 */
public class SpawnException extends WorkerException {

    public SpawnException(String message) {
        super(message);
    }

    public SpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
