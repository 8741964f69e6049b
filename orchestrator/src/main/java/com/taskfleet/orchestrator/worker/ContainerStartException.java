package com.taskfleet.orchestrator.worker;

/**
 * Thrown when the container runtime fails to start (or attach to) a container.
 */
public class ContainerStartException extends WorkerException {

    public ContainerStartException(String message) {
        super(message);
    }

    public ContainerStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
