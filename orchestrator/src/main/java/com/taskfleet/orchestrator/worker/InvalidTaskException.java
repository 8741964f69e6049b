package com.taskfleet.orchestrator.worker;

/**
 * Thrown before dispatch when a request argument is missing or malformed
 * (empty container command, command rejected by {@link CommandPolicy}, count &lt; 1).
 */
public class InvalidTaskException extends WorkerException {

    public InvalidTaskException(String message) {
        super(message);
    }
}
