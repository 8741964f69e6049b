package com.taskfleet.orchestrator.api.dto;

/**
 * Request body for POST /workers/{id}/execute.
 *
 * For terminal workers {@code task} is the prompt; for container workers it is
 * the shell command. timeoutSeconds defaults to 300.
 */
public record ExecuteRequest(String task, Long timeoutSeconds) {

    public static final long DEFAULT_TIMEOUT_SECONDS = 300;

    public ExecuteRequest {
        if (timeoutSeconds == null) timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
    }
}
