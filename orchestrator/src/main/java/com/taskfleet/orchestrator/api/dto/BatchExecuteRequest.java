package com.taskfleet.orchestrator.api.dto;

import java.util.List;

/**
 * Request body for POST /workers/execute-batch. tasks[i] runs on workerIds[i].
 */
public record BatchExecuteRequest(List<String> workerIds, List<String> tasks, Long timeoutSeconds) {

    public BatchExecuteRequest {
        if (workerIds == null)      workerIds = List.of();
        if (tasks == null)          tasks = List.of();
        if (timeoutSeconds == null) timeoutSeconds = ExecuteRequest.DEFAULT_TIMEOUT_SECONDS;
    }
}
