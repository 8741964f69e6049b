package com.taskfleet.orchestrator.api.dto;

/**
 * Request body for POST /workers.
 *
 * count defaults to 1 when omitted.
 */
public record SpawnRequest(String workerType, Integer count) {

    public SpawnRequest {
        if (count == null) count = 1;
    }
}
