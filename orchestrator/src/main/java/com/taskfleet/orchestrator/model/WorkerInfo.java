package com.taskfleet.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Registry view of one worker, returned by GET /workers.
 */
public record WorkerInfo(
        @JsonProperty("worker_id")   String       workerId,
        @JsonProperty("worker_type") String       workerType,
        @JsonProperty("status")      WorkerStatus status
) {}
