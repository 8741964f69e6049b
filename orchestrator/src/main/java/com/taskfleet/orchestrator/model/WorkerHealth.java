package com.taskfleet.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Snapshot of the worker subsystem returned by GET /workers/health.
 *
 * @param maxConcurrent   capacity of the concurrency gate (fixed at construction)
 * @param availableSlots  gate slots free at the moment of the snapshot
 */
public record WorkerHealth(
        @JsonProperty("status")               String           status,
        @JsonProperty("workers_active")       int              workersActive,
        @JsonProperty("max_concurrent")       int              maxConcurrent,
        @JsonProperty("available_slots")      int              availableSlots,
        @JsonProperty("debug_mode")           boolean          debugMode,
        @JsonProperty("debug_monitor_active") boolean          debugMonitorActive,
        @JsonProperty("workers")              List<WorkerInfo> workers
) {}
