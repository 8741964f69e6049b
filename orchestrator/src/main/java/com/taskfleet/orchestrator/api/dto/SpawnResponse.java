package com.taskfleet.orchestrator.api.dto;

import java.util.List;

/** Response body for POST /workers. */
public record SpawnResponse(String workerType, List<String> workerIds) {}
