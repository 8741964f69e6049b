package com.taskfleet.orchestrator.store;

import com.taskfleet.orchestrator.model.WorkerResult;

import java.util.Map;

/**
 * Durable sink for worker output.
 *
 * Persistence is best-effort: workers call {@link #store} after every
 * execution (and the debug monitor after every capture), log any exception it
 * throws, and carry on. A store failure never changes a task's outcome.
 */
public interface ResultStore {

    void store(String workerId, WorkerResult result, Map<String, Object> metadata);
}
