package com.taskfleet.orchestrator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskfleet.orchestrator.model.WorkerResult;
import com.taskfleet.orchestrator.model.WorkerResultRecord;
import com.taskfleet.orchestrator.repository.WorkerResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link ResultStore} that writes one worker_results row per call.
 *
 * Exceptions from the repository propagate; the calling worker decides that
 * they are non-fatal.
 */
@Component
public class JpaResultStore implements ResultStore {

    private static final Logger log = LoggerFactory.getLogger(JpaResultStore.class);

    private final WorkerResultRepository repository;
    private final ObjectMapper           json;

    public JpaResultStore(WorkerResultRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.json       = objectMapper;
    }

    @Override
    public void store(String workerId, WorkerResult result, Map<String, Object> metadata) {
        Map<String, Object> merged = new LinkedHashMap<>(result.metadata());
        if (metadata != null) merged.putAll(metadata);

        WorkerResultRecord saved = repository.save(new WorkerResultRecord(result, toJson(merged)));
        log.debug("Stored {} result for worker {} as {}", result.status().wireValue(), workerId, saved.getId());
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return json.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise result metadata, storing without it: {}", e.getMessage());
            return null;
        }
    }
}
