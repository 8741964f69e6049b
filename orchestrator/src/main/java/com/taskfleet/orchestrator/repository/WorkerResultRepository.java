package com.taskfleet.orchestrator.repository;

import com.taskfleet.orchestrator.model.WorkerResultRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD operations for the worker_results table.
 */
public interface WorkerResultRepository extends JpaRepository<WorkerResultRecord, UUID> {

    /** Stored results for one worker, newest first. */
    List<WorkerResultRecord> findByWorkerIdOrderByStoredAtDesc(String workerId);
}
