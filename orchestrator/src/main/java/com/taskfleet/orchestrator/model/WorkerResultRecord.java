package com.taskfleet.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One persisted worker execution (or debug-monitor capture).
 *
 * DB table: worker_results  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "worker_results")
public class WorkerResultRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "worker_id", nullable = false)
    private String workerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkerStatus status;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_seconds", nullable = false)
    private double durationSeconds;

    // Result metadata merged with the caller's metadata, serialized as JSON.
    @Column(name = "metadata_json", columnDefinition = "TEXT")
    private String metadataJson;

    @Column(name = "stored_at", nullable = false, updatable = false)
    private Instant storedAt = Instant.now();

    protected WorkerResultRecord() {}   // required by JPA

    public WorkerResultRecord(WorkerResult result, String metadataJson) {
        this.workerId        = result.workerId();
        this.status          = result.status();
        this.content         = result.content();
        this.error           = result.error();
        this.startedAt       = result.startedAt();
        this.completedAt     = result.completedAt();
        this.durationSeconds = result.durationSeconds();
        this.metadataJson    = metadataJson;
    }

    public UUID         getId()              { return id; }
    public String       getWorkerId()        { return workerId; }
    public WorkerStatus getStatus()          { return status; }
    public String       getContent()         { return content; }
    public String       getError()           { return error; }
    public Instant      getStartedAt()       { return startedAt; }
    public Instant      getCompletedAt()     { return completedAt; }
    public double       getDurationSeconds() { return durationSeconds; }
    public String       getMetadataJson()    { return metadataJson; }
    public Instant      getStoredAt()        { return storedAt; }
}
