package com.taskfleet.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one execution attempt on one worker.
 *
 * Every worker flavor reports through this record, so callers never need to
 * know whether a task ran in a CLI subprocess or inside a container.
 * A failing or timed-out task is a result, not an exception: partial output is
 * kept in {@code content} and the reason in {@code error}.
 *
 * Wire form (JSON and {@link #toMap()}):
 * <pre>
 *   {worker_id, status, content, error, started_at, completed_at, duration_seconds, metadata}
 * </pre>
 */
public record WorkerResult(
        @JsonProperty("worker_id")        String              workerId,
        @JsonProperty("status")           WorkerStatus        status,
        @JsonProperty("content")          String              content,
        @JsonProperty("error")            String              error,
        @JsonProperty("started_at")       Instant             startedAt,
        @JsonProperty("completed_at")     Instant             completedAt,
        @JsonProperty("duration_seconds") double              durationSeconds,
        @JsonProperty("metadata")         Map<String, Object> metadata
) {

    private static final int SUMMARY_PREVIEW = 50;

    public WorkerResult {
        Objects.requireNonNull(workerId, "workerId");
        Objects.requireNonNull(status, "status");
        if (content == null) content = "";
        if (startedAt == null) startedAt = Instant.now();
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    // ------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------

    /** Build a finished result; duration is derived from the two timestamps. */
    public static WorkerResult of(String workerId, WorkerStatus status, String content, String error,
                                  Instant startedAt, Instant completedAt, Map<String, Object> metadata) {
        double duration = completedAt == null
                ? 0.0
                : Duration.between(startedAt, completedAt).toNanos() / 1_000_000_000.0;
        return new WorkerResult(workerId, status, content, error, startedAt, completedAt,
                Math.max(0.0, duration), metadata);
    }

    /** A FAILED result for an attempt that never produced output. */
    public static WorkerResult failure(String workerId, String error, Instant startedAt,
                                       Map<String, Object> metadata) {
        return of(workerId, WorkerStatus.FAILED, "", error, startedAt, Instant.now(), metadata);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @JsonIgnore
    public boolean isSuccess() {
        return status == WorkerStatus.COMPLETED;
    }

    @JsonIgnore
    public boolean hasContent() {
        return !content.isEmpty();
    }

    /** One-line summary for logs: the content preview on success, the error otherwise. */
    @JsonIgnore
    public String summary() {
        if (isSuccess()) {
            String preview = content.length() > SUMMARY_PREVIEW
                    ? content.substring(0, SUMMARY_PREVIEW) + "..."
                    : content;
            return "[" + status.wireValue() + "] " + workerId + ": " + preview;
        }
        return "[" + status.wireValue() + "] " + workerId + ": "
                + (error != null ? error : "Unknown error");
    }

    /** Copy with extra metadata entries merged over the existing ones. */
    public WorkerResult withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new WorkerResult(workerId, status, content, error, startedAt, completedAt,
                durationSeconds, merged);
    }

    // ------------------------------------------------------------------
    // Generic key-value form
    // ------------------------------------------------------------------

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("worker_id",        workerId);
        map.put("status",           status.wireValue());
        map.put("content",          content);
        map.put("error",            error);
        map.put("started_at",       startedAt.toString());
        map.put("completed_at",     completedAt != null ? completedAt.toString() : null);
        map.put("duration_seconds", durationSeconds);
        map.put("metadata",         new LinkedHashMap<>(metadata));
        return map;
    }

    @SuppressWarnings("unchecked")
    public static WorkerResult fromMap(Map<String, ?> map) {
        Object status    = map.get("status");
        Object started   = map.get("started_at");
        Object completed = map.get("completed_at");
        Object duration  = map.get("duration_seconds");
        Object metadata  = map.get("metadata");
        return new WorkerResult(
                (String) map.get("worker_id"),
                status instanceof WorkerStatus s ? s : WorkerStatus.fromWire(String.valueOf(status)),
                (String) map.get("content"),
                (String) map.get("error"),
                toInstant(started),
                toInstant(completed),
                duration instanceof Number n ? n.doubleValue() : 0.0,
                metadata instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of());
    }

    private static Instant toInstant(Object value) {
        if (value == null) return null;
        if (value instanceof Instant i) return i;
        return Instant.parse(value.toString());
    }
}
