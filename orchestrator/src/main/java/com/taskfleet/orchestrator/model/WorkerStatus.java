package com.taskfleet.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of a worker, and the outcome recorded on a {@link WorkerResult}.
 *
 * Transitions:
 *   PENDING  → STARTING (start() called)
 *   STARTING → RUNNING  (process / container is up)
 *   RUNNING  → COMPLETED | FAILED | TIMEOUT | STOPPED
 *
 * The four end states are terminal: once reached, a worker never leaves them.
 * On the wire the values are written in lower case ("completed", "timeout", ...).
 */
public enum WorkerStatus {
    PENDING,
    STARTING,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMEOUT,
    STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT || this == STOPPED;
    }

    /** True if a worker currently in this state may move to {@code next}. */
    public boolean canTransitionTo(WorkerStatus next) {
        if (isTerminal() || next == this) return false;
        return next.ordinal() > ordinal();
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkerStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Worker status must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
