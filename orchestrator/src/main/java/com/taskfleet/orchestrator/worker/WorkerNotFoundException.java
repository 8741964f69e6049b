package com.taskfleet.orchestrator.worker;

public class WorkerNotFoundException extends WorkerException {

    public WorkerNotFoundException(String workerId) {
        super("Worker not found: '" + workerId + "'");
    }
}
