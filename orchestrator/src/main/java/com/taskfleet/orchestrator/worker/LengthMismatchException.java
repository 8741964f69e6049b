package com.taskfleet.orchestrator.worker;

public class LengthMismatchException extends WorkerException {

    public LengthMismatchException(int workerIds, int tasks) {
        super("worker_ids and tasks must have the same length (got " + workerIds
                + " worker ids and " + tasks + " tasks)");
    }
}
