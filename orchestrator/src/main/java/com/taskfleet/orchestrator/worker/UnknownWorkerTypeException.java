package com.taskfleet.orchestrator.worker;

import java.util.Collection;

public class UnknownWorkerTypeException extends WorkerException {

    public UnknownWorkerTypeException(String workerType, Collection<String> knownTypes) {
        super("Unknown worker type: '" + workerType + "' (known types: "
                + String.join(", ", knownTypes) + ")");
    }
}
