package com.taskfleet.orchestrator.worker;

import java.util.List;
import java.util.function.Function;

/**
 * {@link WorkerProvider} backed by a factory function.
 */
public record DefaultWorkerProvider(String type, List<String> aliases, Function<String, Worker> factory)
        implements WorkerProvider {

    public DefaultWorkerProvider {
        aliases = List.copyOf(aliases);
    }

    public DefaultWorkerProvider(String type, Function<String, Worker> factory) {
        this(type, List.of(), factory);
    }

    @Override
    public Worker create(String workerId) {
        return factory.apply(workerId);
    }
}
