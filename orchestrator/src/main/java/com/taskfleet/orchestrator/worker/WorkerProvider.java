package com.taskfleet.orchestrator.worker;

import java.util.List;

/**
 * Factory for one worker type. Every provider bean in the context is picked up
 * by {@link WorkerTypeRegistry}, so adding a worker flavor only requires
 * declaring a new provider.
 */
public interface WorkerProvider {

    /** Canonical type name, e.g. "terminal-qwen". */
    String type();

    /** Other names that resolve to this provider. */
    default List<String> aliases() {
        return List.of();
    }

    /** Create a new PENDING worker. Must not launch anything. */
    Worker create(String workerId);
}
