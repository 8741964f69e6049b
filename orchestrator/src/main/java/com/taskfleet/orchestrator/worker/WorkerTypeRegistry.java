package com.taskfleet.orchestrator.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps worker type names (and their aliases) to providers.
 *
 * All {@link WorkerProvider} beans are collected at startup via constructor
 * injection.
 */
@Component
public class WorkerTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerTypeRegistry.class);

    private final Map<String, WorkerProvider> providers = new TreeMap<>();
    private final List<String>                canonical;

    public WorkerTypeRegistry(List<WorkerProvider> allProviders) {
        for (WorkerProvider provider : allProviders) {
            register(provider.type(), provider);
            for (String alias : provider.aliases()) {
                register(alias, provider);
            }
            log.info("Registered worker type '{}'{}", provider.type(),
                    provider.aliases().isEmpty() ? "" : " (aliases " + provider.aliases() + ")");
        }
        this.canonical = allProviders.stream().map(WorkerProvider::type).sorted().toList();
    }

    private void register(String name, WorkerProvider provider) {
        WorkerProvider existing = providers.putIfAbsent(name, provider);
        if (existing != null && existing != provider) {
            throw new IllegalStateException("Worker type '" + name + "' is registered twice");
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * @throws UnknownWorkerTypeException if neither a type nor an alias matches
     */
    public WorkerProvider provider(String type) {
        WorkerProvider provider = type == null ? null : providers.get(type);
        if (provider == null) {
            throw new UnknownWorkerTypeException(type, canonical);
        }
        return provider;
    }

    public boolean supports(String type) {
        return type != null && providers.containsKey(type);
    }

    /** Canonical type names, sorted. Aliases are not listed. */
    public List<String> types() {
        return canonical;
    }
}
