package com.taskfleet.orchestrator.runtime;

import com.taskfleet.orchestrator.worker.SpawnException;

import java.util.List;

/**
 * Everything the workers need from the host: launching processes, running
 * commands inside containers, and tearing either of them down.
 *
 * Workers depend only on this interface so tests can substitute scripted handles.
 */
public interface ProcessRuntime {

    /**
     * Launch a local process.
     *
     * @throws SpawnException if the executable cannot be started
     */
    RuntimeHandle spawnProcess(List<String> command);

    /**
     * Run a command inside an already running container.
     *
     * @throws SpawnException if the container runtime binary cannot be started
     */
    RuntimeHandle execInContainer(String containerId, List<String> command);

    /**
     * Terminate gracefully, then force-kill once the grace period has elapsed.
     * Never throws; safe to call on a handle that has already exited.
     */
    void terminate(RuntimeHandle handle);
}
