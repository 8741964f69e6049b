package com.taskfleet.orchestrator.runtime;

import com.taskfleet.orchestrator.worker.SpawnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProcessRuntime} for the local host, built on {@link ProcessBuilder}.
 *
 * Container commands go through the configured runtime CLI
 * ({@code docker exec -i <id> ...} or the podman equivalent), so the same
 * handle type covers both worker flavors.
 */
@Component
public class LocalProcessRuntime implements ProcessRuntime {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessRuntime.class);

    private final String   containerRuntime;
    private final Duration gracePeriod;

    public LocalProcessRuntime(
            @Value("${taskfleet.container.runtime:docker}") String containerRuntime,
            @Value("${taskfleet.workers.stop-grace-period:5s}") Duration gracePeriod) {
        this.containerRuntime = containerRuntime;
        this.gracePeriod      = gracePeriod;
    }

    @Override
    public RuntimeHandle spawnProcess(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new SpawnException("Cannot spawn a process from an empty command");
        }
        try {
            Process process = new ProcessBuilder(command).start();
            log.debug("Spawned '{}' (pid {})", String.join(" ", command), process.pid());
            return new LocalProcessHandle(process, command.get(0));
        } catch (IOException | SecurityException e) {
            throw new SpawnException("Cannot launch '" + command.get(0) + "': " + e.getMessage(), e);
        }
    }

    @Override
    public RuntimeHandle execInContainer(String containerId, List<String> command) {
        List<String> full = new ArrayList<>();
        full.add(containerRuntime);
        full.add("exec");
        full.add("-i");
        full.add(containerId);
        full.addAll(command);
        return spawnProcess(full);
    }

    @Override
    public void terminate(RuntimeHandle handle) {
        if (handle == null || !handle.isAlive()) return;
        try {
            handle.destroy();
            handle.onExit().get(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Terminated {}", handle.description());
        } catch (TimeoutException e) {
            log.warn("{} ignored termination for {}; killing it", handle.description(), gracePeriod);
            handle.destroyForcibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.destroyForcibly();
        } catch (Exception e) {
            log.warn("Error while terminating {}: {}", handle.description(), e.getMessage());
            handle.destroyForcibly();
        }
    }
}
