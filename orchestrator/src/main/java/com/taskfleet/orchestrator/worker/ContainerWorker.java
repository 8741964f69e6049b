package com.taskfleet.orchestrator.worker;

import com.taskfleet.orchestrator.model.WorkerResult;
import com.taskfleet.orchestrator.model.WorkerStatus;
import com.taskfleet.orchestrator.runtime.ProcessRuntime;
import com.taskfleet.orchestrator.runtime.RuntimeHandle;
import com.taskfleet.orchestrator.runtime.StreamCollector;
import com.taskfleet.orchestrator.store.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Worker that owns one long-lived container and runs each task as a shell
 * command inside it.
 *
 * The container is started detached ({@code run -d --rm <image> sleep infinity})
 * on first use and removed on stop. Commands go through {@code sh -c}, so pipes
 * and redirects work; every command is screened by {@link CommandPolicy} first.
 *
 * A command's exit code decides its result: 0 is COMPLETED, anything else is
 * FAILED. The worker itself stays RUNNING either way. Only a timeout takes the
 * worker down, because the container may be left in an unknown state.
 */
public class ContainerWorker extends AbstractWorker {

    private static final Logger log = LoggerFactory.getLogger(ContainerWorker.class);

    private static final Duration OUTPUT_SETTLE        = Duration.ofSeconds(2);
    private static final Duration HOUSEKEEPING_TIMEOUT = Duration.ofSeconds(30);

    /** Container runtime binary, image, and how long {@code run -d} may take. */
    public record Settings(String runtime, String image, Duration startTimeout) {}

    private final Settings       settings;
    private final ProcessRuntime runtime;
    private final CommandPolicy  policy;

    private final AtomicReference<String> containerId = new AtomicReference<>();

    public ContainerWorker(String id, String type, Settings settings, ProcessRuntime runtime,
                           CommandPolicy policy, ResultStore resultStore) {
        super(id, type, resultStore);
        this.settings = settings;
        this.runtime  = runtime;
        this.policy   = policy;
    }

    /** Id of the backing container, or null before start / after stop. */
    public String containerId() {
        return containerId.get();
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Override
    protected void validateTask(String task) {
        policy.validate(task);
    }

    @Override
    protected void doStart() {
        List<String> command = List.of(settings.runtime(), "run", "-d", "--rm",
                settings.image(), "sleep", "infinity");

        RuntimeHandle handle;
        try {
            handle = runtime.spawnProcess(command);
        } catch (SpawnException e) {
            throw new ContainerStartException("Cannot launch container runtime '"
                    + settings.runtime() + "': " + e.getMessage(), e);
        }

        StreamCollector stdout = StreamCollector.start(handle.stdout(), "container-start-" + id());
        int exit;
        try {
            exit = handle.onExit().get(settings.startTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            handle.destroyForcibly();
            throw new ContainerStartException("Container did not start within "
                    + settings.startTimeout().toSeconds() + "s (image " + settings.image() + ")");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.destroyForcibly();
            throw new ContainerStartException("Interrupted while starting container", e);
        } catch (ExecutionException e) {
            throw new ContainerStartException("Container start failed: " + e.getCause(), e);
        }

        if (exit != 0) {
            String stderr = handle.stderr().strip();
            throw new ContainerStartException("Container start exited with code " + exit
                    + (stderr.isEmpty() ? "" : ": " + stderr));
        }

        String started = stdout.await(OUTPUT_SETTLE).strip();
        if (started.isEmpty()) {
            throw new ContainerStartException("Container runtime returned no container id");
        }
        containerId.set(started);
        log.info("Worker {} started container {} from {}", id(), shortId(started), settings.image());
    }

    @Override
    protected void doStop() {
        String current = containerId.getAndSet(null);
        if (current == null) {
            return;
        }
        runAndWait(List.of(settings.runtime(), "stop", current));
        log.info("Worker {} stopped container {}", id(), shortId(current));
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    @Override
    protected WorkerResult doExecute(String task, Duration timeout, Instant startedAt) {
        String current = containerId.get();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("runtime",      settings.runtime());
        metadata.put("image",        settings.image());
        metadata.put("command",      task);
        metadata.put("container_id", current);

        RuntimeHandle handle;
        try {
            handle = runtime.execInContainer(current, List.of("sh", "-c", task));
        } catch (SpawnException e) {
            return WorkerResult.failure(id(), e.getMessage(), startedAt, metadata);
        }
        StreamCollector stdout = StreamCollector.start(handle.stdout(), "container-exec-" + id());

        int exit;
        try {
            exit = handle.onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Command on worker {} timed out after {}s; discarding container", id(), timeout.toSeconds());
            handle.destroyForcibly();
            transitionTo(WorkerStatus.TIMEOUT);
            removeAsync(containerId.getAndSet(null));
            return WorkerResult.of(id(), WorkerStatus.TIMEOUT, stdout.text(),
                    "Command timed out after " + timeout.toSeconds() + "s",
                    startedAt, Instant.now(), metadata);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.destroyForcibly();
            return WorkerResult.failure(id(), "Interrupted while waiting for command", startedAt, metadata);
        } catch (ExecutionException e) {
            return WorkerResult.failure(id(), "Command failed: " + e.getCause(), startedAt, metadata);
        }

        String output = stdout.await(OUTPUT_SETTLE);
        String stderr = handle.stderr().strip();
        metadata.put("exit_code", exit);

        if (exit == 0) {
            return WorkerResult.of(id(), WorkerStatus.COMPLETED, output,
                    stderr.isEmpty() ? null : stderr, startedAt, Instant.now(), metadata);
        }
        String error = stderr.isEmpty() ? "Command failed with exit code " + exit : stderr;
        return WorkerResult.of(id(), WorkerStatus.FAILED, output, error, startedAt, Instant.now(), metadata);
    }

    /** Remove the container in the background; a timed-out worker is not reused. */
    private void removeAsync(String id) {
        if (id == null) return;
        CompletableFuture.runAsync(() -> {
            try {
                runAndWait(List.of(settings.runtime(), "rm", "-f", id));
            } catch (RuntimeException e) {
                log.warn("Could not remove container {}: {}", shortId(id), e.getMessage());
            }
        });
    }

    /** Run a runtime housekeeping command, killing it if it outlasts {@link #HOUSEKEEPING_TIMEOUT}. */
    private void runAndWait(List<String> command) {
        RuntimeHandle handle = runtime.spawnProcess(command);
        try {
            int exit = handle.onExit().get(HOUSEKEEPING_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            if (exit != 0) {
                log.warn("'{}' exited with code {}: {}", String.join(" ", command), exit, handle.stderr().strip());
            }
        } catch (TimeoutException e) {
            log.warn("'{}' did not finish within {}s; killing it", String.join(" ", command),
                    HOUSEKEEPING_TIMEOUT.toSeconds());
            runtime.terminate(handle);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runtime.terminate(handle);
        } catch (ExecutionException e) {
            log.warn("'{}' failed: {}", String.join(" ", command), e.getCause().getMessage());
        }
    }

    private static String shortId(String id) {
        return id.length() > 12 ? id.substring(0, 12) : id;
    }
}
