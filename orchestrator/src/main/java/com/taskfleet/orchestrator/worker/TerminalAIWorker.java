package com.taskfleet.orchestrator.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskfleet.orchestrator.model.WorkerResult;
import com.taskfleet.orchestrator.model.WorkerStatus;
import com.taskfleet.orchestrator.runtime.ProcessRuntime;
import com.taskfleet.orchestrator.runtime.RuntimeHandle;
import com.taskfleet.orchestrator.store.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Worker that drives an interactive CLI agent (Qwen, Claude, ...) running in
 * stream-json output mode.
 *
 * For each task:
 *   1. The task text is written to the process's stdin as one line.
 *   2. stdout lines are consumed one at a time and parsed as JSON objects;
 *      lines that are not JSON objects are counted and skipped.
 *   3. Each chunk's text ({@link StreamProtocol#extractContent}) is appended
 *      to the accumulated content.
 *   4. The task ends at the first chunk carrying a completion marker
 *      ({@link StreamProtocol#completionMarker}), when the process exits,
 *      or when the timeout elapses.
 *
 * A background thread moves stdout lines onto a queue so the execute loop can
 * wait for the next chunk with a deadline.
 */
public class TerminalAIWorker extends AbstractWorker {

    private static final Logger log = LoggerFactory.getLogger(TerminalAIWorker.class);

    /** A stdout line, or the end-of-stream marker. */
    private record Line(String text) {
        static final Line EOF = new Line(null);
    }

    private static final Duration EXIT_CODE_WAIT = Duration.ofSeconds(2);

    private final String         agent;
    private final List<String>   command;
    private final ProcessRuntime runtime;
    private final ObjectMapper   json;

    private final BlockingQueue<Line> lines = new LinkedBlockingQueue<>();
    private volatile RuntimeHandle handle;

    /**
     * @param agent   agent flavor recorded in result metadata, e.g. "qwen"
     * @param command command line that launches the CLI in stream-json mode
     */
    public TerminalAIWorker(String id, String type, String agent, List<String> command,
                            ProcessRuntime runtime, ObjectMapper objectMapper,
                            ResultStore resultStore) {
        super(id, type, resultStore);
        this.agent   = agent;
        this.command = List.copyOf(command);
        this.runtime = runtime;
        this.json    = objectMapper;
    }

    public String agent() {
        return agent;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Override
    protected void doStart() {
        RuntimeHandle started = runtime.spawnProcess(command);
        this.handle = started;

        Thread reader = new Thread(() -> pump(started), "terminal-reader-" + id());
        reader.setDaemon(true);
        reader.start();
        log.info("Launched {} CLI for worker {}: {}", agent, id(), started.description());
    }

    @Override
    protected void doStop() {
        RuntimeHandle current = handle;
        if (current != null) {
            runtime.terminate(current);
        }
    }

    @Override
    protected void refreshStatus() {
        RuntimeHandle current = handle;
        if (current != null && !current.isAlive()) {
            Integer exit = exitCode(current);
            transitionTo(exit != null && exit == 0 ? WorkerStatus.COMPLETED : WorkerStatus.FAILED);
        }
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    @Override
    protected WorkerResult doExecute(String task, Duration timeout, Instant startedAt) {
        RuntimeHandle current = handle;
        StringBuilder content = new StringBuilder();
        int chunks    = 0;
        int malformed = 0;

        discardStaleOutput();
        try {
            OutputStream stdin = current.stdin();
            stdin.write((task + "\n").getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        } catch (IOException e) {
            return finish(WorkerStatus.FAILED, content, "Could not send task to " + agent + " CLI: "
                    + e.getMessage(), startedAt, chunks, malformed, null, null, timeout);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            Line line;
            try {
                long remaining = deadline - System.nanoTime();
                line = remaining > 0 ? lines.poll(remaining, TimeUnit.NANOSECONDS) : null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                current.destroyForcibly();
                transitionTo(WorkerStatus.FAILED);
                return finish(WorkerStatus.FAILED, content, "Interrupted while waiting for output",
                        startedAt, chunks, malformed, null, null, timeout);
            }

            if (line == null) {
                log.warn("Worker {} timed out after {}s; killing {} CLI", id(), timeout.toSeconds(), agent);
                current.destroyForcibly();
                transitionTo(WorkerStatus.TIMEOUT);
                return finish(WorkerStatus.TIMEOUT, content, "Task timed out after " + timeout.toSeconds() + "s",
                        startedAt, chunks, malformed, null, null, timeout);
            }

            if (line == Line.EOF) {
                return processEnded(current, content, startedAt, chunks, malformed, timeout);
            }

            if (line.text().isBlank()) continue;
            chunks++;

            JsonNode chunk = parse(line.text());
            if (chunk == null) {
                malformed++;
                continue;
            }

            content.append(StreamProtocol.extractContent(chunk));
            Optional<String> marker = StreamProtocol.completionMarker(chunk);
            if (marker.isPresent()) {
                return finish(WorkerStatus.COMPLETED, content, null, startedAt, chunks, malformed,
                        marker.get(), null, timeout);
            }
        }
    }

    /** The stream closed before any completion marker arrived. */
    private WorkerResult processEnded(RuntimeHandle current, StringBuilder content, Instant startedAt,
                                      int chunks, int malformed, Duration timeout) {
        Integer exit = exitCode(current);
        if (isStopRequested()) {
            return finish(WorkerStatus.STOPPED, content, "Worker was stopped during execution",
                    startedAt, chunks, malformed, null, exit, timeout);
        }
        if (exit != null && exit == 0) {
            transitionTo(WorkerStatus.COMPLETED);
            return finish(WorkerStatus.COMPLETED, content, null, startedAt, chunks, malformed,
                    "process_exit", exit, timeout);
        }

        transitionTo(WorkerStatus.FAILED);
        String stderr = current.stderr().strip();
        String error = stderr.isEmpty()
                ? agent + " CLI exited with code " + exit + " before completing"
                : stderr;
        log.warn("Worker {} {} CLI exited with code {} before a completion marker", id(), agent, exit);
        return finish(WorkerStatus.FAILED, content, error, startedAt, chunks, malformed, null, exit, timeout);
    }

    private WorkerResult finish(WorkerStatus status, StringBuilder content, String error, Instant startedAt,
                                int chunks, int malformed, String marker, Integer exitCode, Duration timeout) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("agent",            agent);
        metadata.put("chunks",           chunks);
        metadata.put("malformed_chunks", malformed);
        metadata.put("timeout_seconds",  timeout.toSeconds());
        if (marker != null)   metadata.put("completion_marker", marker);
        if (exitCode != null) metadata.put("exit_code", exitCode);
        return WorkerResult.of(id(), status, content.toString(), error, startedAt, Instant.now(), metadata);
    }

    /** Parse one stdout line; null if it is not a JSON object. */
    private JsonNode parse(String text) {
        try {
            JsonNode node = json.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Skipping non-JSON line from {} CLI: {}", agent, e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Drop lines left over from the previous task (output after its completion
     * marker). An end-of-stream marker is kept so the next read sees it.
     */
    private void discardStaleOutput() {
        List<Line> stale = new ArrayList<>();
        lines.drainTo(stale);
        if (stale.contains(Line.EOF)) {
            lines.add(Line.EOF);
        }
        if (!stale.isEmpty()) {
            log.debug("Discarded {} stale line(s) before new task on worker {}", stale.size(), id());
        }
    }

    /** Reader thread body: stdout lines onto the queue, then EOF. */
    private void pump(RuntimeHandle source) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(source.stdout(), StandardCharsets.UTF_8))) {
            String text;
            while ((text = reader.readLine()) != null) {
                lines.add(new Line(text));
            }
        } catch (IOException e) {
            log.debug("stdout of worker {} closed: {}", id(), e.getMessage());
        } finally {
            lines.add(Line.EOF);
        }
    }

    private static Integer exitCode(RuntimeHandle handle) {
        try {
            return handle.onExit().get(EXIT_CODE_WAIT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (Exception e) {
            log.debug("Exit code unavailable for {}: {}", handle.description(), e.getMessage());
            return null;
        }
    }
}
