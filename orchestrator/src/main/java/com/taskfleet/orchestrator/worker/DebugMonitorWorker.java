package com.taskfleet.orchestrator.worker;

import com.taskfleet.orchestrator.model.WorkerResult;
import com.taskfleet.orchestrator.model.WorkerStatus;
import com.taskfleet.orchestrator.store.ResultStore;
import com.taskfleet.orchestrator.terminal.LogTail;
import com.taskfleet.orchestrator.terminal.TerminalIntrospector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Passive observer of a terminal session. It never runs tasks.
 *
 * Once started, it captures the last {@code captureLines} lines of its target
 * every {@code captureInterval} and, when the text changed since the previous
 * capture, forwards it to the result store as a {@code debug_log} entry.
 *
 * Start never fails on a missing collaborator. Without a usable introspector
 * or result store the monitor runs in {@link CaptureMode#LOCAL_ONLY}: it tails
 * the target file directly and keeps the most recent captures in memory.
 */
public class DebugMonitorWorker extends AbstractWorker {

    private static final Logger log = LoggerFactory.getLogger(DebugMonitorWorker.class);

    static final int RECENT_CAPTURES = 20;

    public enum CaptureMode { FORWARDING, LOCAL_ONLY }

    private final String               target;
    private final TerminalIntrospector introspector;   // may be null
    private final Duration             captureInterval;
    private final int                  captureLines;

    private final Deque<String> recent = new ArrayDeque<>();
    private final AtomicLong    captures = new AtomicLong();

    private volatile CaptureMode              mode = CaptureMode.LOCAL_ONLY;
    private volatile ScheduledExecutorService scheduler;
    private String                            previous;   // only touched by the scheduler thread

    public DebugMonitorWorker(String id, String type, String target, TerminalIntrospector introspector,
                              Duration captureInterval, int captureLines, ResultStore resultStore) {
        super(id, type, resultStore);
        this.target          = target;
        this.introspector    = introspector;
        this.captureInterval = captureInterval;
        this.captureLines    = captureLines;
    }

    public String target() {
        return target;
    }

    public CaptureMode mode() {
        return mode;
    }

    /** Number of distinct captures taken since start. */
    public long captureCount() {
        return captures.get();
    }

    /** Most recent captures, oldest first. */
    public List<String> recentCaptures() {
        synchronized (recent) {
            return List.copyOf(recent);
        }
    }

    /** Always throws: a monitor only observes. */
    @Override
    public WorkerResult execute(String task, Duration timeout) {
        throw new UnsupportedOperationException("Worker " + id() + " (" + type() + ") does not execute tasks");
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Override
    protected void doStart() {
        boolean canCapture = introspector != null && introspector.isAvailable(target);
        mode = canCapture && resultStore() != null ? CaptureMode.FORWARDING : CaptureMode.LOCAL_ONLY;
        if (mode == CaptureMode.LOCAL_ONLY) {
            log.warn("Debug monitor {} on {} running local-only (introspector {}, result store {})",
                    id(), target,
                    canCapture ? "available" : "unavailable",
                    resultStore() != null ? "available" : "unavailable");
        }

        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "debug-monitor-" + id());
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::captureOnce, 0, captureInterval.toMillis(), TimeUnit.MILLISECONDS);
        scheduler = executor;
        log.info("Debug monitor {} watching {} every {}ms ({})", id(), target, captureInterval.toMillis(), mode);
    }

    @Override
    protected WorkerResult doExecute(String task, Duration timeout, Instant startedAt) {
        throw new UnsupportedOperationException("Worker " + id() + " (" + type() + ") does not execute tasks");
    }

    @Override
    protected void doStop() {
        ScheduledExecutorService current = scheduler;
        if (current != null) {
            current.shutdownNow();
        }
        log.info("Debug monitor {} stopped after {} capture(s)", id(), captures.get());
    }

    // ------------------------------------------------------------------
    // Capture loop
    // ------------------------------------------------------------------

    /** One capture tick. Never throws, so the schedule keeps running. */
    void captureOnce() {
        String text;
        try {
            text = capture();
        } catch (IOException | RuntimeException e) {
            log.warn("Debug monitor {} could not capture {}: {}", id(), target, e.getMessage());
            return;
        }
        if (text == null || text.isBlank() || text.equals(previous)) {
            return;
        }
        previous = text;
        long count = captures.incrementAndGet();

        synchronized (recent) {
            recent.addLast(text);
            while (recent.size() > RECENT_CAPTURES) recent.removeFirst();
        }

        if (mode == CaptureMode.FORWARDING) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("type",       "debug_log");
            metadata.put("source",     "debug_monitor");
            metadata.put("target",     target);
            metadata.put("capture",    count);
            persist(new WorkerResult(id(), WorkerStatus.RUNNING, text, null,
                    Instant.now(), null, 0.0, Map.of()), metadata);
        }
        if (count % 60 == 0) {
            log.debug("Debug monitor {} has taken {} captures of {}", id(), count, target);
        }
    }

    private String capture() throws IOException {
        if (mode == CaptureMode.FORWARDING) {
            return introspector.capture(target, captureLines);
        }
        Path file = Path.of(target);
        return Files.isReadable(file) ? LogTail.lastLines(file, captureLines) : null;
    }
}
