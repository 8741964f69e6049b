package com.taskfleet.orchestrator.runtime;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * {@link RuntimeHandle} backed by a {@link java.lang.Process}.
 */
final class LocalProcessHandle implements RuntimeHandle {

    // After exit, give the stderr drain a moment to reach end-of-stream.
    private static final Duration STDERR_SETTLE = Duration.ofMillis(500);

    private final Process         process;
    private final String          description;
    private final StreamCollector stderr;

    LocalProcessHandle(Process process, String description) {
        this.process     = process;
        this.description = description + " (pid " + process.pid() + ")";
        this.stderr      = StreamCollector.start(process.getErrorStream(),
                "stderr-" + process.pid());
    }

    @Override public String       description() { return description; }
    @Override public OutputStream stdin()       { return process.getOutputStream(); }
    @Override public InputStream  stdout()      { return process.getInputStream(); }
    @Override public boolean      isAlive()     { return process.isAlive(); }

    @Override
    public String stderr() {
        return process.isAlive() ? stderr.text() : stderr.await(STDERR_SETTLE);
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return process.onExit().thenApply(Process::exitValue);
    }

    @Override
    public void destroy() {
        process.destroy();
    }

    @Override
    public void destroyForcibly() {
        process.destroyForcibly();
    }
}
