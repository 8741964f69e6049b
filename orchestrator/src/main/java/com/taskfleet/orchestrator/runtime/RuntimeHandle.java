package com.taskfleet.orchestrator.runtime;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Opaque handle to a running process, either a local subprocess or a command
 * exec'd inside a container.
 *
 * stdout is left to the caller to consume; stderr is drained in the background
 * so a chatty process can never block on a full pipe.
 */
public interface RuntimeHandle {

    /** Human-readable label for logs (command line, pid). */
    String description();

    OutputStream stdin();

    InputStream stdout();

    /** Everything the process has written to stderr so far. */
    String stderr();

    boolean isAlive();

    /** Completes with the exit code once the process has terminated. */
    CompletableFuture<Integer> onExit();

    /** Ask the process to terminate (SIGTERM on POSIX). */
    void destroy();

    /** Kill the process immediately (SIGKILL on POSIX). Returns without waiting. */
    void destroyForcibly();
}
