package com.taskfleet.orchestrator.terminal;

import java.io.IOException;

/**
 * Reads what a terminal or session is currently showing.
 *
 * The debug monitor depends only on this interface; the capture mechanism
 * (log tail, screen scrape, multiplexer pane dump) is up to the implementation.
 */
public interface TerminalIntrospector {

    /** Whether {@code target} can be captured right now. */
    boolean isAvailable(String target);

    /**
     * The last {@code lines} lines visible on {@code target}, newline-joined.
     *
     * @throws IOException if the target cannot be read
     */
    String capture(String target, int lines) throws IOException;
}
