package com.taskfleet.orchestrator.terminal;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Treats a log file as the terminal: the "visible screen" is its last N lines,
 * which is what {@code tail -f} on that file would be showing.
 */
@Component
public class LogFileIntrospector implements TerminalIntrospector {

    @Override
    public boolean isAvailable(String target) {
        return target != null && !target.isBlank() && Files.isReadable(Path.of(target));
    }

    @Override
    public String capture(String target, int lines) throws IOException {
        return LogTail.lastLines(Path.of(target), lines);
    }
}
