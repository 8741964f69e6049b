package com.taskfleet.orchestrator.worker;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Screens container commands before they are exec'd.
 *
 * Checks, in order:
 *   - the command is not blank and not longer than {@link #MAX_COMMAND_LENGTH}
 *   - it contains none of the known destructive or shell-escape patterns
 *   - its first word is on the allowlist
 *
 * A rejected command never reaches the container runtime.
 */
public final class CommandPolicy {

    public static final int MAX_COMMAND_LENGTH = 10_000;

    private static final Set<String> DEFAULT_ALLOWED = Set.of(
            "python", "python3", "pip", "npm", "node", "ls", "cat", "echo",
            "grep", "find", "head", "tail", "wc", "pwd", "cd",
            "mkdir", "touch", "rm", "cp", "mv", "sort", "uniq",
            "cut", "awk", "sed", "git", "pytest", "black", "true", "false", "sleep");

    private static final List<String> DANGEROUS_PATTERNS = List.of(
            "rm -rf /", "mkfs", "dd if=", "> /dev/sd",
            "chmod 000", "chown root:", "curl | sh", "wget | sh",
            "&& rm", "; rm", "| rm", "nc -e", "ncat",
            "/dev/tcp", "/dev/udp", "bind shell", "reverse shell");

    private final Set<String> allowedCommands;

    public CommandPolicy(Set<String> allowedCommands) {
        this.allowedCommands = Set.copyOf(allowedCommands);
    }

    public static CommandPolicy defaults() {
        return new CommandPolicy(DEFAULT_ALLOWED);
    }

    /**
     * @throws InvalidTaskException describing the first rule the command breaks
     */
    public void validate(String command) {
        if (command == null || command.isBlank()) {
            throw new InvalidTaskException("Container task must specify a non-empty command");
        }
        if (command.length() > MAX_COMMAND_LENGTH) {
            throw new InvalidTaskException("Command too long: " + command.length()
                    + " > " + MAX_COMMAND_LENGTH + " characters");
        }

        String lower = command.toLowerCase(Locale.ROOT);
        for (String pattern : DANGEROUS_PATTERNS) {
            if (lower.contains(pattern)) {
                throw new InvalidTaskException("Command contains blocked pattern '" + pattern + "'");
            }
        }

        String program = command.strip().split("\\s+", 2)[0];
        if (!allowedCommands.contains(program)) {
            throw new InvalidTaskException("Command '" + program + "' is not allowed. Allowed commands: "
                    + String.join(", ", new TreeSet<>(allowedCommands)));
        }
    }
}
