package com.taskfleet.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskfleet.orchestrator.runtime.ProcessRuntime;
import com.taskfleet.orchestrator.store.ResultStore;
import com.taskfleet.orchestrator.terminal.TerminalIntrospector;
import com.taskfleet.orchestrator.worker.CommandPolicy;
import com.taskfleet.orchestrator.worker.ContainerWorker;
import com.taskfleet.orchestrator.worker.DebugMonitorWorker;
import com.taskfleet.orchestrator.worker.DefaultWorkerProvider;
import com.taskfleet.orchestrator.worker.TerminalAIWorker;
import com.taskfleet.orchestrator.worker.WorkerProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Declares one {@link WorkerProvider} per supported worker type.
 *
 * <pre>
 *   terminal-qwen     Qwen CLI in stream-json mode
 *   terminal-claude   Claude CLI in stream-json mode
 *   container         long-lived container, alias container-executor
 *   debug-monitor     passive log watcher
 * </pre>
 */
@Configuration
public class WorkerConfiguration {

    public static final String TERMINAL_QWEN   = "terminal-qwen";
    public static final String TERMINAL_CLAUDE = "terminal-claude";
    public static final String CONTAINER       = "container";
    public static final String DEBUG_MONITOR   = "debug-monitor";

    @Bean
    WorkerProvider qwenWorkerProvider(
            @Value("${taskfleet.terminal.qwen-command:qwen -o stream-json --approval-mode yolo}") String command,
            ProcessRuntime runtime, ObjectMapper objectMapper, ResultStore resultStore) {
        List<String> argv = splitCommand(command);
        return new DefaultWorkerProvider(TERMINAL_QWEN, id ->
                new TerminalAIWorker(id, TERMINAL_QWEN, "qwen", argv, runtime, objectMapper, resultStore));
    }

    @Bean
    WorkerProvider claudeWorkerProvider(
            @Value("${taskfleet.terminal.claude-command:claude --output-format stream-json --permission-mode acceptEdits}")
            String command,
            ProcessRuntime runtime, ObjectMapper objectMapper, ResultStore resultStore) {
        List<String> argv = splitCommand(command);
        return new DefaultWorkerProvider(TERMINAL_CLAUDE, id ->
                new TerminalAIWorker(id, TERMINAL_CLAUDE, "claude", argv, runtime, objectMapper, resultStore));
    }

    @Bean
    WorkerProvider containerWorkerProvider(
            @Value("${taskfleet.container.runtime:docker}") String containerRuntime,
            @Value("${taskfleet.container.image:python:3.13-slim}") String image,
            @Value("${taskfleet.container.start-timeout:60s}") Duration startTimeout,
            ProcessRuntime runtime, ResultStore resultStore) {
        ContainerWorker.Settings settings = new ContainerWorker.Settings(containerRuntime, image, startTimeout);
        CommandPolicy policy = CommandPolicy.defaults();
        return new DefaultWorkerProvider(CONTAINER, List.of("container-executor"), id ->
                new ContainerWorker(id, CONTAINER, settings, runtime, policy, resultStore));
    }

    @Bean
    WorkerProvider debugMonitorWorkerProvider(
            @Value("${taskfleet.debug.log-path:logs/taskfleet-debug.log}") String logPath,
            @Value("${taskfleet.debug.capture-interval:1s}") Duration captureInterval,
            @Value("${taskfleet.debug.capture-lines:100}") int captureLines,
            TerminalIntrospector introspector, ResultStore resultStore) {
        return new DefaultWorkerProvider(DEBUG_MONITOR, id ->
                new DebugMonitorWorker(id, DEBUG_MONITOR, logPath, introspector,
                        captureInterval, captureLines, resultStore));
    }

    /** Whitespace split; command templates carry no quoted arguments. */
    static List<String> splitCommand(String command) {
        return Arrays.stream(command.strip().split("\\s+"))
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
