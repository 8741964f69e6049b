package com.taskfleet.orchestrator.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskfleet.orchestrator.model.WorkerResult;
import com.taskfleet.orchestrator.model.WorkerStatus;
import com.taskfleet.orchestrator.store.ResultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for TerminalAIWorker.
 *
 * The CLI process is a {@link FakeHandle}: each test scripts the stream-json
 * lines it prints in reply to a task and how it exits.
 */
class TerminalAIWorkerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    FakeRuntime runtime;
    FakeHandle  cli;
    ResultStore store;
    TerminalAIWorker worker;

    @BeforeEach
    void setUp() {
        cli     = new FakeHandle();
        runtime = new FakeRuntime().enqueue(cli);
        store   = mock(ResultStore.class);
        worker  = new TerminalAIWorker("terminal-qwen-1", "terminal-qwen", "qwen",
                List.of("qwen", "-o", "stream-json"), runtime, new ObjectMapper(), store);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Test
    void newWorker_isPendingAndLaunchesNothing() {
        assertThat(worker.getStatus()).isEqualTo(WorkerStatus.PENDING);
        assertThat(runtime.spawned).isEmpty();
    }

    @Test
    void start_launchesCommandAndRuns() {
        worker.start();

        assertThat(runtime.spawned).containsExactly(List.of("qwen", "-o", "stream-json"));
        assertThat(worker.getStatus()).isEqualTo(WorkerStatus.RUNNING);
    }

    @Test
    void start_spawnFailure_marksFailedAndRethrows() {
        runtime.failWith(new SpawnException("qwen: not found"));

        assertThatThrownBy(worker::start).isInstanceOf(SpawnException.class);
        assertThat(worker.getStatus()).isEqualTo(WorkerStatus.FAILED);
    }

    @Test
    void execute_spawnFailureOnLazyStart_returnsFailedResult() {
        runtime.failWith(new SpawnException("qwen: not found"));

        WorkerResult result = worker.execute("hello", TIMEOUT);

        assertThat(result.status()).isEqualTo(WorkerStatus.FAILED);
        assertThat(result.error()).contains("not found");
        assertThat(result.metadata()).containsEntry("exception", "SpawnException");
    }

    @Test
    void stop_isIdempotentAndTerminatesProcessOnce() {
        worker.start();

        worker.stop();
        worker.stop();

        assertThat(runtime.terminated).hasSize(1);
        assertThat(worker.getStatus()).isEqualTo(WorkerStatus.STOPPED);
    }

    @Test
    void stop_beforeStart_goesStraightToStopped() {
        worker.stop();

        assertThat(worker.getStatus()).isEqualTo(WorkerStatus.STOPPED);
        assertThat(runtime.spawned).isEmpty();
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    @Test
    void execute_accumulatesDeltaContentUntilFinishReason() {
        cli.onInput(h -> h
                .emit("{\"delta\":{\"content\":\"Hel\"}}")
                .emit("{\"delta\":{\"content\":\"lo\"}}")
                .emit("{\"delta\":{\"content\":\"!\"},\"finish_reason\":\"stop\"}"));

        WorkerResult result = worker.execute("say hello", TIMEOUT);

        assertThat(result.status()).isEqualTo(WorkerStatus.COMPLETED);
        assertThat(result.content()).isEqualTo("Hello!");
        assertThat(result.error()).isNull();
        assertThat(result.metadata())
                .containsEntry("completion_marker", "finish_reason")
                .containsEntry("chunks", 3)
                .containsEntry("agent", "qwen");
        assertThat(cli.stdinText()).isEqualTo("say hello\n");
        // the worker itself stays up for the next task
        assertThat(worker.getStatus()).isEqualTo(WorkerStatus.RUNNING);
    }

    @Test
    void execute_skipsMalformedLines() {
        cli.onInput(h -> h
                .emit("Loading model...")
                .emit("{\"text\":\"answer\"}")
                .emit("[1,2,3]")
                .emit("{\"type\":\"done\"}"));

        WorkerResult result = worker.execute("q", TIMEOUT);

        assertThat(result.status()).isEqualTo(WorkerStatus.COMPLETED);
        assertThat(result.content()).isEqualTo("answer");
        assertThat(result.metadata()).containsEntry("malformed_chunks", 2);
    }

    @Test
    void execute_contentFragmentsAndStatusCompleted() {
        cli.onInput(h -> h
                .emit("{\"content\":[{\"type\":\"text\",\"text\":\"a\"},{\"type\":\"text\",\"text\":\"b\"}]}")
                .emit("{\"status\":\"completed\"}"));

        WorkerResult result = worker.execute("q", TIMEOUT);

        assertThat(result.content()).isEqualTo("ab");
        assertThat(result.metadata()).containsEntry("completion_marker", "status");
    }

    @Test
    void execute_processExitsNonZeroBeforeMarker_returnsFailedWithPartialContent() {
        cli.stderr = "rate limited";
        cli.onInput(h -> {
            h.emit("{\"text\":\"partial\"}");
            h.exit(2);
        });

        WorkerResult result = worker.execute("q", TIMEOUT);

        assertThat(result.status()).isEqualTo(WorkerStatus.FAILED);
        assertThat(result.content()).isEqualTo("partial");
        assertThat(result.error()).isEqualTo("rate limited");
        assertThat(result.metadata()).containsEntry("exit_code", 2);
        assertThat(worker.getStatus()).isEqualTo(WorkerStatus.FAILED);
    }

    @Test
    void execute_processExitsCleanlyWithoutMarker_returnsCompleted() {
        cli.onInput(h -> {
            h.emit("{\"text\":\"all done\"}");
            h.exit(0);
        });

        WorkerResult result = worker.execute("q", TIMEOUT);

        assertThat(result.status()).isEqualTo(WorkerStatus.COMPLETED);
        assertThat(result.content()).isEqualTo("all done");
        assertThat(result.metadata()).containsEntry("completion_marker", "process_exit");
    }

    @Test
    void execute_noMarkerWithinTimeout_returnsTimeoutAndKillsProcess() {
        cli.onInput(h -> h.emit("{\"delta\":{\"content\":\"thinking\"}}"));

        WorkerResult result = worker.execute("q", Duration.ofMillis(300));

        assertThat(result.status()).isEqualTo(WorkerStatus.TIMEOUT);
        assertThat(result.content()).isEqualTo("thinking");
        assertThat(result.error()).contains("timed out");
        assertThat(cli.destroyed).isTrue();
        assertThat(worker.getStatus()).isEqualTo(WorkerStatus.TIMEOUT);
    }

    @Test
    void execute_afterTimeout_returnsFailedWithoutTouchingProcess() {
        worker.execute("q", Duration.ofMillis(200));

        WorkerResult second = worker.execute("again", TIMEOUT);

        assertThat(second.status()).isEqualTo(WorkerStatus.FAILED);
        assertThat(second.error()).contains("not running");
    }

    @Test
    void execute_secondTaskIgnoresOutputLeftFromFirst() {
        cli.onInput(h -> {
            if (h.stdinText().endsWith("second\n")) {
                h.emit("{\"text\":\"two\",\"done\":true}");
            } else {
                h.emit("{\"text\":\"one\",\"done\":true}");
                h.emit("{\"text\":\"trailing noise\"}");
            }
        });

        worker.execute("first", TIMEOUT);
        sleep(100);   // let the trailing line reach the queue
        WorkerResult second = worker.execute("second", TIMEOUT);

        assertThat(second.content()).isEqualTo("two");
    }

    @Test
    void execute_whileAnotherTaskRuns_throwsWorkerBusy() throws Exception {
        CountDownLatch sent = new CountDownLatch(1);
        cli.onInput(h -> sent.countDown());

        CompletableFuture<WorkerResult> first =
                CompletableFuture.supplyAsync(() -> worker.execute("long task", Duration.ofSeconds(2)));
        assertThat(sent.await(2, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> worker.execute("intruder", TIMEOUT))
                .isInstanceOf(WorkerBusyException.class);

        cli.emit("{\"text\":\"ok\",\"done\":true}");
        assertThat(first.get(5, TimeUnit.SECONDS).status()).isEqualTo(WorkerStatus.COMPLETED);
    }

    @Test
    void execute_nonPositiveTimeout_throwsInvalidTask() {
        assertThatThrownBy(() -> worker.execute("q", Duration.ZERO))
                .isInstanceOf(InvalidTaskException.class);
        assertThat(runtime.spawned).isEmpty();
    }

    // ------------------------------------------------------------------
    // Persistence
    // ------------------------------------------------------------------

    @Test
    void execute_storesResultWithExecutionMetadata() {
        cli.onInput(h -> h.emit("{\"text\":\"hi\",\"done\":true}"));

        WorkerResult result = worker.execute("greet", TIMEOUT);

        verify(store).store(eq("terminal-qwen-1"), eq(result), eq(Map.of(
                "type", "worker_execution",
                "worker_type", "terminal-qwen",
                "task_preview", "greet")));
    }

    @Test
    void execute_storeFailure_doesNotAffectResult() {
        doThrow(new IllegalStateException("db down")).when(store).store(any(), any(), anyMap());
        cli.onInput(h -> h.emit("{\"text\":\"hi\",\"done\":true}"));

        WorkerResult result = worker.execute("greet", TIMEOUT);

        assertThat(result.status()).isEqualTo(WorkerStatus.COMPLETED);
        assertThat(worker.lastResult()).contains(result);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
