package com.taskfleet.orchestrator.api;

import com.taskfleet.orchestrator.model.WorkerHealth;
import com.taskfleet.orchestrator.model.WorkerInfo;
import com.taskfleet.orchestrator.model.WorkerResult;
import com.taskfleet.orchestrator.model.WorkerStatus;
import com.taskfleet.orchestrator.service.WorkerManager;
import com.taskfleet.orchestrator.worker.LengthMismatchException;
import com.taskfleet.orchestrator.worker.UnknownWorkerTypeException;
import com.taskfleet.orchestrator.worker.WorkerBusyException;
import com.taskfleet.orchestrator.worker.WorkerNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for WorkerController.
 *
 * @WebMvcTest spins up only the web layer (no DB, no processes, no containers).
 * WorkerManager is replaced by a mock.
 */
@WebMvcTest(WorkerController.class)
class WorkerControllerTest {

    @Autowired MockMvc        mockMvc;
    @MockitoBean WorkerManager workerManager;

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    // ------------------------------------------------------------------
    // POST /workers
    // ------------------------------------------------------------------

    @Test
    void spawn_validRequest_returns201WithIds() throws Exception {
        when(workerManager.spawn("container", 2)).thenReturn(List.of("container-1a2b3c4d", "container-5e6f7a8b"));

        mockMvc.perform(post("/workers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerType":"container","count":2}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.workerIds.length()").value(2))
                .andExpect(jsonPath("$.workerIds[0]").value("container-1a2b3c4d"));
    }

    @Test
    void spawn_countOmitted_defaultsToOne() throws Exception {
        when(workerManager.spawn("terminal-qwen", 1)).thenReturn(List.of("terminal-qwen-00000001"));

        mockMvc.perform(post("/workers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerType":"terminal-qwen"}
                                """))
                .andExpect(status().isCreated());
        verify(workerManager).spawn("terminal-qwen", 1);
    }

    @Test
    void spawn_unknownType_returns400() throws Exception {
        when(workerManager.spawn(eq("terminal-gpt"), anyInt()))
                .thenThrow(new UnknownWorkerTypeException("terminal-gpt", List.of("container")));

        mockMvc.perform(post("/workers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerType":"terminal-gpt","count":1}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UnknownWorkerTypeException"));
    }

    // ------------------------------------------------------------------
    // POST /workers/{id}/execute
    // ------------------------------------------------------------------

    @Test
    void execute_returnsResultInWireForm() throws Exception {
        WorkerResult result = WorkerResult.of("container-1", WorkerStatus.COMPLETED, "hello\n", null,
                START, START.plusSeconds(1), Map.of("exit_code", 0));
        when(workerManager.execute("container-1", "echo hello", Duration.ofSeconds(300))).thenReturn(result);

        mockMvc.perform(post("/workers/{id}/execute", "container-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"task":"echo hello"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.worker_id").value("container-1"))
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.content").value("hello\n"))
                .andExpect(jsonPath("$.duration_seconds").value(1.0))
                .andExpect(jsonPath("$.metadata.exit_code").value(0));
    }

    @Test
    void execute_unknownWorker_returns404() throws Exception {
        when(workerManager.execute(eq("ghost"), any(), any())).thenThrow(new WorkerNotFoundException("ghost"));

        mockMvc.perform(post("/workers/{id}/execute", "ghost")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"task":"ls","timeoutSeconds":10}
                                """))
                .andExpect(status().isNotFound());
    }

    @Test
    void execute_busyWorker_returns409() throws Exception {
        when(workerManager.execute(eq("w-1"), any(), any())).thenThrow(new WorkerBusyException("w-1"));

        mockMvc.perform(post("/workers/{id}/execute", "w-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"task":"ls"}
                                """))
                .andExpect(status().isConflict());
    }

    @Test
    void execute_monitorWorker_returns422() throws Exception {
        when(workerManager.execute(eq("debug-monitor-1"), any(), any()))
                .thenThrow(new UnsupportedOperationException("does not execute tasks"));

        mockMvc.perform(post("/workers/{id}/execute", "debug-monitor-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"task":"ls"}
                                """))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void execute_nonPositiveTimeout_returns400() throws Exception {
        mockMvc.perform(post("/workers/{id}/execute", "w-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"task":"ls","timeoutSeconds":0}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // POST /workers/execute-batch
    // ------------------------------------------------------------------

    @Test
    void executeBatch_returnsResultsInOrder() throws Exception {
        List<WorkerResult> results = List.of(
                WorkerResult.of("w-1", WorkerStatus.COMPLETED, "a", null, START, START, Map.of()),
                WorkerResult.failure("w-2", "exit 1", START, Map.of()));
        when(workerManager.executeBatch(List.of("w-1", "w-2"), List.of("ls", "false"), Duration.ofSeconds(60)))
                .thenReturn(results);

        mockMvc.perform(post("/workers/execute-batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerIds":["w-1","w-2"],"tasks":["ls","false"],"timeoutSeconds":60}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].worker_id").value("w-1"))
                .andExpect(jsonPath("$[1].status").value("failed"));
    }

    @Test
    void executeBatch_lengthMismatch_returns400() throws Exception {
        when(workerManager.executeBatch(anyList(), anyList(), any()))
                .thenThrow(new LengthMismatchException(2, 1));

        mockMvc.perform(post("/workers/execute-batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workerIds":["w-1","w-2"],"tasks":["ls"]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("LengthMismatchException"));
    }

    // ------------------------------------------------------------------
    // GET endpoints
    // ------------------------------------------------------------------

    @Test
    void status_returnsLowerCaseStatuses() throws Exception {
        Map<String, WorkerStatus> snapshot = new LinkedHashMap<>();
        snapshot.put("w-1", WorkerStatus.RUNNING);
        snapshot.put("w-2", WorkerStatus.TIMEOUT);
        when(workerManager.snapshot(List.of("w-1", "w-2"))).thenReturn(snapshot);

        mockMvc.perform(get("/workers/status").param("ids", "w-1", "w-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['w-1']").value("running"))
                .andExpect(jsonPath("$['w-2']").value("timeout"));
    }

    @Test
    void list_returnsRegisteredWorkers() throws Exception {
        when(workerManager.listWorkers()).thenReturn(List.of(
                new WorkerInfo("container-1", "container", WorkerStatus.PENDING)));

        mockMvc.perform(get("/workers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].worker_type").value("container"))
                .andExpect(jsonPath("$[0].status").value("pending"));
    }

    @Test
    void health_returnsGateCapacity() throws Exception {
        when(workerManager.health()).thenReturn(new WorkerHealth("healthy", 0, 10, 10, false, false, List.of()));

        mockMvc.perform(get("/workers/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.max_concurrent").value(10))
                .andExpect(jsonPath("$.available_slots").value(10));
    }

    // ------------------------------------------------------------------
    // DELETE
    // ------------------------------------------------------------------

    @Test
    void close_returns204() throws Exception {
        mockMvc.perform(delete("/workers/{id}", "w-1"))
                .andExpect(status().isNoContent());
        verify(workerManager).close("w-1");
    }

    @Test
    void close_unknownWorker_returns404() throws Exception {
        doThrow(new WorkerNotFoundException("ghost")).when(workerManager).close("ghost");

        mockMvc.perform(delete("/workers/{id}", "ghost"))
                .andExpect(status().isNotFound());
    }

    @Test
    void closeAll_returnsCount() throws Exception {
        when(workerManager.closeAll()).thenReturn(3);

        mockMvc.perform(delete("/workers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.closedCount").value(3));
    }
}
