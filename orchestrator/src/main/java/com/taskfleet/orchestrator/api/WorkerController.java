package com.taskfleet.orchestrator.api;

import com.taskfleet.orchestrator.api.dto.BatchExecuteRequest;
import com.taskfleet.orchestrator.api.dto.ExecuteRequest;
import com.taskfleet.orchestrator.api.dto.SpawnRequest;
import com.taskfleet.orchestrator.api.dto.SpawnResponse;
import com.taskfleet.orchestrator.model.WorkerHealth;
import com.taskfleet.orchestrator.model.WorkerInfo;
import com.taskfleet.orchestrator.model.WorkerResult;
import com.taskfleet.orchestrator.model.WorkerStatus;
import com.taskfleet.orchestrator.service.WorkerManager;
import com.taskfleet.orchestrator.worker.InvalidTaskException;
import com.taskfleet.orchestrator.worker.LengthMismatchException;
import com.taskfleet.orchestrator.worker.UnknownWorkerTypeException;
import com.taskfleet.orchestrator.worker.WorkerBusyException;
import com.taskfleet.orchestrator.worker.WorkerNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * REST API for the worker pool.
 *
 * POST   /workers                   spawn N workers of a type
 * GET    /workers                   list registered workers
 * GET    /workers/health            gate capacity and worker summary
 * POST   /workers/{id}/execute      run one task (blocks until it finishes)
 * POST   /workers/execute-batch     run tasks[i] on workerIds[i], results in input order
 * GET    /workers/status?ids=       one status snapshot
 * GET    /workers/results?ids=      last result of each worker
 * DELETE /workers/{id}              stop and deregister one worker
 * DELETE /workers                   stop and deregister all workers
 */
@RestController
@RequestMapping("/workers")
public class WorkerController {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private final WorkerManager workerManager;

    public WorkerController(WorkerManager workerManager) {
        this.workerManager = workerManager;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/workers \
     *     -H "Content-Type: application/json" \
     *     -d '{"workerType":"container","count":3}'
     */
    @PostMapping
    public ResponseEntity<SpawnResponse> spawn(@RequestBody SpawnRequest req) {
        List<String> ids = workerManager.spawn(req.workerType(), req.count());
        return ResponseEntity.status(HttpStatus.CREATED).body(new SpawnResponse(req.workerType(), ids));
    }

    @GetMapping
    public List<WorkerInfo> list() {
        return workerManager.listWorkers();
    }

    @GetMapping("/health")
    public WorkerHealth health() {
        return workerManager.health();
    }

    @PostMapping("/{id}/execute")
    public WorkerResult execute(@PathVariable String id, @RequestBody ExecuteRequest req) {
        return workerManager.execute(id, req.task(), timeout(req.timeoutSeconds()));
    }

    @PostMapping("/execute-batch")
    public List<WorkerResult> executeBatch(@RequestBody BatchExecuteRequest req) {
        return workerManager.executeBatch(req.workerIds(), req.tasks(), timeout(req.timeoutSeconds()));
    }

    /** Omitting {@code ids} selects every worker. */
    @GetMapping("/status")
    public Map<String, WorkerStatus> status(@RequestParam(required = false) List<String> ids) {
        return workerManager.snapshot(ids);
    }

    @GetMapping("/results")
    public Map<String, WorkerResult> results(@RequestParam(required = false) List<String> ids) {
        return workerManager.collectResults(ids);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> close(@PathVariable String id) {
        workerManager.close(id);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public Map<String, Integer> closeAll() {
        return Map.of("closedCount", workerManager.closeAll());
    }

    private static Duration timeout(long seconds) {
        if (seconds <= 0) {
            throw new InvalidTaskException("timeoutSeconds must be positive, got " + seconds);
        }
        return Duration.ofSeconds(seconds);
    }

    // ------------------------------------------------------------------
    // Error mapping
    // ------------------------------------------------------------------

    @ExceptionHandler(WorkerNotFoundException.class)
    ResponseEntity<Map<String, String>> notFound(WorkerNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({UnknownWorkerTypeException.class, LengthMismatchException.class, InvalidTaskException.class})
    ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(WorkerBusyException.class)
    ResponseEntity<Map<String, String>> busy(WorkerBusyException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    ResponseEntity<Map<String, String>> unsupported(UnsupportedOperationException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, RuntimeException e) {
        log.debug("Request rejected with {}: {}", status.value(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of(
                "error",   e.getClass().getSimpleName(),
                "message", String.valueOf(e.getMessage())));
    }
}
