package com.hailmary.api;

import com.hailmary.orchestrator.SourceStatistics;
import com.hailmary.orchestrator.SyncOrchestrator;
import com.hailmary.orchestrator.SyncStatusReport;
import com.hailmary.pipeline.CycleResult;
import com.hailmary.pipeline.PipelineStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only status plus administrative actions for the sync service.
 */
@RestController
@RequestMapping("/api/v1/sync")
@RequiredArgsConstructor
@Slf4j
public class SyncStatusController {

    private final SyncOrchestrator orchestrator;

    /**
     * Per-pipeline state, checkpoint and error counters, plus database and Elasticsearch
     * reachability.  Answers 503 while any of them is unhealthy.
     */
    @GetMapping("/status")
    public ResponseEntity<SyncStatusReport> status() {
        SyncStatusReport report = orchestrator.status();
        return ResponseEntity.status(report.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(report);
    }

    @GetMapping("/sources/{name}")
    public PipelineStatus sourceStatus(@PathVariable String name) {
        return orchestrator.status(name);
    }

    @GetMapping("/stats")
    public List<SourceStatistics> statistics() {
        return orchestrator.statistics();
    }

    @PostMapping("/sources/{name}/reset")
    public ActionResponse resetSource(@PathVariable String name) {
        log.info("Checkpoint reset requested for source '{}'", name);
        orchestrator.resetCheckpoint(name);
        return ActionResponse.of("Checkpoint of '" + name + "' reset, full resync on next cycle");
    }

    @PostMapping("/reset")
    public ActionResponse resetAll() {
        log.info("Checkpoint reset requested for all sources");
        orchestrator.resetAll();
        return ActionResponse.of("All checkpoints reset");
    }

    /**
     * Queues one cycle of the source and answers 202 without waiting for it.  Before the
     * orchestrator is started the cycle runs inline and its outcome is reported.
     */
    @PostMapping("/sources/{name}/trigger")
    public ResponseEntity<ActionResponse> trigger(@PathVariable String name) {
        log.info("Sync cycle requested for source '{}'", name);
        CompletableFuture<CycleResult> cycle = orchestrator.triggerSync(name);
        cycle.thenAccept(result -> log.info("[{}] Requested cycle finished: {}", name, result.getOutcome()));
        String message = cycle.isDone()
                ? "Cycle of '" + name + "' finished: " + cycle.join().getOutcome()
                : "Cycle of '" + name + "' queued";
        return ResponseEntity.accepted().body(ActionResponse.of(message));
    }

    @PostMapping("/full-sync")
    public ActionResponse fullSync() {
        log.info("Full sync requested");
        orchestrator.fullSync();
        return ActionResponse.of("All checkpoints reset and view refreshed");
    }

    @PostMapping("/refresh")
    public ActionResponse refreshView() {
        boolean refreshed = orchestrator.refreshView();
        return ActionResponse.of(refreshed ? "View refreshed" : "View already current");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ActionResponse> handleUnknownSource(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ActionResponse.failure(ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ActionResponse> handleUnavailable(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ActionResponse.failure(ex.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ActionResponse> handleFailure(RuntimeException ex) {
        log.error("Sync action failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ActionResponse.failure(ex.getMessage()));
    }

    @lombok.Data
    @lombok.Builder
    public static class ActionResponse {
        private boolean success;
        private String message;
        private Long timestamp;

        static ActionResponse of(String message) {
            return ActionResponse.builder()
                    .success(true)
                    .message(message)
                    .timestamp(System.currentTimeMillis())
                    .build();
        }

        static ActionResponse failure(String message) {
            return ActionResponse.builder()
                    .success(false)
                    .message(message)
                    .timestamp(System.currentTimeMillis())
                    .build();
        }
    }
}
