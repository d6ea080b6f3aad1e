package com.disasterfeed.sync.config;

import com.disasterfeed.sync.model.SyncRun;
import com.disasterfeed.sync.scheduler.SyncScheduler;
import com.disasterfeed.sync.scheduler.SyncStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class SyncController {

    private final SyncScheduler scheduler;

    // ── Sync triggers ─────────────────────────────────────────────────────────

    @PostMapping("/sync/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (scheduler.triggerNow()) {
            return ResponseEntity.accepted().body(Map.of("status", "accepted"));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("status", "busy", "state", scheduler.getState().name()));
    }

    // ── Status ────────────────────────────────────────────────────────────────

    @GetMapping("/sync/status")
    public ResponseEntity<SyncStatus> status() {
        return ResponseEntity.ok(scheduler.status());
    }

    /**
     * Report of the most recent completed cycle.
     *
     * GET /sync/runs/last -> 204 until the first cycle has finished
     */
    @GetMapping("/sync/runs/last")
    public ResponseEntity<SyncRun> lastRun() {
        SyncRun run = scheduler.status().lastRun();
        return run == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(run);
    }
}
