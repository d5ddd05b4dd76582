package com.example.snapshotcache.web;

import com.example.snapshotcache.model.RefreshOutcome;
import com.example.snapshotcache.model.ResourceType;
import com.example.snapshotcache.read.CacheStatus;
import com.example.snapshotcache.read.Freshness;
import com.example.snapshotcache.read.SnapshotFilter;
import com.example.snapshotcache.read.SnapshotReadService;
import com.example.snapshotcache.read.SnapshotView;
import com.example.snapshotcache.refresh.RefreshCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/snapshots")
public class SnapshotController {

    private static final Logger log = LoggerFactory.getLogger(SnapshotController.class);

    private final SnapshotReadService readService;
    private final RefreshCoordinator refreshCoordinator;

    public SnapshotController(SnapshotReadService readService, RefreshCoordinator refreshCoordinator) {
        this.readService = readService;
        this.refreshCoordinator = refreshCoordinator;
    }

    @GetMapping
    public List<CacheStatus> overview() {
        return readService.overview();
    }

    @GetMapping("/{type}")
    public SnapshotView read(
            @PathVariable ResourceType type,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String assignee,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dueBefore,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dueAfter,
            @RequestParam(required = false) Boolean overdue) {
        return readService.read(type, new SnapshotFilter(status, assignee, dueBefore, dueAfter, overdue));
    }

    @GetMapping("/{type}/freshness")
    public Freshness freshness(@PathVariable ResourceType type) {
        return readService.freshness(type);
    }

    /**
     * Runs a refresh on the calling thread. A refresh already in flight for the type
     * answers 202 without starting another one.
     */
    @PostMapping("/{type}/refresh")
    public ResponseEntity<RefreshOutcome> refresh(@PathVariable ResourceType type) {
        log.info("Manual refresh of '{}' requested", type.id());
        RefreshOutcome outcome = refreshCoordinator.refresh(type);
        HttpStatus status = switch (outcome.status()) {
            case SUCCESS -> HttpStatus.OK;
            case ALREADY_IN_PROGRESS -> HttpStatus.ACCEPTED;
            case TRANSIENT_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
            case PERMANENT_FAILURE -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(outcome);
    }
}
