package com.di.bqindexer.controller;

import com.di.bqindexer.indexer.IndexRunReport;
import com.di.bqindexer.indexer.IndexerRunnerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runs the indexer on demand when the service is not in run-on-startup mode.
 * <ul>
 *   <li>{@code POST /api/indexer/runs}: runs the whole job synchronously and returns its report
 *       (409 while another run is active)</li>
 *   <li>{@code GET /api/indexer/runs/last}: report of the last finished run, 404 if none</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/indexer/runs")
@RequiredArgsConstructor
public class IndexerController {

    private final IndexerRunnerService runnerService;

    @PostMapping
    public ResponseEntity<IndexRunReport> run() {
        log.info("[RUN] run requested over HTTP");
        return ResponseEntity.ok(runnerService.run());
    }

    @GetMapping("/last")
    public ResponseEntity<IndexRunReport> last() {
        return runnerService.getLastReport()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
