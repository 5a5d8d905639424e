package com.jay.marketpulse.controller;

import com.jay.marketpulse.layer4_pipeline.PipelineRunner;
import com.jay.marketpulse.layer4_pipeline.TriggerResult;
import com.jay.marketpulse.layer5_status.StatusRecord;
import com.jay.marketpulse.layer5_status.StatusStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API: pipeline progress and manual trigger.
 *
 * Endpoints:
 *   GET  /api/pipeline-status         latest StatusRecord (idle when none)
 *   POST /api/run-pipeline?fast=      start a run: started | busy | skipped
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PipelineController {

    private final StatusStore statusStore;
    private final PipelineRunner pipelineRunner;

    @GetMapping("/pipeline-status")
    public ResponseEntity<StatusRecord> pipelineStatus() {
        return ResponseEntity.ok(statusStore.latest());
    }

    @PostMapping("/run-pipeline")
    public ResponseEntity<Map<String, Object>> runPipeline(@RequestParam(defaultValue = "false") boolean fast) {
        TriggerResult result = pipelineRunner.triggerManual(fast);
        return ResponseEntity.ok(Map.of(
            "status", result.wireValue(),
            "fast", fast,
            "stages", pipelineRunner.stageNames()
        ));
    }
}
