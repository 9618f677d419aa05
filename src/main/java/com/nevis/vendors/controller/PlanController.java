package com.nevis.vendors.controller;

import com.nevis.vendors.service.PlanRunService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/plans")
@RequiredArgsConstructor
public class PlanController {

    private final PlanRunService planRunService;

    @PostMapping
    public ResponseEntity<PlanAcceptedResponse> startPlan(@Valid @RequestBody PlanRequest request) {
        var run = planRunService.start(request.toCommand());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(new PlanAcceptedResponse(run.getRunId(), run.getStatus()));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<RunStatusResponse> getPlan(@PathVariable UUID runId) {
        return ResponseEntity.ok(RunStatusResponse.from(planRunService.get(runId)));
    }

    @DeleteMapping("/{runId}")
    public ResponseEntity<RunStatusResponse> cancelPlan(@PathVariable UUID runId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(RunStatusResponse.from(planRunService.cancel(runId)));
    }
}
